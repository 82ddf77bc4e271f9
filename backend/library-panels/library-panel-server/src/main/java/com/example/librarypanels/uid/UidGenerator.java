package com.example.librarypanels.uid;

/**
 * Produces the external identifier of a new library panel. Collisions are not prevented here;
 * they surface as a uniqueness violation when the panel is stored.
 */
@FunctionalInterface
public interface UidGenerator {
    String generate();
}
