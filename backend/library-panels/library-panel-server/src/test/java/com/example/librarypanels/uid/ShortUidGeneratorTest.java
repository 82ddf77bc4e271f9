package com.example.librarypanels.uid;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ShortUidGenerator Tests")
class ShortUidGeneratorTest {

    private final ShortUidGenerator generator = new ShortUidGenerator();

    @Test
    @DisplayName("Should produce short identifiers from the URL-safe alphabet")
    void shouldProduceUrlSafeIdentifiers() {
        String uid = generator.generate();

        assertThat(uid).hasSize(ShortUidGenerator.LENGTH);
        assertThat(uid.chars()).allMatch(c -> ShortUidGenerator.ALPHABET.indexOf(c) >= 0);
    }

    @Test
    @DisplayName("Should not repeat identifiers across a thousand draws")
    void shouldProduceDistinctIdentifiers() {
        Set<String> uids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            uids.add(generator.generate());
        }
        assertThat(uids).hasSize(1000);
    }
}
