package com.example.librarypanels.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Partial update of a library panel. A zero folder id, an empty name or a missing model leave the
 * stored value in place.
 */
public record PatchLibraryPanelRequest(long folderId, String name, JsonNode model) {

  public boolean hasModel() {
    return model != null && !model.isNull();
  }
}
