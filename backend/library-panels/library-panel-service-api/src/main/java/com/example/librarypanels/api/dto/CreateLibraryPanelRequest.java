package com.example.librarypanels.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

public record CreateLibraryPanelRequest(long folderId, String name, JsonNode model) {}
