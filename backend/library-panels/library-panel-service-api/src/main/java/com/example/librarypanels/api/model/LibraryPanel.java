package com.example.librarypanels.api.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDateTime;

/**
 * LibraryPanel DTO - API contract for library panel data exchange. This is a pure data transfer
 * object without any database annotations. The model is the panel's visual definition and is
 * passed through untouched.
 */
public record LibraryPanel(
    Long id,
    Long orgId,
    Long folderId,
    String uid,
    String name,
    JsonNode model,
    LocalDateTime created,
    LocalDateTime updated,
    Long createdBy,
    Long updatedBy) {}
