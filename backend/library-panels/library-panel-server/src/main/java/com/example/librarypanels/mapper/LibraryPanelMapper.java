package com.example.librarypanels.mapper;

import com.example.librarypanels.api.model.LibraryPanel;
import com.example.librarypanels.model.LibraryPanelEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Converts between the LibraryPanel DTO and LibraryPanelEntity. The model travels as a JSON tree
 * in the API and as JSON text in storage; its content is never inspected.
 */
@Component
public class LibraryPanelMapper {

    private final ObjectMapper objectMapper;

    public LibraryPanelMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public LibraryPanel toDto(LibraryPanelEntity entity) {
        if (entity == null) {
            return null;
        }
        return new LibraryPanel(
                entity.getId(),
                entity.getOrgId(),
                entity.getFolderId(),
                entity.getUid(),
                entity.getName(),
                readModel(entity.getModel()),
                entity.getCreated(),
                entity.getUpdated(),
                entity.getCreatedBy(),
                entity.getUpdatedBy()
        );
    }

    /** JSON text for the model column; {@code null} when the caller sent no model. */
    public String writeModel(JsonNode model) {
        if (model == null || model.isNull()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(model);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Library panel model cannot be serialized", e);
        }
    }

    public JsonNode readModel(String model) {
        if (model == null) {
            return null;
        }
        try {
            return objectMapper.readTree(model);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored library panel model is not valid JSON", e);
        }
    }
}
