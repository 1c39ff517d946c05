package com.purchasingpower.ragstore.storage.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.ragstore.model.metadata.MetadataValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts chunk metadata to and from the {@code metadata_json} node property.
 * Neo4j properties cannot hold maps, so the whole tree is stored as one string.
 */
class MetadataJsonCodec {

    private static final TypeReference<LinkedHashMap<String, MetadataValue>> METADATA_TYPE =
        new TypeReference<>() {
        };

    private final ObjectMapper objectMapper;

    MetadataJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    String write(Map<String, MetadataValue> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata != null ? metadata : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Metadata is not serializable", e);
        }
    }

    Map<String, MetadataValue> read(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return Collections.unmodifiableMap(objectMapper.readValue(json, METADATA_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored metadata_json is not valid JSON", e);
        }
    }
}
