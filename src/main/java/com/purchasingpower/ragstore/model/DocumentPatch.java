package com.purchasingpower.ragstore.model;

import com.purchasingpower.ragstore.model.metadata.MetadataValue;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Partial chunk update; null fields are left untouched.
 *
 * <p>{@code metadata} replaces the whole mapping when present.
 */
@Value
@Builder
public class DocumentPatch {
    String content;
    Map<String, MetadataValue> metadata;
    List<Double> embedding;

    public boolean isEmpty() {
        return content == null && metadata == null && embedding == null;
    }
}
