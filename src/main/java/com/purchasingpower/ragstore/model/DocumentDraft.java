package com.purchasingpower.ragstore.model;

import com.purchasingpower.ragstore.model.metadata.MetadataValue;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Caller input for a new chunk. A null embedding asks the store to compute one.
 */
@Value
@Builder
public class DocumentDraft {
    String content;
    Map<String, MetadataValue> metadata;
    List<Double> embedding;
}
