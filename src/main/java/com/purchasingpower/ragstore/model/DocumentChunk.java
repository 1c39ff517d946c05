package com.purchasingpower.ragstore.model;

import com.purchasingpower.ragstore.model.metadata.MetadataValue;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The atomic retrievable unit: text, open metadata and an optional embedding.
 */
@Value
@Builder(toBuilder = true)
public class DocumentChunk {
    String docId;
    String indexName;
    String content;
    Map<String, MetadataValue> metadata;
    List<Double> embedding;
    Instant createdAt;
    Instant updatedAt;

    public boolean hasEmbedding() {
        return embedding != null && !embedding.isEmpty();
    }
}
