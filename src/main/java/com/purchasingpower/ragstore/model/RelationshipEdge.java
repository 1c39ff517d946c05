package com.purchasingpower.ragstore.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Typed, directed link between two chunks of the same index.
 *
 * <p>Identity is {@code (indexName, sourceDocId, targetDocId, relType)};
 * the reason is a mutable annotation on the edge.
 */
@Value
@Builder(toBuilder = true)
public class RelationshipEdge {
    String indexName;
    String sourceDocId;
    String targetDocId;
    String relType;
    String reason;
    Instant createdAt;
    Instant updatedAt;

    public boolean touches(String docId) {
        return sourceDocId.equals(docId) || targetDocId.equals(docId);
    }

    public boolean sameKey(String source, String target, String type) {
        return sourceDocId.equals(source) && targetDocId.equals(target) && relType.equals(type);
    }
}
