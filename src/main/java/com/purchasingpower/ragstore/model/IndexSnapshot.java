package com.purchasingpower.ragstore.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Consistent view of one index, its chunks and its edges, read in a single
 * store transaction.
 */
@Value
@Builder
public class IndexSnapshot {
    RagIndex index;
    List<DocumentChunk> chunks;
    List<RelationshipEdge> relationships;
}
