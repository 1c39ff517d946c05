package com.purchasingpower.ragstore.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class IndexAnalytics {
    String indexName;
    long chunkCount;
    long relationshipCount;
    Map<String, Long> relationshipTypes;
    List<RelationshipEdge> sampleRelationships;
}
