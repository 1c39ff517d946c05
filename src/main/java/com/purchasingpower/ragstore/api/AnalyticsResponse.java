package com.purchasingpower.ragstore.api;

import com.purchasingpower.ragstore.model.IndexAnalytics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsResponse {

    private String indexName;
    private long chunkCount;
    private long relationshipCount;
    private Map<String, Long> relationshipTypes;
    private List<RelationshipResponse> sampleRelationships;

    public static AnalyticsResponse from(IndexAnalytics analytics) {
        return AnalyticsResponse.builder()
            .indexName(analytics.getIndexName())
            .chunkCount(analytics.getChunkCount())
            .relationshipCount(analytics.getRelationshipCount())
            .relationshipTypes(analytics.getRelationshipTypes())
            .sampleRelationships(analytics.getSampleRelationships().stream()
                .map(RelationshipResponse::from)
                .toList())
            .build();
    }
}
