package com.purchasingpower.ragstore.api;

import com.purchasingpower.ragstore.model.RelationshipEdge;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelationshipResponse {

    private String indexName;
    private String sourceDocId;
    private String targetDocId;
    private String relType;
    private String reason;
    private Instant createdAt;
    private Instant updatedAt;

    public static RelationshipResponse from(RelationshipEdge edge) {
        return RelationshipResponse.builder()
            .indexName(edge.getIndexName())
            .sourceDocId(edge.getSourceDocId())
            .targetDocId(edge.getTargetDocId())
            .relType(edge.getRelType())
            .reason(edge.getReason())
            .createdAt(edge.getCreatedAt())
            .updatedAt(edge.getUpdatedAt())
            .build();
    }
}
