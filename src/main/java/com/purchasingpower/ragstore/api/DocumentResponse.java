package com.purchasingpower.ragstore.api;

import com.purchasingpower.ragstore.model.DocumentChunk;
import com.purchasingpower.ragstore.model.metadata.MetadataValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

    private String docId;
    private String indexName;
    private String content;
    private Map<String, MetadataValue> metadata;
    private List<Double> embedding;
    private Instant createdAt;
    private Instant updatedAt;

    public static DocumentResponse from(DocumentChunk chunk) {
        return DocumentResponse.builder()
            .docId(chunk.getDocId())
            .indexName(chunk.getIndexName())
            .content(chunk.getContent())
            .metadata(chunk.getMetadata())
            .embedding(chunk.getEmbedding())
            .createdAt(chunk.getCreatedAt())
            .updatedAt(chunk.getUpdatedAt())
            .build();
    }
}
