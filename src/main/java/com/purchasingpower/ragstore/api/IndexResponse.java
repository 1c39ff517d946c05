package com.purchasingpower.ragstore.api;

import com.purchasingpower.ragstore.model.RagIndex;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexResponse {

    private String name;
    private int dimension;
    private String description;
    private Instant createdAt;
    private Instant updatedAt;

    public static IndexResponse from(RagIndex index) {
        return IndexResponse.builder()
            .name(index.getName())
            .dimension(index.getDimension())
            .description(index.getDescription())
            .createdAt(index.getCreatedAt())
            .updatedAt(index.getUpdatedAt())
            .build();
    }
}
