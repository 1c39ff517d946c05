package com.purchasingpower.ragstore.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.ragstore.model.metadata.MetadataValue;
import com.purchasingpower.ragstore.search.RankedChunk;
import com.purchasingpower.ragstore.search.SearchResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResponse {

    @Builder.Default
    private List<Chunk> chunks = new ArrayList<>();

    private String answer;

    public static SearchResponse from(SearchResult result) {
        List<Chunk> chunks = new ArrayList<>();
        for (RankedChunk ranked : result.getChunks()) {
            chunks.add(Chunk.builder()
                .docId(ranked.getChunk().getDocId())
                .content(ranked.getChunk().getContent())
                .metadata(ranked.getChunk().getMetadata())
                .score(ranked.getScore())
                .build());
        }
        return SearchResponse.builder()
            .chunks(chunks)
            .answer(result.getAnswer())
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Chunk {
        private String docId;
        private String content;
        private Map<String, MetadataValue> metadata;
        private double score;
    }
}
