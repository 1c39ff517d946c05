package com.purchasingpower.ragstore.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Search request. {@code top_k} defaults to {@code app.search.default-top-k}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

    @NotBlank
    private String indexName;

    @NotBlank
    private String query;

    private List<String> keywords;
    private Integer topK;
    private List<Double> embedding;
    private Long timeoutMs;
}
