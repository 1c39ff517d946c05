package com.purchasingpower.ragstore.search;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One search request against a single index.
 */
@Value
@Builder
public class SearchQuery {
    String indexName;
    String query;

    /**
     * Explicit keyword terms; when empty the query text is tokenized instead.
     */
    List<String> keywords;

    int topK;

    /**
     * Precomputed query vector. When null the query text is embedded.
     */
    List<Double> embedding;

    /**
     * Deadline in milliseconds; null uses the configured default.
     */
    Long timeoutMs;
}
