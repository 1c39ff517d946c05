package com.purchasingpower.ragstore.model;

/**
 * Retrieval strategies available to the search engine.
 */
public enum SearchMode {
    /**
     * Cosine similarity only.
     */
    VECTOR,

    /**
     * Normalized vector similarity fused with keyword overlap.
     */
    HYBRID,

    /**
     * Hybrid ranking widened with one-hop relationship neighbours.
     */
    GRAPH
}
