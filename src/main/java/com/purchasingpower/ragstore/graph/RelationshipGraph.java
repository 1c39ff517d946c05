package com.purchasingpower.ragstore.graph;

import com.purchasingpower.ragstore.model.IndexAnalytics;
import com.purchasingpower.ragstore.model.RelationshipEdge;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Typed, directed edges between chunks of one index.
 */
public interface RelationshipGraph {

    /**
     * Declare {@code source -[relType]-> target}. Declaring an existing edge
     * again only refreshes its reason.
     *
     * @param relType upper-case identifier, e.g. {@code REFERENCES}
     */
    CompletableFuture<RelationshipEdge> declareRelationship(String indexName, String sourceDocId,
                                                            String targetDocId, String relType, String reason);

    CompletableFuture<Void> deleteRelationship(String indexName, String sourceDocId,
                                               String targetDocId, String relType);

    /**
     * Edges of the index in creation order; when {@code docId} is given only
     * the edges touching that chunk.
     */
    CompletableFuture<List<RelationshipEdge>> listRelationships(String indexName, String docId);

    /**
     * Chunk and edge counts, edge counts per type and a small sample of edges.
     */
    CompletableFuture<IndexAnalytics> analytics(String indexName);
}
