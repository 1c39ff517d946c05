package com.purchasingpower.ragstore.graph.impl;

import com.purchasingpower.ragstore.configuration.AppProperties;
import com.purchasingpower.ragstore.configuration.AsyncConfig;
import com.purchasingpower.ragstore.exception.ValidationException;
import com.purchasingpower.ragstore.graph.RelationshipGraph;
import com.purchasingpower.ragstore.model.IndexAnalytics;
import com.purchasingpower.ragstore.model.RelationshipEdge;
import com.purchasingpower.ragstore.storage.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;

@Slf4j
@Service
public class RelationshipGraphImpl implements RelationshipGraph {

    private static final Pattern REL_TYPE = Pattern.compile("[A-Z][A-Z0-9_]*");

    private final DocumentStore store;
    private final Executor storeExecutor;
    private final int sampleSize;

    public RelationshipGraphImpl(DocumentStore store,
                                 AppProperties props,
                                 @Qualifier(AsyncConfig.STORE_EXECUTOR) Executor storeExecutor) {
        this.store = store;
        this.storeExecutor = storeExecutor;
        this.sampleSize = props.getGraph().getAnalyticsSampleSize();
    }

    @Override
    public CompletableFuture<RelationshipEdge> declareRelationship(String indexName, String sourceDocId,
                                                                   String targetDocId, String relType,
                                                                   String reason) {
        try {
            validateEndpoints(sourceDocId, targetDocId);
            validateRelType(relType);
        } catch (ValidationException e) {
            return CompletableFuture.failedFuture(e);
        }

        Instant now = Instant.now();
        RelationshipEdge edge = RelationshipEdge.builder()
            .indexName(indexName)
            .sourceDocId(sourceDocId)
            .targetDocId(targetDocId)
            .relType(relType)
            .reason(reason)
            .createdAt(now)
            .updatedAt(now)
            .build();

        return CompletableFuture.supplyAsync(() -> {
            RelationshipEdge stored = store.mergeRelationship(edge);
            log.debug("🔗 {} -[{}]-> {} in '{}'", sourceDocId, relType, targetDocId, indexName);
            return stored;
        }, storeExecutor);
    }

    @Override
    public CompletableFuture<Void> deleteRelationship(String indexName, String sourceDocId,
                                                      String targetDocId, String relType) {
        try {
            validateEndpoints(sourceDocId, targetDocId);
            validateRelType(relType);
        } catch (ValidationException e) {
            return CompletableFuture.failedFuture(e);
        }
        return CompletableFuture.runAsync(
            () -> store.deleteRelationship(indexName, sourceDocId, targetDocId, relType), storeExecutor);
    }

    @Override
    public CompletableFuture<List<RelationshipEdge>> listRelationships(String indexName, String docId) {
        String filter = docId == null || docId.isBlank() ? null : docId;
        return CompletableFuture.supplyAsync(() -> store.listRelationships(indexName, filter), storeExecutor);
    }

    @Override
    public CompletableFuture<IndexAnalytics> analytics(String indexName) {
        return CompletableFuture.supplyAsync(() -> store.analytics(indexName, sampleSize), storeExecutor);
    }

    private static void validateEndpoints(String sourceDocId, String targetDocId) {
        if (sourceDocId == null || sourceDocId.isBlank() || targetDocId == null || targetDocId.isBlank()) {
            throw new ValidationException("source_doc_id and target_doc_id are required");
        }
    }

    private static void validateRelType(String relType) {
        if (relType == null || !REL_TYPE.matcher(relType).matches()) {
            throw new ValidationException("rel_type must be an upper-case identifier ([A-Z][A-Z0-9_]*), got: "
                + relType);
        }
    }
}
