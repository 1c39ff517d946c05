package com.purchasingpower.ragstore.document.impl;

import com.purchasingpower.ragstore.configuration.AsyncConfig;
import com.purchasingpower.ragstore.document.BatchIngestResult;
import com.purchasingpower.ragstore.document.BatchItemResult;
import com.purchasingpower.ragstore.document.ChunkStore;
import com.purchasingpower.ragstore.embedding.EmbeddingService;
import com.purchasingpower.ragstore.exception.DimensionMismatchException;
import com.purchasingpower.ragstore.exception.ErrorCode;
import com.purchasingpower.ragstore.exception.NotFoundException;
import com.purchasingpower.ragstore.exception.RagStoreException;
import com.purchasingpower.ragstore.exception.ValidationException;
import com.purchasingpower.ragstore.model.DocumentChunk;
import com.purchasingpower.ragstore.model.DocumentDraft;
import com.purchasingpower.ragstore.model.DocumentPatch;
import com.purchasingpower.ragstore.model.RagIndex;
import com.purchasingpower.ragstore.model.metadata.MetadataValue;
import com.purchasingpower.ragstore.storage.DocumentStore;
import com.purchasingpower.ragstore.util.EmbeddingVectors;
import com.purchasingpower.ragstore.util.Futures;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Slf4j
@Service
public class ChunkStoreImpl implements ChunkStore {

    private final DocumentStore store;
    private final EmbeddingService embeddingService;
    private final Executor storeExecutor;

    public ChunkStoreImpl(DocumentStore store,
                          EmbeddingService embeddingService,
                          @Qualifier(AsyncConfig.STORE_EXECUTOR) Executor storeExecutor) {
        this.store = store;
        this.embeddingService = embeddingService;
        this.storeExecutor = storeExecutor;
    }

    @Override
    public CompletableFuture<DocumentChunk> createDocument(String indexName, DocumentDraft draft) {
        if (draft == null || draft.getContent() == null) {
            return CompletableFuture.failedFuture(new ValidationException("content is required"));
        }
        return requireIndex(indexName).thenCompose(index -> create(index, draft));
    }

    @Override
    public CompletableFuture<BatchIngestResult> createDocuments(String indexName, List<DocumentDraft> drafts) {
        if (drafts == null || drafts.isEmpty()) {
            return CompletableFuture.failedFuture(new ValidationException("documents must not be empty"));
        }
        return requireIndex(indexName).thenCompose(index -> {
            List<CompletableFuture<BatchItemResult>> items = new ArrayList<>(drafts.size());
            for (int i = 0; i < drafts.size(); i++) {
                int position = i;
                DocumentDraft draft = drafts.get(i);
                CompletableFuture<DocumentChunk> created = draft == null || draft.getContent() == null
                    ? CompletableFuture.failedFuture(new ValidationException("content is required"))
                    : create(index, draft);
                items.add(created.handle((chunk, error) -> error == null
                    ? BatchItemResult.created(position, chunk)
                    : toFailure(position, error)));
            }
            return CompletableFuture.allOf(items.toArray(new CompletableFuture[0]))
                .thenApply(done -> {
                    List<BatchItemResult> results = new ArrayList<>(items.size());
                    for (CompletableFuture<BatchItemResult> item : items) {
                        results.add(item.join());
                    }
                    BatchIngestResult batch = new BatchIngestResult(results);
                    log.info("📦 Batch ingest into '{}': {}/{} created",
                        indexName, batch.getCreatedCount(), results.size());
                    return batch;
                });
        });
    }

    @Override
    public CompletableFuture<DocumentChunk> getDocument(String indexName, String docId) {
        return CompletableFuture.supplyAsync(() -> store.findDocument(indexName, docId)
            .orElseThrow(() -> NotFoundException.document(indexName, docId)), storeExecutor);
    }

    @Override
    public CompletableFuture<List<DocumentChunk>> listDocuments(String indexName) {
        return CompletableFuture.supplyAsync(() -> store.listDocuments(indexName), storeExecutor);
    }

    @Override
    public CompletableFuture<DocumentChunk> updateDocument(String indexName, String docId, DocumentPatch patch) {
        try {
            EmbeddingVectors.requireFinite("embedding", patch.getEmbedding());
        } catch (ValidationException e) {
            return CompletableFuture.failedFuture(e);
        }
        return CompletableFuture.supplyAsync(() -> {
            RagIndex index = store.findIndex(indexName).orElseThrow(() -> NotFoundException.index(indexName));
            DocumentChunk current = store.findDocument(indexName, docId)
                .orElseThrow(() -> NotFoundException.document(indexName, docId));
            checkDimension(index, patch.getEmbedding());
            if (patch.getContent() != null && patch.getEmbedding() == null) {
                checkEmbedderDimension(index);
            }
            return current;
        }, storeExecutor).thenCompose(current -> {
            if (patch.isEmpty()) {
                return CompletableFuture.completedFuture(current);
            }
            CompletableFuture<DocumentPatch> resolved;
            if (patch.getContent() != null && patch.getEmbedding() == null) {
                resolved = embeddingService.embed(patch.getContent()).thenApply(vector -> DocumentPatch.builder()
                    .content(patch.getContent())
                    .metadata(patch.getMetadata())
                    .embedding(vector)
                    .build());
            } else {
                resolved = CompletableFuture.completedFuture(patch);
            }
            return resolved.thenApplyAsync(
                change -> store.updateDocument(indexName, docId, change, Instant.now()), storeExecutor);
        });
    }

    @Override
    public CompletableFuture<Void> deleteDocument(String indexName, String docId) {
        return CompletableFuture.runAsync(() -> {
            store.deleteDocument(indexName, docId);
            log.debug("Deleted document {} from '{}'", docId, indexName);
        }, storeExecutor);
    }

    private CompletableFuture<RagIndex> requireIndex(String indexName) {
        return CompletableFuture.supplyAsync(
            () -> store.findIndex(indexName).orElseThrow(() -> NotFoundException.index(indexName)), storeExecutor);
    }

    /**
     * Embeds the content when needed, checks the dimension, then persists.
     */
    private CompletableFuture<DocumentChunk> create(RagIndex index, DocumentDraft draft) {
        try {
            EmbeddingVectors.requireFinite("embedding", draft.getEmbedding());
            if (draft.getEmbedding() != null) {
                checkDimension(index, draft.getEmbedding());
            } else {
                checkEmbedderDimension(index);
            }
        } catch (RagStoreException e) {
            return CompletableFuture.failedFuture(e);
        }
        CompletableFuture<List<Double>> embedding = draft.getEmbedding() != null
            ? CompletableFuture.completedFuture(draft.getEmbedding())
            : embeddingService.embed(draft.getContent());

        return embedding.thenApplyAsync(vector -> {
            Instant now = Instant.now();
            DocumentChunk chunk = DocumentChunk.builder()
                .docId(UUID.randomUUID().toString())
                .indexName(index.getName())
                .content(draft.getContent())
                .metadata(MetadataValue.copyOf(draft.getMetadata()))
                .embedding(vector)
                .createdAt(now)
                .updatedAt(now)
                .build();
            return store.insertDocument(chunk);
        }, storeExecutor);
    }

    private static void checkDimension(RagIndex index, List<Double> embedding) {
        if (embedding != null && embedding.size() != index.getDimension()) {
            throw new DimensionMismatchException(index.getName(), index.getDimension(), embedding.size());
        }
    }

    /**
     * Server-side embedding can only fill indexes of the embedder's width.
     */
    private void checkEmbedderDimension(RagIndex index) {
        int produced = embeddingService.dimension();
        if (produced != index.getDimension()) {
            throw new DimensionMismatchException(index.getName(), index.getDimension(), produced);
        }
    }

    private static BatchItemResult toFailure(int position, Throwable error) {
        Throwable cause = Futures.unwrap(error);
        if (cause instanceof RagStoreException ragError) {
            return BatchItemResult.failed(position, ragError.getErrorCode(), ragError.getMessage());
        }
        log.error("Batch item {} failed unexpectedly", position, cause);
        return BatchItemResult.failed(position, ErrorCode.INTERNAL_ERROR, cause.getMessage());
    }
}
