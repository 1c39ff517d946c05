package com.purchasingpower.ragstore.document;

import com.purchasingpower.ragstore.model.DocumentChunk;
import com.purchasingpower.ragstore.model.DocumentDraft;
import com.purchasingpower.ragstore.model.DocumentPatch;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Chunk records within an index.
 *
 * <p>Chunks without an explicit embedding are embedded from their content
 * through the embedding service. Every embedding is checked against the index
 * dimension before anything is persisted.
 */
public interface ChunkStore {

    CompletableFuture<DocumentChunk> createDocument(String indexName, DocumentDraft draft);

    /**
     * Ingest several chunks; each item succeeds or fails on its own. A missing
     * index fails the whole call.
     */
    CompletableFuture<BatchIngestResult> createDocuments(String indexName, List<DocumentDraft> drafts);

    CompletableFuture<DocumentChunk> getDocument(String indexName, String docId);

    /**
     * All chunks of the index, most recently updated first.
     */
    CompletableFuture<List<DocumentChunk>> listDocuments(String indexName);

    /**
     * New content is re-embedded unless the same patch carries an embedding.
     * Metadata, when present, replaces the stored mapping.
     */
    CompletableFuture<DocumentChunk> updateDocument(String indexName, String docId, DocumentPatch patch);

    /**
     * Delete the chunk and its incident relationships. Deleting a missing
     * chunk fails {@code NotFound}.
     */
    CompletableFuture<Void> deleteDocument(String indexName, String docId);
}
