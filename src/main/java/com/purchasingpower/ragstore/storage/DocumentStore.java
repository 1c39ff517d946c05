package com.purchasingpower.ragstore.storage;

import com.purchasingpower.ragstore.model.DocumentChunk;
import com.purchasingpower.ragstore.model.DocumentPatch;
import com.purchasingpower.ragstore.model.IndexAnalytics;
import com.purchasingpower.ragstore.model.IndexPatch;
import com.purchasingpower.ragstore.model.IndexSnapshot;
import com.purchasingpower.ragstore.model.RagIndex;
import com.purchasingpower.ragstore.model.RelationshipEdge;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * System of record for indexes, chunks and relationship edges.
 *
 * <p>Every method is blocking and runs as one atomic unit against the backing
 * store: a mutation is visible to all readers once it returns, and deleting an
 * index is atomic with respect to writes into it. Implementations report
 * failures with the {@code com.purchasingpower.ragstore.exception} types.
 */
public interface DocumentStore {

    // =========================================================================
    // Index Operations
    // =========================================================================

    /**
     * Create a new index.
     *
     * @throws com.purchasingpower.ragstore.exception.ConflictException if the name is taken
     */
    RagIndex createIndex(RagIndex index);

    Optional<RagIndex> findIndex(String name);

    /**
     * All indexes ordered by name.
     */
    List<RagIndex> listIndexes();

    /**
     * Apply a partial update of the description.
     *
     * @throws com.purchasingpower.ragstore.exception.NotFoundException if the index is absent
     */
    RagIndex updateIndex(String name, IndexPatch patch, Instant updatedAt);

    /**
     * Remove the index together with all of its chunks and edges.
     *
     * @throws com.purchasingpower.ragstore.exception.NotFoundException if the index is absent
     */
    void deleteIndex(String name);

    // =========================================================================
    // Chunk Operations
    // =========================================================================

    /**
     * Persist a new chunk into {@code chunk.getIndexName()}.
     *
     * @throws com.purchasingpower.ragstore.exception.NotFoundException if the index is absent
     * @throws com.purchasingpower.ragstore.exception.DimensionMismatchException if the embedding
     *         length differs from the index dimension
     */
    DocumentChunk insertDocument(DocumentChunk chunk);

    /**
     * @throws com.purchasingpower.ragstore.exception.NotFoundException if the index is absent
     */
    Optional<DocumentChunk> findDocument(String indexName, String docId);

    /**
     * Chunks of the index, most recently updated first.
     *
     * @throws com.purchasingpower.ragstore.exception.NotFoundException if the index is absent
     */
    List<DocumentChunk> listDocuments(String indexName);

    /**
     * Apply a resolved patch: non-null fields replace the stored ones.
     *
     * @throws com.purchasingpower.ragstore.exception.NotFoundException if the index or chunk is absent
     * @throws com.purchasingpower.ragstore.exception.DimensionMismatchException on a wrong-length embedding
     */
    DocumentChunk updateDocument(String indexName, String docId, DocumentPatch patch, Instant updatedAt);

    /**
     * Remove the chunk and every edge that touches it.
     *
     * @throws com.purchasingpower.ragstore.exception.NotFoundException if the index or chunk is absent
     */
    void deleteDocument(String indexName, String docId);

    // =========================================================================
    // Relationship Operations
    // =========================================================================

    /**
     * Create the edge, or refresh the reason of the existing edge with the same
     * {@code (index, source, target, relType)} key.
     *
     * @throws com.purchasingpower.ragstore.exception.NotFoundException if the index or an
     *         endpoint is absent from the index
     */
    RelationshipEdge mergeRelationship(RelationshipEdge edge);

    /**
     * @throws com.purchasingpower.ragstore.exception.NotFoundException if the edge does not exist
     */
    void deleteRelationship(String indexName, String sourceDocId, String targetDocId, String relType);

    /**
     * Edges of the index ordered by creation time, optionally restricted to
     * those touching {@code docId}.
     *
     * @throws com.purchasingpower.ragstore.exception.NotFoundException if the index is absent
     */
    List<RelationshipEdge> listRelationships(String indexName, String docId);

    /**
     * @throws com.purchasingpower.ragstore.exception.NotFoundException if the index is absent
     */
    IndexAnalytics analytics(String indexName, int sampleSize);

    /**
     * Read the index with its chunks and edges in one transaction.
     *
     * @throws com.purchasingpower.ragstore.exception.NotFoundException if the index is absent
     */
    IndexSnapshot snapshot(String indexName);
}
