package com.purchasingpower.ragstore.storage.impl;

import com.purchasingpower.ragstore.exception.ConflictException;
import com.purchasingpower.ragstore.exception.DimensionMismatchException;
import com.purchasingpower.ragstore.exception.NotFoundException;
import com.purchasingpower.ragstore.model.DocumentChunk;
import com.purchasingpower.ragstore.model.DocumentPatch;
import com.purchasingpower.ragstore.model.IndexAnalytics;
import com.purchasingpower.ragstore.model.IndexPatch;
import com.purchasingpower.ragstore.model.IndexSnapshot;
import com.purchasingpower.ragstore.model.RagIndex;
import com.purchasingpower.ragstore.model.RelationshipEdge;
import com.purchasingpower.ragstore.model.metadata.MetadataValue;
import com.purchasingpower.ragstore.storage.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Process-local {@link DocumentStore} for development and tests.
 *
 * <p>Each index lives in its own {@link Partition} guarded by a read/write
 * lock. Deleting an index marks the partition deleted under the write lock
 * before unlinking it, so a writer that looked the partition up just before
 * the delete fails {@code NotFound} instead of leaving an orphaned chunk.
 * Readers always receive copies.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "app.store", name = "backend", havingValue = "memory")
public class InMemoryDocumentStore implements DocumentStore {

    static final Comparator<DocumentChunk> MOST_RECENT_FIRST =
        Comparator.comparing(DocumentChunk::getUpdatedAt).reversed()
            .thenComparing(DocumentChunk::getDocId);

    private final ConcurrentHashMap<String, Partition> partitions = new ConcurrentHashMap<>();

    public InMemoryDocumentStore() {
        log.info("🗄️ In-memory document store initialized");
    }

    // =========================================================================
    // Index Operations
    // =========================================================================

    @Override
    public RagIndex createIndex(RagIndex index) {
        Partition created = new Partition(index);
        Partition winner = partitions.compute(index.getName(),
            (name, current) -> current == null || current.deleted ? created : current);
        if (winner != created) {
            throw ConflictException.indexExists(index.getName());
        }
        log.debug("Created index {} (dimension={})", index.getName(), index.getDimension());
        return index;
    }

    @Override
    public Optional<RagIndex> findIndex(String name) {
        Partition partition = partitions.get(name);
        if (partition == null) {
            return Optional.empty();
        }
        return partition.read(p -> Optional.ofNullable(p.deleted ? null : p.index));
    }

    @Override
    public List<RagIndex> listIndexes() {
        TreeMap<String, RagIndex> sorted = new TreeMap<>();
        for (Partition partition : partitions.values()) {
            RagIndex index = partition.read(p -> p.deleted ? null : p.index);
            if (index != null) {
                sorted.put(index.getName(), index);
            }
        }
        return new ArrayList<>(sorted.values());
    }

    @Override
    public RagIndex updateIndex(String name, IndexPatch patch, Instant updatedAt) {
        return writeTo(name, p -> {
            RagIndex.RagIndexBuilder builder = p.index.toBuilder().updatedAt(updatedAt);
            if (patch.getDescription() != null) {
                builder.description(patch.getDescription());
            }
            p.index = builder.build();
            return p.index;
        });
    }

    @Override
    public void deleteIndex(String name) {
        writeTo(name, p -> {
            p.deleted = true;
            log.debug("Deleting index {} with {} chunks and {} edges", name, p.chunks.size(), p.edges.size());
            p.chunks.clear();
            p.edges.clear();
            partitions.remove(name, p);
            return null;
        });
    }

    // =========================================================================
    // Chunk Operations
    // =========================================================================

    @Override
    public DocumentChunk insertDocument(DocumentChunk chunk) {
        return writeTo(chunk.getIndexName(), p -> {
            checkDimension(p.index, chunk.getEmbedding());
            DocumentChunk stored = copy(chunk);
            p.chunks.put(stored.getDocId(), stored);
            return stored;
        });
    }

    @Override
    public Optional<DocumentChunk> findDocument(String indexName, String docId) {
        return readFrom(indexName, p -> Optional.ofNullable(p.chunks.get(docId)));
    }

    @Override
    public List<DocumentChunk> listDocuments(String indexName) {
        return readFrom(indexName, p -> sortedChunks(p.chunks));
    }

    @Override
    public DocumentChunk updateDocument(String indexName, String docId, DocumentPatch patch, Instant updatedAt) {
        return writeTo(indexName, p -> {
            DocumentChunk current = p.chunks.get(docId);
            if (current == null) {
                throw NotFoundException.document(indexName, docId);
            }
            DocumentChunk.DocumentChunkBuilder builder = current.toBuilder().updatedAt(updatedAt);
            if (patch.getContent() != null) {
                builder.content(patch.getContent());
            }
            if (patch.getMetadata() != null) {
                builder.metadata(patch.getMetadata());
            }
            if (patch.getEmbedding() != null) {
                checkDimension(p.index, patch.getEmbedding());
                builder.embedding(patch.getEmbedding());
            }
            DocumentChunk updated = copy(builder.build());
            p.chunks.put(docId, updated);
            return updated;
        });
    }

    @Override
    public void deleteDocument(String indexName, String docId) {
        writeTo(indexName, p -> {
            if (p.chunks.remove(docId) == null) {
                throw NotFoundException.document(indexName, docId);
            }
            p.edges.removeIf(edge -> edge.touches(docId));
            return null;
        });
    }

    // =========================================================================
    // Relationship Operations
    // =========================================================================

    @Override
    public RelationshipEdge mergeRelationship(RelationshipEdge edge) {
        return writeTo(edge.getIndexName(), p -> {
            requireDocument(p, edge.getSourceDocId());
            requireDocument(p, edge.getTargetDocId());
            for (int i = 0; i < p.edges.size(); i++) {
                RelationshipEdge existing = p.edges.get(i);
                if (existing.sameKey(edge.getSourceDocId(), edge.getTargetDocId(), edge.getRelType())) {
                    RelationshipEdge refreshed = existing.toBuilder()
                        .reason(edge.getReason())
                        .updatedAt(edge.getUpdatedAt())
                        .build();
                    p.edges.set(i, refreshed);
                    return refreshed;
                }
            }
            p.edges.add(edge);
            return edge;
        });
    }

    @Override
    public void deleteRelationship(String indexName, String sourceDocId, String targetDocId, String relType) {
        writeTo(indexName, p -> {
            boolean removed = p.edges.removeIf(edge -> edge.sameKey(sourceDocId, targetDocId, relType));
            if (!removed) {
                throw NotFoundException.relationship(sourceDocId, relType, targetDocId);
            }
            return null;
        });
    }

    @Override
    public List<RelationshipEdge> listRelationships(String indexName, String docId) {
        return readFrom(indexName, p -> {
            List<RelationshipEdge> edges = new ArrayList<>();
            for (RelationshipEdge edge : p.edges) {
                if (docId == null || edge.touches(docId)) {
                    edges.add(edge);
                }
            }
            return edges;
        });
    }

    @Override
    public IndexAnalytics analytics(String indexName, int sampleSize) {
        return readFrom(indexName, p -> {
            Map<String, Long> byType = new TreeMap<>();
            for (RelationshipEdge edge : p.edges) {
                byType.merge(edge.getRelType(), 1L, Long::sum);
            }
            return IndexAnalytics.builder()
                .indexName(indexName)
                .chunkCount(p.chunks.size())
                .relationshipCount(p.edges.size())
                .relationshipTypes(byType)
                .sampleRelationships(new ArrayList<>(p.edges.subList(0, Math.min(sampleSize, p.edges.size()))))
                .build();
        });
    }

    @Override
    public IndexSnapshot snapshot(String indexName) {
        return readFrom(indexName, p -> IndexSnapshot.builder()
            .index(p.index)
            .chunks(sortedChunks(p.chunks))
            .relationships(new ArrayList<>(p.edges))
            .build());
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private <T> T readFrom(String indexName, Function<Partition, T> action) {
        Partition partition = partitions.get(indexName);
        if (partition == null) {
            throw NotFoundException.index(indexName);
        }
        return partition.read(p -> {
            if (p.deleted) {
                throw NotFoundException.index(indexName);
            }
            return action.apply(p);
        });
    }

    private <T> T writeTo(String indexName, Function<Partition, T> action) {
        Partition partition = partitions.get(indexName);
        if (partition == null) {
            throw NotFoundException.index(indexName);
        }
        return partition.write(p -> {
            if (p.deleted) {
                throw NotFoundException.index(indexName);
            }
            return action.apply(p);
        });
    }

    private static void requireDocument(Partition partition, String docId) {
        if (!partition.chunks.containsKey(docId)) {
            throw NotFoundException.document(partition.index.getName(), docId);
        }
    }

    private static void checkDimension(RagIndex index, List<Double> embedding) {
        if (embedding != null && embedding.size() != index.getDimension()) {
            throw new DimensionMismatchException(index.getName(), index.getDimension(), embedding.size());
        }
    }

    private static List<DocumentChunk> sortedChunks(Map<String, DocumentChunk> chunks) {
        List<DocumentChunk> sorted = new ArrayList<>(chunks.values());
        sorted.sort(MOST_RECENT_FIRST);
        return sorted;
    }

    private static DocumentChunk copy(DocumentChunk chunk) {
        return chunk.toBuilder()
            .metadata(Collections.unmodifiableMap(MetadataValue.copyOf(chunk.getMetadata())))
            .embedding(chunk.getEmbedding() != null ? List.copyOf(chunk.getEmbedding()) : null)
            .build();
    }

    private static final class Partition {
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private final Map<String, DocumentChunk> chunks = new LinkedHashMap<>();
        private final List<RelationshipEdge> edges = new ArrayList<>();
        private RagIndex index;
        private volatile boolean deleted;

        Partition(RagIndex index) {
            this.index = index;
        }

        <T> T read(Function<Partition, T> action) {
            return locked(lock.readLock(), action);
        }

        <T> T write(Function<Partition, T> action) {
            return locked(lock.writeLock(), action);
        }

        private <T> T locked(Lock held, Function<Partition, T> action) {
            held.lock();
            try {
                return action.apply(this);
            } finally {
                held.unlock();
            }
        }
    }
}
