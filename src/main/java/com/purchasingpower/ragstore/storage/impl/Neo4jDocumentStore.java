package com.purchasingpower.ragstore.storage.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.ragstore.configuration.AppProperties;
import com.purchasingpower.ragstore.exception.ConflictException;
import com.purchasingpower.ragstore.exception.DimensionMismatchException;
import com.purchasingpower.ragstore.exception.NotFoundException;
import com.purchasingpower.ragstore.exception.UpstreamException;
import com.purchasingpower.ragstore.model.CallContext;
import com.purchasingpower.ragstore.model.DocumentChunk;
import com.purchasingpower.ragstore.model.DocumentPatch;
import com.purchasingpower.ragstore.model.IndexAnalytics;
import com.purchasingpower.ragstore.model.IndexPatch;
import com.purchasingpower.ragstore.model.IndexSnapshot;
import com.purchasingpower.ragstore.model.RagIndex;
import com.purchasingpower.ragstore.model.RelationshipEdge;
import com.purchasingpower.ragstore.model.ServiceType;
import com.purchasingpower.ragstore.storage.DocumentStore;
import com.purchasingpower.ragstore.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.TransactionContext;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.ClientException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.Relationship;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import jakarta.annotation.PostConstruct;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Neo4j implementation of {@link DocumentStore}.
 *
 * <p>Schema:
 * <pre>
 * (:RAGIndex {name, dimension, description, created_at, updated_at})
 *   -[:HAS_DOCUMENT]->
 * (:RAGDocument {doc_id, index_name, content, metadata_json, embedding, created_at, updated_at})
 *   -[:RELATES_TO {rel_type, reason, index_name, created_at, updated_at}]->
 * (:RAGDocument)
 * </pre>
 *
 * <p>Every operation runs as one managed transaction. Documents are only ever
 * created by matching their index node first, so a write racing an index
 * delete either lands before the delete (and is removed with it) or finds no
 * index and fails {@code NotFound}.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "app.store", name = "backend", havingValue = "neo4j", matchIfMissing = true)
public class Neo4jDocumentStore implements DocumentStore {

    private static final String CONSTRAINT_VIOLATION = "Neo.ClientError.Schema.ConstraintValidationFailed";

    /**
     * Fixed-width UTC timestamps, so string order in Cypher matches time order.
     */
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'").withZone(ZoneOffset.UTC);

    private static final String EDGE_MATCH = """
        MATCH (:RAGIndex {name: $indexName})-[:HAS_DOCUMENT]->(s:RAGDocument)-[r:RELATES_TO]->(t:RAGDocument)
        WHERE $docId IS NULL OR s.doc_id = $docId OR t.doc_id = $docId
        RETURN s.doc_id AS source, t.doc_id AS target, r
        ORDER BY r.created_at, source, target, r.rel_type
        """;

    private final Driver driver;
    private final SessionConfig sessionConfig;
    private final MetadataJsonCodec metadataCodec;

    public Neo4jDocumentStore(Driver driver, AppProperties props, ObjectMapper objectMapper) {
        this.driver = driver;
        String database = props.getNeo4j().getDatabase();
        this.sessionConfig = database == null || database.isBlank()
            ? SessionConfig.defaultConfig()
            : SessionConfig.forDatabase(database);
        this.metadataCodec = new MetadataJsonCodec(objectMapper);
    }

    @PostConstruct
    public void init() {
        try (Session session = driver.session(sessionConfig)) {
            session.run("CREATE CONSTRAINT rag_index_name IF NOT EXISTS FOR (i:RAGIndex) REQUIRE i.name IS UNIQUE");
            session.run("CREATE CONSTRAINT rag_document_id IF NOT EXISTS FOR (d:RAGDocument) REQUIRE d.doc_id IS UNIQUE");
            session.run("CREATE INDEX rag_document_index IF NOT EXISTS FOR (d:RAGDocument) ON (d.index_name)");
            log.info("✅ Neo4j constraints for RAGIndex/RAGDocument ensured");
        } catch (Exception e) {
            log.warn("⚠️  Failed to create Neo4j constraints, duplicate names are then only caught per transaction: {}", e.getMessage());
        }
    }

    // =========================================================================
    // Index Operations
    // =========================================================================

    @Override
    public RagIndex createIndex(RagIndex index) {
        String cypher = """
            CREATE (i:RAGIndex {
                name: $name,
                dimension: $dimension,
                description: $description,
                created_at: $createdAt,
                updated_at: $updatedAt
            })
            RETURN i
            """;

        return execute("createIndex", session -> session.executeWrite(tx -> {
            if (findIndexNode(tx, index.getName()).isPresent()) {
                throw ConflictException.indexExists(index.getName());
            }
            Record record = tx.run(cypher, params(
                "name", index.getName(),
                "dimension", index.getDimension(),
                "description", index.getDescription(),
                "createdAt", format(index.getCreatedAt()),
                "updatedAt", format(index.getUpdatedAt())
            )).single();
            return nodeToIndex(record.get("i").asNode());
        }));
    }

    @Override
    public Optional<RagIndex> findIndex(String name) {
        return execute("findIndex", session -> session.executeRead(tx -> findIndexNode(tx, name)));
    }

    @Override
    public List<RagIndex> listIndexes() {
        String cypher = "MATCH (i:RAGIndex) RETURN i ORDER BY i.name";

        return execute("listIndexes", session -> session.executeRead(tx -> {
            Result result = tx.run(cypher);
            List<RagIndex> indexes = new ArrayList<>();
            while (result.hasNext()) {
                indexes.add(nodeToIndex(result.next().get("i").asNode()));
            }
            return indexes;
        }));
    }

    @Override
    public RagIndex updateIndex(String name, IndexPatch patch, Instant updatedAt) {
        String cypher = """
            MATCH (i:RAGIndex {name: $name})
            SET i.description = coalesce($description, i.description),
                i.updated_at = $updatedAt
            RETURN i
            """;

        return execute("updateIndex", session -> session.executeWrite(tx -> {
            Result result = tx.run(cypher, params(
                "name", name,
                "description", patch.getDescription(),
                "updatedAt", format(updatedAt)
            ));
            if (!result.hasNext()) {
                throw NotFoundException.index(name);
            }
            return nodeToIndex(result.single().get("i").asNode());
        }));
    }

    @Override
    public void deleteIndex(String name) {
        String cypher = """
            MATCH (i:RAGIndex {name: $name})
            OPTIONAL MATCH (i)-[:HAS_DOCUMENT]->(d:RAGDocument)
            WITH i, collect(d) AS docs
            FOREACH (doc IN docs | DETACH DELETE doc)
            DETACH DELETE i
            RETURN size(docs) AS removed
            """;

        execute("deleteIndex", session -> session.executeWrite(tx -> {
            Result result = tx.run(cypher, params("name", name));
            if (!result.hasNext()) {
                throw NotFoundException.index(name);
            }
            log.debug("Deleted index {} with {} documents", name, result.single().get("removed").asLong());
            return null;
        }));
    }

    // =========================================================================
    // Chunk Operations
    // =========================================================================

    @Override
    public DocumentChunk insertDocument(DocumentChunk chunk) {
        String cypher = """
            MATCH (i:RAGIndex {name: $indexName})
            CREATE (i)-[:HAS_DOCUMENT]->(d:RAGDocument {
                doc_id: $docId,
                index_name: $indexName,
                content: $content,
                metadata_json: $metadataJson,
                embedding: $embedding,
                created_at: $createdAt,
                updated_at: $updatedAt
            })
            RETURN d
            """;

        return execute("insertDocument", session -> session.executeWrite(tx -> {
            RagIndex index = requireIndex(tx, chunk.getIndexName());
            checkDimension(index, chunk.getEmbedding());
            Result result = tx.run(cypher, params(
                "indexName", chunk.getIndexName(),
                "docId", chunk.getDocId(),
                "content", chunk.getContent(),
                "metadataJson", metadataCodec.write(chunk.getMetadata()),
                "embedding", chunk.getEmbedding(),
                "createdAt", format(chunk.getCreatedAt()),
                "updatedAt", format(chunk.getUpdatedAt())
            ));
            if (!result.hasNext()) {
                throw NotFoundException.index(chunk.getIndexName());
            }
            return nodeToChunk(result.single().get("d").asNode());
        }));
    }

    @Override
    public Optional<DocumentChunk> findDocument(String indexName, String docId) {
        return execute("findDocument", session -> session.executeRead(tx -> {
            requireIndex(tx, indexName);
            return findDocumentNode(tx, indexName, docId).map(this::nodeToChunk);
        }));
    }

    @Override
    public List<DocumentChunk> listDocuments(String indexName) {
        return execute("listDocuments", session -> session.executeRead(tx -> {
            requireIndex(tx, indexName);
            return readChunks(tx, indexName);
        }));
    }

    @Override
    public DocumentChunk updateDocument(String indexName, String docId, DocumentPatch patch, Instant updatedAt) {
        String cypher = """
            MATCH (:RAGIndex {name: $indexName})-[:HAS_DOCUMENT]->(d:RAGDocument {doc_id: $docId})
            SET d += $changes
            RETURN d
            """;

        return execute("updateDocument", session -> session.executeWrite(tx -> {
            RagIndex index = requireIndex(tx, indexName);
            checkDimension(index, patch.getEmbedding());

            Map<String, Object> changes = new HashMap<>();
            changes.put("updated_at", format(updatedAt));
            if (patch.getContent() != null) {
                changes.put("content", patch.getContent());
            }
            if (patch.getMetadata() != null) {
                changes.put("metadata_json", metadataCodec.write(patch.getMetadata()));
            }
            if (patch.getEmbedding() != null) {
                changes.put("embedding", patch.getEmbedding());
            }

            Result result = tx.run(cypher, params("indexName", indexName, "docId", docId, "changes", changes));
            if (!result.hasNext()) {
                throw NotFoundException.document(indexName, docId);
            }
            return nodeToChunk(result.single().get("d").asNode());
        }));
    }

    @Override
    public void deleteDocument(String indexName, String docId) {
        String cypher = """
            MATCH (:RAGIndex {name: $indexName})-[:HAS_DOCUMENT]->(d:RAGDocument {doc_id: $docId})
            DETACH DELETE d
            RETURN count(*) AS removed
            """;

        execute("deleteDocument", session -> session.executeWrite(tx -> {
            requireIndex(tx, indexName);
            long removed = tx.run(cypher, params("indexName", indexName, "docId", docId))
                .single().get("removed").asLong();
            if (removed == 0) {
                throw NotFoundException.document(indexName, docId);
            }
            return null;
        }));
    }

    // =========================================================================
    // Relationship Operations
    // =========================================================================

    @Override
    public RelationshipEdge mergeRelationship(RelationshipEdge edge) {
        String cypher = """
            MATCH (i:RAGIndex {name: $indexName})-[:HAS_DOCUMENT]->(s:RAGDocument {doc_id: $source})
            MATCH (i)-[:HAS_DOCUMENT]->(t:RAGDocument {doc_id: $target})
            MERGE (s)-[r:RELATES_TO {rel_type: $relType}]->(t)
            ON CREATE SET r.created_at = $now, r.index_name = $indexName
            SET r.reason = $reason, r.updated_at = $now
            RETURN s.doc_id AS source, t.doc_id AS target, r
            """;

        String indexName = edge.getIndexName();
        return execute("mergeRelationship", session -> session.executeWrite(tx -> {
            requireIndex(tx, indexName);
            if (findDocumentNode(tx, indexName, edge.getSourceDocId()).isEmpty()) {
                throw NotFoundException.document(indexName, edge.getSourceDocId());
            }
            if (findDocumentNode(tx, indexName, edge.getTargetDocId()).isEmpty()) {
                throw NotFoundException.document(indexName, edge.getTargetDocId());
            }
            Record record = tx.run(cypher, params(
                "indexName", indexName,
                "source", edge.getSourceDocId(),
                "target", edge.getTargetDocId(),
                "relType", edge.getRelType(),
                "reason", edge.getReason(),
                "now", format(edge.getUpdatedAt())
            )).single();
            return recordToEdge(indexName, record);
        }));
    }

    @Override
    public void deleteRelationship(String indexName, String sourceDocId, String targetDocId, String relType) {
        String cypher = """
            MATCH (:RAGIndex {name: $indexName})-[:HAS_DOCUMENT]->(s:RAGDocument {doc_id: $source})
                  -[r:RELATES_TO {rel_type: $relType}]->(t:RAGDocument {doc_id: $target})
            DELETE r
            RETURN count(*) AS removed
            """;

        execute("deleteRelationship", session -> session.executeWrite(tx -> {
            requireIndex(tx, indexName);
            long removed = tx.run(cypher, params(
                "indexName", indexName,
                "source", sourceDocId,
                "target", targetDocId,
                "relType", relType
            )).single().get("removed").asLong();
            if (removed == 0) {
                throw NotFoundException.relationship(sourceDocId, relType, targetDocId);
            }
            return null;
        }));
    }

    @Override
    public List<RelationshipEdge> listRelationships(String indexName, String docId) {
        return execute("listRelationships", session -> session.executeRead(tx -> {
            requireIndex(tx, indexName);
            return readEdges(tx, indexName, docId);
        }));
    }

    @Override
    public IndexAnalytics analytics(String indexName, int sampleSize) {
        String countCypher = """
            MATCH (i:RAGIndex {name: $indexName})
            OPTIONAL MATCH (i)-[:HAS_DOCUMENT]->(d:RAGDocument)
            RETURN count(d) AS chunkCount
            """;
        String typeCypher = """
            MATCH (:RAGIndex {name: $indexName})-[:HAS_DOCUMENT]->(:RAGDocument)-[r:RELATES_TO]->(:RAGDocument)
            RETURN r.rel_type AS relType, count(r) AS total
            ORDER BY relType
            """;
        String sampleCypher = """
            MATCH (:RAGIndex {name: $indexName})-[:HAS_DOCUMENT]->(s:RAGDocument)-[r:RELATES_TO]->(t:RAGDocument)
            RETURN s.doc_id AS source, t.doc_id AS target, r
            ORDER BY r.created_at, source, target, r.rel_type
            LIMIT $limit
            """;

        return execute("analytics", session -> session.executeRead(tx -> {
            requireIndex(tx, indexName);
            long chunkCount = tx.run(countCypher, params("indexName", indexName))
                .single().get("chunkCount").asLong();

            Map<String, Long> byType = new LinkedHashMap<>();
            long relationshipCount = 0;
            Result types = tx.run(typeCypher, params("indexName", indexName));
            while (types.hasNext()) {
                Record record = types.next();
                long total = record.get("total").asLong();
                byType.put(record.get("relType").asString(), total);
                relationshipCount += total;
            }

            List<RelationshipEdge> sample = new ArrayList<>();
            Result edges = tx.run(sampleCypher, params("indexName", indexName, "limit", sampleSize));
            while (edges.hasNext()) {
                sample.add(recordToEdge(indexName, edges.next()));
            }

            return IndexAnalytics.builder()
                .indexName(indexName)
                .chunkCount(chunkCount)
                .relationshipCount(relationshipCount)
                .relationshipTypes(byType)
                .sampleRelationships(sample)
                .build();
        }));
    }

    @Override
    public IndexSnapshot snapshot(String indexName) {
        return execute("snapshot", session -> session.executeRead(tx -> IndexSnapshot.builder()
            .index(requireIndex(tx, indexName))
            .chunks(readChunks(tx, indexName))
            .relationships(readEdges(tx, indexName, null))
            .build()));
    }

    // =========================================================================
    // Helper Methods
    // =========================================================================

    /**
     * Opens a session, logs the call and translates driver failures into the
     * store's exception types.
     */
    private <T> T execute(String operation, Function<Session, T> work) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, operation, log);
        ctx.logRequest(null);
        try (Session session = driver.session(sessionConfig)) {
            T result = work.apply(session);
            ctx.logResponse("ok");
            return result;
        } catch (ClientException e) {
            if (CONSTRAINT_VIOLATION.equals(e.code())) {
                throw new ConflictException("Constraint violated during " + operation + ": " + e.getMessage());
            }
            ctx.logError(e.getMessage(), e);
            throw new UpstreamException("Neo4j rejected " + operation + ": " + e.getMessage(), e);
        } catch (ServiceUnavailableException | SessionExpiredException e) {
            ctx.logError("Neo4j unavailable", e);
            throw new UpstreamException("Neo4j unavailable during " + operation, e);
        }
    }

    private Optional<RagIndex> findIndexNode(TransactionContext tx, String name) {
        Result result = tx.run("MATCH (i:RAGIndex {name: $name}) RETURN i", params("name", name));
        if (result.hasNext()) {
            return Optional.of(nodeToIndex(result.single().get("i").asNode()));
        }
        return Optional.empty();
    }

    private RagIndex requireIndex(TransactionContext tx, String name) {
        return findIndexNode(tx, name).orElseThrow(() -> NotFoundException.index(name));
    }

    private Optional<Node> findDocumentNode(TransactionContext tx, String indexName, String docId) {
        String cypher = """
            MATCH (:RAGIndex {name: $indexName})-[:HAS_DOCUMENT]->(d:RAGDocument {doc_id: $docId})
            RETURN d
            """;
        Result result = tx.run(cypher, params("indexName", indexName, "docId", docId));
        if (result.hasNext()) {
            return Optional.of(result.single().get("d").asNode());
        }
        return Optional.empty();
    }

    private List<DocumentChunk> readChunks(TransactionContext tx, String indexName) {
        String cypher = """
            MATCH (:RAGIndex {name: $indexName})-[:HAS_DOCUMENT]->(d:RAGDocument)
            RETURN d
            ORDER BY d.updated_at DESC, d.doc_id ASC
            """;
        Result result = tx.run(cypher, params("indexName", indexName));
        List<DocumentChunk> chunks = new ArrayList<>();
        while (result.hasNext()) {
            chunks.add(nodeToChunk(result.next().get("d").asNode()));
        }
        return chunks;
    }

    private List<RelationshipEdge> readEdges(TransactionContext tx, String indexName, String docId) {
        Result result = tx.run(EDGE_MATCH, params("indexName", indexName, "docId", docId));
        List<RelationshipEdge> edges = new ArrayList<>();
        while (result.hasNext()) {
            edges.add(recordToEdge(indexName, result.next()));
        }
        return edges;
    }

    private static void checkDimension(RagIndex index, List<Double> embedding) {
        if (embedding != null && embedding.size() != index.getDimension()) {
            throw new DimensionMismatchException(index.getName(), index.getDimension(), embedding.size());
        }
    }

    /**
     * Builds a parameter map. Unlike {@code Map.of}, null values are kept and
     * bound as Cypher {@code null}.
     */
    private static Map<String, Object> params(Object... keyValues) {
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            params.put((String) keyValues[i], keyValues[i + 1]);
        }
        return params;
    }

    private RagIndex nodeToIndex(Node node) {
        return RagIndex.builder()
            .name(getString(node.get("name")))
            .dimension(node.get("dimension").asInt())
            .description(getString(node.get("description")))
            .createdAt(parseInstant(getString(node.get("created_at"))))
            .updatedAt(parseInstant(getString(node.get("updated_at"))))
            .build();
    }

    private DocumentChunk nodeToChunk(Node node) {
        Value embedding = node.get("embedding");
        return DocumentChunk.builder()
            .docId(getString(node.get("doc_id")))
            .indexName(getString(node.get("index_name")))
            .content(getString(node.get("content")))
            .metadata(metadataCodec.read(getString(node.get("metadata_json"))))
            .embedding(embedding.isNull() ? null : embedding.asList(Value::asDouble))
            .createdAt(parseInstant(getString(node.get("created_at"))))
            .updatedAt(parseInstant(getString(node.get("updated_at"))))
            .build();
    }

    private RelationshipEdge recordToEdge(String indexName, Record record) {
        Relationship rel = record.get("r").asRelationship();
        return RelationshipEdge.builder()
            .indexName(indexName)
            .sourceDocId(record.get("source").asString())
            .targetDocId(record.get("target").asString())
            .relType(getString(rel.get("rel_type")))
            .reason(getString(rel.get("reason")))
            .createdAt(parseInstant(getString(rel.get("created_at"))))
            .updatedAt(parseInstant(getString(rel.get("updated_at"))))
            .build();
    }

    private static String getString(Value value) {
        return value == null || value.isNull() ? null : value.asString();
    }

    private static String format(Instant instant) {
        return instant != null ? TIMESTAMP_FORMAT.format(instant) : null;
    }

    private static Instant parseInstant(String value) {
        return value != null ? Instant.parse(value) : null;
    }
}
