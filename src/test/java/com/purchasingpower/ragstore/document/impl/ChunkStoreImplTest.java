package com.purchasingpower.ragstore.document.impl;

import com.purchasingpower.ragstore.TestFixtures;
import com.purchasingpower.ragstore.document.BatchIngestResult;
import com.purchasingpower.ragstore.document.BatchItemResult;
import com.purchasingpower.ragstore.embedding.impl.EmbeddingServiceImpl;
import com.purchasingpower.ragstore.embedding.impl.HashingEmbeddingProvider;
import com.purchasingpower.ragstore.exception.DimensionMismatchException;
import com.purchasingpower.ragstore.exception.ErrorCode;
import com.purchasingpower.ragstore.exception.NotFoundException;
import com.purchasingpower.ragstore.exception.ValidationException;
import com.purchasingpower.ragstore.model.DocumentChunk;
import com.purchasingpower.ragstore.model.DocumentDraft;
import com.purchasingpower.ragstore.model.DocumentPatch;
import com.purchasingpower.ragstore.model.RagIndex;
import com.purchasingpower.ragstore.model.RelationshipEdge;
import com.purchasingpower.ragstore.model.metadata.MetadataValue;
import com.purchasingpower.ragstore.storage.impl.InMemoryDocumentStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.purchasingpower.ragstore.TestFixtures.DIMENSION;
import static com.purchasingpower.ragstore.TestFixtures.await;
import static com.purchasingpower.ragstore.TestFixtures.failureOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Chunk store")
class ChunkStoreImplTest {

    private ThreadPoolTaskExecutor storeExecutor;
    private ThreadPoolTaskExecutor embeddingExecutor;
    private InMemoryDocumentStore store;
    private HashingEmbeddingProvider provider;
    private ChunkStoreImpl chunkStore;

    @BeforeEach
    void setUp() {
        storeExecutor = TestFixtures.executor("store-", 4);
        embeddingExecutor = TestFixtures.executor("embed-", 2);
        store = new InMemoryDocumentStore();
        provider = new HashingEmbeddingProvider(DIMENSION);
        chunkStore = new ChunkStoreImpl(store, new EmbeddingServiceImpl(provider, embeddingExecutor), storeExecutor);

        Instant now = Instant.now();
        store.createIndex(RagIndex.builder().name("alpha").dimension(DIMENSION).createdAt(now).updatedAt(now).build());
    }

    @AfterEach
    void tearDown() {
        storeExecutor.shutdown();
        embeddingExecutor.shutdown();
    }

    @Test
    @DisplayName("Content without an embedding is embedded on ingest")
    void createDocument_embedsContent() throws Exception {
        // When
        DocumentChunk created = await(chunkStore.createDocument("alpha", DocumentDraft.builder()
            .content("Alpha strategy insights")
            .metadata(Map.of("source", MetadataValue.of("crm")))
            .build()));

        // Then
        assertThat(created.getDocId()).isNotBlank();
        assertEquals("alpha", created.getIndexName());
        assertEquals(provider.embed("Alpha strategy insights"), created.getEmbedding());
        assertEquals(MetadataValue.of("crm"), created.getMetadata().get("source"));
        assertEquals(created, await(chunkStore.getDocument("alpha", created.getDocId())));
    }

    @Test
    @DisplayName("A wrong-length embedding fails and persists nothing")
    void createDocument_dimensionMismatch() throws Exception {
        Throwable failure = failureOf(chunkStore.createDocument("alpha", DocumentDraft.builder()
            .content("short vector")
            .embedding(List.of(0.1, 0.2, 0.3))
            .build()));

        assertThat(failure).isInstanceOf(DimensionMismatchException.class);
        assertEquals(DIMENSION, ((DimensionMismatchException) failure).getExpected());
        assertEquals(3, ((DimensionMismatchException) failure).getActual());
        assertThat(await(chunkStore.listDocuments("alpha"))).isEmpty();
    }

    @Test
    @DisplayName("Embeddings with null or non-finite components are rejected on create and update")
    void embedding_rejectsNonFiniteComponents() throws Exception {
        // Given
        DocumentChunk created = await(chunkStore.createDocument("alpha",
            DocumentDraft.builder().content("kept").build()));

        // When / Then
        assertThat(failureOf(chunkStore.createDocument("alpha", DocumentDraft.builder()
            .content("hole").embedding(unitVectorWith(1, null)).build())))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("embedding[1]");
        assertThat(failureOf(chunkStore.createDocument("alpha", DocumentDraft.builder()
            .content("nan").embedding(unitVectorWith(2, Double.NaN)).build())))
            .isInstanceOf(ValidationException.class);
        assertThat(failureOf(chunkStore.updateDocument("alpha", created.getDocId(),
            DocumentPatch.builder().embedding(unitVectorWith(3, Double.POSITIVE_INFINITY)).build())))
            .isInstanceOf(ValidationException.class);

        assertThat(await(chunkStore.listDocuments("alpha"))).containsExactly(created);
    }

    @Test
    @DisplayName("Server-side embedding into an index of another width fails before persisting")
    void embedding_embedderDimensionMismatch() throws Exception {
        // Given
        Instant now = Instant.now();
        store.createIndex(RagIndex.builder().name("wide").dimension(DIMENSION * 2).createdAt(now).updatedAt(now).build());
        Double[] wide = new Double[DIMENSION * 2];
        Arrays.fill(wide, 0.5);
        DocumentChunk supplied = await(chunkStore.createDocument("wide",
            DocumentDraft.builder().content("pre-embedded").embedding(List.of(wide)).build()));

        // When
        Throwable onCreate = failureOf(chunkStore.createDocument("wide",
            DocumentDraft.builder().content("needs embedding").build()));
        Throwable onUpdate = failureOf(chunkStore.updateDocument("wide", supplied.getDocId(),
            DocumentPatch.builder().content("rewritten").build()));

        // Then
        assertThat(onCreate).isInstanceOf(DimensionMismatchException.class);
        assertEquals(DIMENSION, ((DimensionMismatchException) onCreate).getActual());
        assertThat(onUpdate).isInstanceOf(DimensionMismatchException.class);
        assertThat(await(chunkStore.listDocuments("wide"))).containsExactly(supplied);
    }

    @Test
    @DisplayName("Missing index and missing content are rejected")
    void createDocument_rejectsBadInput() throws Exception {
        assertThat(failureOf(chunkStore.createDocument("ghost", DocumentDraft.builder().content("x").build())))
            .isInstanceOf(NotFoundException.class);
        assertThat(failureOf(chunkStore.createDocument("alpha", DocumentDraft.builder().build())))
            .isInstanceOf(ValidationException.class);
        assertThat(failureOf(chunkStore.getDocument("alpha", "nope")))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Updating content re-embeds, metadata-only updates keep the vector")
    void updateDocument_reembedsContent() throws Exception {
        // Given
        DocumentChunk created = await(chunkStore.createDocument("alpha",
            DocumentDraft.builder().content("first draft").build()));

        // When
        DocumentChunk retitled = await(chunkStore.updateDocument("alpha", created.getDocId(),
            DocumentPatch.builder().content("completely rewritten paragraph").build()));
        DocumentChunk tagged = await(chunkStore.updateDocument("alpha", created.getDocId(),
            DocumentPatch.builder().metadata(Map.of("tag", MetadataValue.of(true))).build()));

        // Then
        assertEquals("completely rewritten paragraph", retitled.getContent());
        assertEquals(provider.embed("completely rewritten paragraph"), retitled.getEmbedding());
        assertNotEquals(created.getEmbedding(), retitled.getEmbedding());
        assertEquals(created.getCreatedAt(), retitled.getCreatedAt());
        assertEquals(retitled.getEmbedding(), tagged.getEmbedding());
        assertEquals("completely rewritten paragraph", tagged.getContent());
        assertThat(tagged.getMetadata()).containsOnlyKeys("tag");
    }

    @Test
    @DisplayName("A supplied embedding wins over re-embedding and is dimension checked")
    void updateDocument_explicitEmbedding() throws Exception {
        DocumentChunk created = await(chunkStore.createDocument("alpha",
            DocumentDraft.builder().content("first").build()));
        List<Double> unit = unitVector();

        DocumentChunk updated = await(chunkStore.updateDocument("alpha", created.getDocId(),
            DocumentPatch.builder().content("second").embedding(unit).build()));

        assertEquals(unit, updated.getEmbedding());
        assertThat(failureOf(chunkStore.updateDocument("alpha", created.getDocId(),
            DocumentPatch.builder().embedding(List.of(1.0)).build())))
            .isInstanceOf(DimensionMismatchException.class);
        assertThat(failureOf(chunkStore.updateDocument("alpha", "nope",
            DocumentPatch.builder().content("x").build())))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("An empty patch returns the document unchanged")
    void updateDocument_emptyPatch() throws Exception {
        DocumentChunk created = await(chunkStore.createDocument("alpha",
            DocumentDraft.builder().content("steady").build()));

        DocumentChunk same = await(chunkStore.updateDocument("alpha", created.getDocId(),
            DocumentPatch.builder().build()));

        assertEquals(created, same);
    }

    @Test
    @DisplayName("Delete removes incident edges and a second delete fails NotFound")
    void deleteDocument_twice() throws Exception {
        // Given
        DocumentChunk a = await(chunkStore.createDocument("alpha", DocumentDraft.builder().content("a").build()));
        DocumentChunk b = await(chunkStore.createDocument("alpha", DocumentDraft.builder().content("b").build()));
        Instant now = Instant.now();
        store.mergeRelationship(RelationshipEdge.builder()
            .indexName("alpha").sourceDocId(a.getDocId()).targetDocId(b.getDocId()).relType("REFERENCES")
            .createdAt(now).updatedAt(now)
            .build());

        // When
        await(chunkStore.deleteDocument("alpha", a.getDocId()));

        // Then
        assertThat(store.listRelationships("alpha", null)).isEmpty();
        assertThat(failureOf(chunkStore.deleteDocument("alpha", a.getDocId())))
            .isInstanceOf(NotFoundException.class);
        assertThat(await(chunkStore.listDocuments("alpha"))).extracting(DocumentChunk::getDocId)
            .containsExactly(b.getDocId());
    }

    @Test
    @DisplayName("Batch ingest reports per-item outcomes in request order")
    void createDocuments_partialFailure() throws Exception {
        // Given
        List<DocumentDraft> drafts = Arrays.asList(
            DocumentDraft.builder().content("one").build(),
            DocumentDraft.builder().content("two").embedding(List.of(1.0, 2.0)).build(),
            DocumentDraft.builder().content("three").embedding(unitVector()).build(),
            DocumentDraft.builder().build());

        // When
        BatchIngestResult result = await(chunkStore.createDocuments("alpha", drafts));

        // Then
        assertFalse(result.isFullSuccess());
        assertEquals(2, result.getCreatedCount());
        List<BatchItemResult> items = result.getItems();
        assertThat(items).extracting(BatchItemResult::getPosition).containsExactly(0, 1, 2, 3);
        assertTrue(items.get(0).isSuccess());
        assertEquals(ErrorCode.DIMENSION_MISMATCH, items.get(1).getError());
        assertEquals("three", items.get(2).getDocument().getContent());
        assertEquals(ErrorCode.VALIDATION_ERROR, items.get(3).getError());
        assertThat(await(chunkStore.listDocuments("alpha"))).hasSize(2);
    }

    @Test
    @DisplayName("Batch ingest into a missing index fails as a whole")
    void createDocuments_missingIndex() throws Exception {
        Throwable failure = failureOf(chunkStore.createDocuments("ghost",
            List.of(DocumentDraft.builder().content("one").build())));

        assertThat(failure).isInstanceOf(NotFoundException.class);
        assertThat(failureOf(chunkStore.createDocuments("alpha", Collections.emptyList())))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Listing returns the most recently updated document first")
    void listDocuments_order() throws Exception {
        DocumentChunk first = await(chunkStore.createDocument("alpha", DocumentDraft.builder().content("1").build()));
        await(chunkStore.createDocument("alpha", DocumentDraft.builder().content("2").build()));
        Thread.sleep(5);
        await(chunkStore.updateDocument("alpha", first.getDocId(), DocumentPatch.builder().content("1b").build()));

        List<DocumentChunk> listed = await(chunkStore.listDocuments("alpha"));

        assertEquals(2, listed.size());
        assertEquals(first.getDocId(), listed.get(0).getDocId());
    }

    private static List<Double> unitVectorWith(int position, Double value) {
        Double[] values = new Double[DIMENSION];
        Arrays.fill(values, 0.0);
        values[0] = 1.0;
        values[position] = value;
        return Arrays.asList(values);
    }

    private static List<Double> unitVector() {
        Double[] values = new Double[DIMENSION];
        Arrays.fill(values, 0.0);
        values[0] = 1.0;
        return List.of(values);
    }
}
