package com.purchasingpower.ragstore.graph.impl;

import com.purchasingpower.ragstore.TestFixtures;
import com.purchasingpower.ragstore.exception.NotFoundException;
import com.purchasingpower.ragstore.exception.ValidationException;
import com.purchasingpower.ragstore.index.impl.IndexRegistryImpl;
import com.purchasingpower.ragstore.model.IndexAnalytics;
import com.purchasingpower.ragstore.model.RagIndex;
import com.purchasingpower.ragstore.model.RelationshipEdge;
import com.purchasingpower.ragstore.storage.impl.InMemoryDocumentStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Instant;
import java.util.List;

import static com.purchasingpower.ragstore.TestFixtures.await;
import static com.purchasingpower.ragstore.TestFixtures.chunk;
import static com.purchasingpower.ragstore.TestFixtures.failureOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Relationship graph")
class RelationshipGraphImplTest {

    private static final List<Double> VECTOR = List.of(1.0, 0.0);

    private ThreadPoolTaskExecutor executor;
    private InMemoryDocumentStore store;
    private RelationshipGraphImpl graph;

    @BeforeEach
    void setUp() {
        executor = TestFixtures.executor("store-", 4);
        store = new InMemoryDocumentStore();
        graph = new RelationshipGraphImpl(store, TestFixtures.properties(), executor);

        Instant now = Instant.now();
        for (String name : List.of("alpha", "beta")) {
            store.createIndex(RagIndex.builder().name(name).dimension(2).createdAt(now).updatedAt(now).build());
        }
        store.insertDocument(chunk("a1", "alpha", "alpha one", VECTOR, now));
        store.insertDocument(chunk("a2", "alpha", "alpha two", VECTOR, now));
        store.insertDocument(chunk("a3", "alpha", "alpha three", VECTOR, now));
        store.insertDocument(chunk("b1", "beta", "beta one", VECTOR, now));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("Declaring the same edge twice keeps one edge with the latest reason")
    void declare_isIdempotent() throws Exception {
        // When
        RelationshipEdge first = await(graph.declareRelationship("alpha", "a1", "a2", "REFERENCES", "cites"));
        RelationshipEdge second = await(graph.declareRelationship("alpha", "a1", "a2", "REFERENCES", "quotes"));

        // Then
        assertEquals("quotes", second.getReason());
        assertEquals(first.getCreatedAt(), second.getCreatedAt());
        assertThat(await(graph.listRelationships("alpha", null))).hasSize(1);
    }

    @Test
    @DisplayName("Edges cannot cross indexes")
    void declare_crossIndexFails() throws Exception {
        assertThat(failureOf(graph.declareRelationship("alpha", "a1", "b1", "REFERENCES", null)))
            .isInstanceOf(NotFoundException.class);
        assertThat(failureOf(graph.declareRelationship("ghost", "a1", "a2", "REFERENCES", null)))
            .isInstanceOf(NotFoundException.class);
        assertThat(await(graph.listRelationships("alpha", null))).isEmpty();
    }

    @Test
    @DisplayName("Relationship types must be upper-case identifiers")
    void declare_validatesRelType() throws Exception {
        assertThat(failureOf(graph.declareRelationship("alpha", "a1", "a2", "references", null)))
            .isInstanceOf(ValidationException.class);
        assertThat(failureOf(graph.declareRelationship("alpha", "a1", "a2", "HAS SPACE", null)))
            .isInstanceOf(ValidationException.class);
        assertThat(failureOf(graph.declareRelationship("alpha", "", "a2", "REFERENCES", null)))
            .isInstanceOf(ValidationException.class);
        assertEquals("PART_OF_2", await(graph.declareRelationship("alpha", "a1", "a2", "PART_OF_2", null))
            .getRelType());
    }

    @Test
    @DisplayName("Listing can be filtered to the edges touching one document")
    void list_filtersByDocument() throws Exception {
        await(graph.declareRelationship("alpha", "a1", "a2", "REFERENCES", null));
        await(graph.declareRelationship("alpha", "a3", "a1", "CITES", null));
        await(graph.declareRelationship("alpha", "a2", "a3", "CITES", null));

        assertThat(await(graph.listRelationships("alpha", "a1"))).extracting(RelationshipEdge::getRelType)
            .containsExactly("REFERENCES", "CITES");
        assertThat(await(graph.listRelationships("alpha", ""))).hasSize(3);
        assertThat(failureOf(graph.listRelationships("ghost", null))).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Deleting the index removes its chunks and edges")
    void indexDelete_cascadesToChunksAndEdges() throws Exception {
        // Given: three chunks and two edges in alpha
        await(graph.declareRelationship("alpha", "a1", "a2", "REFERENCES", null));
        await(graph.declareRelationship("alpha", "a2", "a3", "CITES", null));
        assertEquals(2, await(graph.analytics("alpha")).getRelationshipCount());

        // When
        IndexRegistryImpl registry = new IndexRegistryImpl(store, TestFixtures.properties(), executor);
        await(registry.delete("alpha"));

        // Then
        assertThatThrownBy(() -> store.listDocuments("alpha")).isInstanceOf(NotFoundException.class);
        assertThat(failureOf(graph.analytics("alpha"))).isInstanceOf(NotFoundException.class);
        assertThat(failureOf(graph.listRelationships("alpha", null))).isInstanceOf(NotFoundException.class);
        assertThat(store.listDocuments("beta")).hasSize(1);
    }

    @Test
    @DisplayName("Deleting an edge leaves the documents in place")
    void delete_removesEdgeOnly() throws Exception {
        await(graph.declareRelationship("alpha", "a1", "a2", "REFERENCES", null));

        await(graph.deleteRelationship("alpha", "a1", "a2", "REFERENCES"));

        assertThat(await(graph.listRelationships("alpha", null))).isEmpty();
        assertThat(store.listDocuments("alpha")).hasSize(3);
        assertThat(failureOf(graph.deleteRelationship("alpha", "a1", "a2", "REFERENCES")))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Analytics summarizes counts and samples a few edges")
    void analytics_summary() throws Exception {
        // Given: sample size is 5 by default
        String[] docs = {"a1", "a2", "a3"};
        for (String source : docs) {
            for (String target : docs) {
                if (!source.equals(target)) {
                    await(graph.declareRelationship("alpha", source, target, "LINKS", null));
                }
            }
        }
        await(graph.declareRelationship("alpha", "a1", "a2", "CITES", null));

        // When
        IndexAnalytics analytics = await(graph.analytics("alpha"));

        // Then
        assertEquals("alpha", analytics.getIndexName());
        assertEquals(3, analytics.getChunkCount());
        assertEquals(7, analytics.getRelationshipCount());
        assertThat(analytics.getRelationshipTypes()).containsEntry("LINKS", 6L).containsEntry("CITES", 1L);
        assertThat(analytics.getSampleRelationships()).hasSize(5);
    }
}
