package com.purchasingpower.ragstore.search.impl;

import com.purchasingpower.ragstore.TestFixtures;
import com.purchasingpower.ragstore.configuration.AppProperties;
import com.purchasingpower.ragstore.embedding.EmbeddingProvider;
import com.purchasingpower.ragstore.embedding.impl.EmbeddingServiceImpl;
import com.purchasingpower.ragstore.embedding.impl.HashingEmbeddingProvider;
import com.purchasingpower.ragstore.exception.DimensionMismatchException;
import com.purchasingpower.ragstore.exception.NotFoundException;
import com.purchasingpower.ragstore.exception.UpstreamTimeoutException;
import com.purchasingpower.ragstore.exception.ValidationException;
import com.purchasingpower.ragstore.model.DocumentChunk;
import com.purchasingpower.ragstore.model.RagIndex;
import com.purchasingpower.ragstore.model.SearchMode;
import com.purchasingpower.ragstore.model.metadata.MetadataValue;
import com.purchasingpower.ragstore.search.RankedChunk;
import com.purchasingpower.ragstore.search.SearchQuery;
import com.purchasingpower.ragstore.search.SearchResult;
import com.purchasingpower.ragstore.storage.impl.InMemoryDocumentStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.purchasingpower.ragstore.TestFixtures.await;
import static com.purchasingpower.ragstore.TestFixtures.failureOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Search service")
class SearchServiceImplTest {

    private ThreadPoolTaskExecutor storeExecutor;
    private ThreadPoolTaskExecutor embeddingExecutor;
    private InMemoryDocumentStore store;
    private AppProperties props;

    @BeforeEach
    void setUp() {
        storeExecutor = TestFixtures.executor("store-", 4);
        embeddingExecutor = TestFixtures.executor("embed-", 2);
        store = new InMemoryDocumentStore();
        props = TestFixtures.properties();
    }

    @AfterEach
    void tearDown() {
        storeExecutor.shutdown();
        embeddingExecutor.shutdown();
    }

    @Test
    @DisplayName("Results only ever come from the requested index")
    void search_isolatesIndexes() throws Exception {
        // Given: same wording in two indexes
        HashingEmbeddingProvider provider = new HashingEmbeddingProvider(TestFixtures.DIMENSION);
        createIndex("alpha", TestFixtures.DIMENSION);
        createIndex("beta", TestFixtures.DIMENSION);
        for (int i = 0; i < 4; i++) {
            ingest(provider, "alpha", "alpha-" + i, "shared quarterly strategy " + i);
            ingest(provider, "beta", "beta-" + i, "shared quarterly strategy " + i);
        }
        SearchServiceImpl service = service(provider);

        // When
        SearchResult result = await(service.search(query("alpha", "quarterly strategy", 10)));

        // Then
        assertThat(result.getChunks()).hasSize(4);
        assertThat(result.getChunks()).allSatisfy(ranked -> {
            assertEquals("alpha", ranked.getChunk().getIndexName());
            assertEquals(MetadataValue.of("alpha"), ranked.getChunk().getMetadata().get("source"));
        });
        assertNull(result.getAnswer());
    }

    @Test
    @DisplayName("A large enough top_k returns every chunk exactly once")
    void search_coversWholeIndex() throws Exception {
        HashingEmbeddingProvider provider = new HashingEmbeddingProvider(TestFixtures.DIMENSION);
        createIndex("alpha", TestFixtures.DIMENSION);
        for (int i = 0; i < 8; i++) {
            ingest(provider, "alpha", "doc-" + i, "note number " + i);
        }

        SearchResult result = await(service(provider).search(query("alpha", "unrelated words", 8)));

        Set<String> ids = new HashSet<>();
        for (RankedChunk ranked : result.getChunks()) {
            ids.add(ranked.getChunk().getDocId());
        }
        assertEquals(8, ids.size());
        assertEquals(8, result.getChunks().size());
        assertThat(result.getChunks()).isSortedAccordingTo(RankedChunk.BY_RELEVANCE);
    }

    @Test
    @DisplayName("Every chunk of a document sharing a unique token is returned when top_k leaves room")
    void search_returnsAllChunksOfOneDocument() throws Exception {
        // Given: three chunks of one document mixed in with twelve unrelated ones
        HashingEmbeddingProvider provider = new HashingEmbeddingProvider(TestFixtures.DIMENSION);
        createIndex("alpha", TestFixtures.DIMENSION);
        List<String> zephyrIds = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            if (i % 5 == 2) {
                String docId = "zephyr-part-" + zephyrIds.size();
                ingest(provider, "alpha", docId, "zephyr rollout plan part " + zephyrIds.size());
                zephyrIds.add(docId);
            } else {
                ingest(provider, "alpha", "other-" + i, "quarterly budget review note " + i);
            }
        }

        // When
        SearchResult result = await(service(provider).search(query("alpha", "zephyr", zephyrIds.size() + 2)));

        // Then
        assertThat(result.getChunks()).hasSize(zephyrIds.size() + 2);
        assertThat(result.getChunks()).extracting(ranked -> ranked.getChunk().getDocId())
            .containsAll(zephyrIds)
            .doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Invalid requests fail validation before touching the store")
    void search_validation() throws Exception {
        SearchServiceImpl service = service(new HashingEmbeddingProvider(TestFixtures.DIMENSION));

        assertThat(failureOf(service.search(query("alpha", "q", 0)))).isInstanceOf(ValidationException.class);
        assertThat(failureOf(service.search(query("alpha", "q", 101)))).isInstanceOf(ValidationException.class);
        assertThat(failureOf(service.search(query("alpha", "   ", 5)))).isInstanceOf(ValidationException.class);
        assertThat(failureOf(service.search(query("", "q", 5)))).isInstanceOf(ValidationException.class);
        assertThat(failureOf(service.search(SearchQuery.builder()
            .indexName("alpha").query("q").topK(5).timeoutMs(0L).build())))
            .isInstanceOf(ValidationException.class);
        assertThat(failureOf(service.search(SearchQuery.builder()
            .indexName("alpha").query("q").topK(5).embedding(Arrays.asList(null, 1.0)).build())))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("embedding[0]");
        assertThat(failureOf(service.search(SearchQuery.builder()
            .indexName("alpha").query("q").topK(5).embedding(List.of(1.0, Double.NaN)).build())))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Unknown index fails NotFound")
    void search_missingIndex() throws Exception {
        SearchServiceImpl service = service(new HashingEmbeddingProvider(TestFixtures.DIMENSION));

        assertThat(failureOf(service.search(query("ghost", "anything", 5)))).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("A supplied query embedding must match the index dimension")
    void search_suppliedEmbeddingMismatch() throws Exception {
        createIndex("alpha", TestFixtures.DIMENSION);
        SearchServiceImpl service = service(new HashingEmbeddingProvider(TestFixtures.DIMENSION));

        Throwable failure = failureOf(service.search(SearchQuery.builder()
            .indexName("alpha").query("q").topK(5).embedding(List.of(1.0, 0.0)).build()));

        assertThat(failure).isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    @DisplayName("Alpha index end to end: keyword search only returns alpha-sourced chunks")
    void search_alphaEndToEnd() throws Exception {
        // Given
        HashingEmbeddingProvider provider = new HashingEmbeddingProvider(1536);
        createIndex("alpha", 1536);
        ingest(provider, "alpha", "s1", "alpha strategy insights for the next quarter");
        ingest(provider, "alpha", "s2", "alpha roadmap milestones and owners");
        props.getSearch().setStrategy(SearchMode.HYBRID);

        // When
        SearchResult result = await(service(provider).search(SearchQuery.builder()
            .indexName("alpha")
            .query("alpha strategy")
            .keywords(List.of("alpha", "strategy"))
            .topK(5)
            .build()));

        // Then
        assertThat(result.getChunks()).isNotEmpty();
        assertThat(result.getChunks()).allSatisfy(ranked ->
            assertEquals(MetadataValue.of("alpha"), ranked.getChunk().getMetadata().get("source")));
        assertEquals("s1", result.getChunks().get(0).getChunk().getDocId());
    }

    @Test
    @DisplayName("Passing the deadline fails UpstreamTimeout and interrupts the embedding call")
    void search_timeoutInterruptsEmbedding() throws Exception {
        // Given
        createIndex("alpha", TestFixtures.DIMENSION);
        BlockingProvider provider = new BlockingProvider();
        SearchServiceImpl service = service(provider);

        // When
        CompletableFuture<SearchResult> future = service.search(SearchQuery.builder()
            .indexName("alpha").query("slow").topK(5).timeoutMs(200L).build());

        // Then
        assertThat(failureOf(future)).isInstanceOf(UpstreamTimeoutException.class);
        assertTrue(provider.interrupted.await(5, TimeUnit.SECONDS), "embedding call was not interrupted");
    }

    @Test
    @DisplayName("Cancelling a search interrupts the in-flight embedding call")
    void search_cancelInterruptsEmbedding() throws Exception {
        createIndex("alpha", TestFixtures.DIMENSION);
        BlockingProvider provider = new BlockingProvider();
        CompletableFuture<SearchResult> future = service(provider).search(query("alpha", "slow", 5));
        assertTrue(provider.started.await(5, TimeUnit.SECONDS));

        future.cancel(true);

        assertTrue(provider.interrupted.await(5, TimeUnit.SECONDS), "embedding call was not interrupted");
        assertTrue(future.isCancelled());
    }

    private SearchServiceImpl service(EmbeddingProvider provider) {
        HybridRetrievalStrategy hybrid = new HybridRetrievalStrategy(props);
        return new SearchServiceImpl(
            store,
            new EmbeddingServiceImpl(provider, embeddingExecutor),
            new NoOpAnswerSynthesizer(),
            List.of(new VectorRetrievalStrategy(), hybrid, new GraphAugmentedRetrievalStrategy(hybrid, props)),
            props,
            storeExecutor);
    }

    private void createIndex(String name, int dimension) {
        Instant now = Instant.now();
        store.createIndex(RagIndex.builder().name(name).dimension(dimension).createdAt(now).updatedAt(now).build());
    }

    private void ingest(EmbeddingProvider provider, String indexName, String docId, String content) {
        Instant now = Instant.now();
        store.insertDocument(DocumentChunk.builder()
            .docId(docId)
            .indexName(indexName)
            .content(content)
            .metadata(Map.of("source", MetadataValue.of(indexName)))
            .embedding(provider.embed(content))
            .createdAt(now)
            .updatedAt(now)
            .build());
    }

    private static SearchQuery query(String indexName, String text, int topK) {
        return SearchQuery.builder().indexName(indexName).query(text).topK(topK).build();
    }

    /**
     * Blocks until interrupted.
     */
    private static final class BlockingProvider implements EmbeddingProvider {
        private final CountDownLatch started = new CountDownLatch(1);
        private final CountDownLatch interrupted = new CountDownLatch(1);

        @Override
        public List<Double> embed(String text) {
            started.countDown();
            try {
                Thread.sleep(60_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException("interrupted");
        }

        @Override
        public int dimension() {
            return TestFixtures.DIMENSION;
        }
    }
}
