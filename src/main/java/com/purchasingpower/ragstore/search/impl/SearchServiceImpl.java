package com.purchasingpower.ragstore.search.impl;

import com.purchasingpower.ragstore.configuration.AppProperties;
import com.purchasingpower.ragstore.configuration.AsyncConfig;
import com.purchasingpower.ragstore.configuration.SearchProperties;
import com.purchasingpower.ragstore.embedding.EmbeddingService;
import com.purchasingpower.ragstore.exception.DimensionMismatchException;
import com.purchasingpower.ragstore.exception.UpstreamTimeoutException;
import com.purchasingpower.ragstore.exception.ValidationException;
import com.purchasingpower.ragstore.model.IndexSnapshot;
import com.purchasingpower.ragstore.search.AnswerSynthesizer;
import com.purchasingpower.ragstore.search.RankedChunk;
import com.purchasingpower.ragstore.search.RetrievalRequest;
import com.purchasingpower.ragstore.search.RetrievalStrategy;
import com.purchasingpower.ragstore.search.SearchQuery;
import com.purchasingpower.ragstore.search.SearchResult;
import com.purchasingpower.ragstore.search.SearchService;
import com.purchasingpower.ragstore.storage.DocumentStore;
import com.purchasingpower.ragstore.util.EmbeddingVectors;
import com.purchasingpower.ragstore.util.Futures;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Implementation of SearchService.
 *
 * <p>Pipeline: validate, then read the index snapshot (store pool) and embed
 * the query (embedding pool) concurrently, rank with the configured
 * {@link RetrievalStrategy}, drop anything outside the requested index, and
 * finally consult the {@link AnswerSynthesizer}.
 *
 * <p>The returned future is completed either with the full result or with an
 * error. When it fails, is cancelled, or passes its deadline, the embedding
 * call is cancelled as well.
 */
@Slf4j
@Service
public class SearchServiceImpl implements SearchService {

    private final DocumentStore store;
    private final EmbeddingService embeddingService;
    private final AnswerSynthesizer answerSynthesizer;
    private final RetrievalStrategy strategy;
    private final SearchProperties settings;
    private final Executor storeExecutor;

    public SearchServiceImpl(DocumentStore store,
                             EmbeddingService embeddingService,
                             AnswerSynthesizer answerSynthesizer,
                             List<RetrievalStrategy> strategies,
                             AppProperties props,
                             @Qualifier(AsyncConfig.STORE_EXECUTOR) Executor storeExecutor) {
        this.store = store;
        this.embeddingService = embeddingService;
        this.answerSynthesizer = answerSynthesizer;
        this.settings = props.getSearch();
        this.storeExecutor = storeExecutor;
        this.strategy = strategies.stream()
            .filter(candidate -> candidate.mode() == settings.getStrategy())
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("No retrieval strategy for mode " + settings.getStrategy()));
        log.info("🔍 Search strategy: {} (vector weight {})", strategy.mode(), settings.getVectorWeight());
    }

    @Override
    public CompletableFuture<SearchResult> search(SearchQuery query) {
        try {
            validate(query);
        } catch (ValidationException e) {
            return CompletableFuture.failedFuture(e);
        }

        String indexName = query.getIndexName();
        List<String> terms = Scoring.terms(query.getQuery(), query.getKeywords());
        log.debug("Search index={} topK={} terms={} mode={}", indexName, query.getTopK(), terms, strategy.mode());

        CompletableFuture<IndexSnapshot> snapshot =
            CompletableFuture.supplyAsync(() -> store.snapshot(indexName), storeExecutor);
        CompletableFuture<List<Double>> queryVector = query.getEmbedding() != null
            ? CompletableFuture.completedFuture(query.getEmbedding())
            : embeddingService.embed(query.getQuery());

        CompletableFuture<SearchResult> pipeline = snapshot
            .thenCombine(queryVector, (snap, vector) -> rank(query, terms, snap, vector))
            .thenCompose(ranked -> answerSynthesizer.synthesize(query.getQuery(), ranked)
                .thenApply(answer -> SearchResult.builder().chunks(ranked).answer(answer).build()));

        CompletableFuture<SearchResult> outcome = new CompletableFuture<>();
        pipeline.whenComplete((result, error) -> {
            if (error != null) {
                outcome.completeExceptionally(Futures.unwrap(error));
            } else {
                outcome.complete(result);
            }
        });

        long timeoutMs = query.getTimeoutMs() != null ? query.getTimeoutMs() : settings.getDefaultTimeoutMs();
        CompletableFuture.delayedExecutor(timeoutMs, TimeUnit.MILLISECONDS).execute(() -> {
            if (outcome.completeExceptionally(new UpstreamTimeoutException(
                    "Search on index '" + indexName + "' exceeded " + timeoutMs + "ms"))) {
                log.warn("⏱️ Search on {} timed out after {}ms", indexName, timeoutMs);
            }
        });

        outcome.whenComplete((result, error) -> {
            if (error != null) {
                queryVector.cancel(true);
                snapshot.cancel(true);
                pipeline.cancel(true);
            }
        });
        return outcome;
    }

    private void validate(SearchQuery query) {
        if (query.getIndexName() == null || query.getIndexName().isBlank()) {
            throw new ValidationException("index_name must not be blank");
        }
        if (query.getQuery() == null || query.getQuery().isBlank()) {
            throw new ValidationException("query must not be blank");
        }
        if (query.getTopK() <= 0 || query.getTopK() > settings.getMaxTopK()) {
            throw new ValidationException("top_k must be between 1 and " + settings.getMaxTopK()
                + ", got " + query.getTopK());
        }
        if (query.getTimeoutMs() != null && query.getTimeoutMs() <= 0) {
            throw new ValidationException("timeout_ms must be positive");
        }
        EmbeddingVectors.requireFinite("embedding", query.getEmbedding());
    }

    private List<RankedChunk> rank(SearchQuery query, List<String> terms, IndexSnapshot snapshot, List<Double> vector) {
        int dimension = snapshot.getIndex().getDimension();
        if (query.getEmbedding() != null && query.getEmbedding().size() != dimension) {
            throw new DimensionMismatchException(query.getIndexName(), dimension, query.getEmbedding().size());
        }

        List<RankedChunk> ranked = strategy.rank(RetrievalRequest.builder()
            .snapshot(snapshot)
            .queryVector(vector)
            .terms(terms)
            .topK(query.getTopK())
            .build());

        List<RankedChunk> isolated = new ArrayList<>(ranked.size());
        for (RankedChunk candidate : ranked) {
            if (query.getIndexName().equals(candidate.getChunk().getIndexName())) {
                isolated.add(candidate);
            } else {
                log.error("Dropping chunk {} of index {} from results for index {}",
                    candidate.getChunk().getDocId(), candidate.getChunk().getIndexName(), query.getIndexName());
            }
        }
        return isolated;
    }
}
