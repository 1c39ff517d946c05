package com.purchasingpower.ragstore;

import com.purchasingpower.ragstore.configuration.AppProperties;
import com.purchasingpower.ragstore.model.DocumentChunk;
import com.purchasingpower.ragstore.model.metadata.MetadataValue;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Shared builders for unit tests that wire services by hand.
 */
public final class TestFixtures {

    public static final int DIMENSION = 64;

    private TestFixtures() {
    }

    public static AppProperties properties() {
        AppProperties props = new AppProperties();
        props.getEmbedding().setDimension(DIMENSION);
        props.getIndex().setDefaultDimension(DIMENSION);
        props.getSearch().setDefaultTimeoutMs(10_000);
        return props;
    }

    public static DocumentChunk chunk(String docId, String indexName, String content,
                                      List<Double> embedding, Instant updatedAt) {
        return DocumentChunk.builder()
            .docId(docId)
            .indexName(indexName)
            .content(content)
            .metadata(Map.of("source", MetadataValue.of(indexName)))
            .embedding(embedding)
            .createdAt(updatedAt)
            .updatedAt(updatedAt)
            .build();
    }

    public static ThreadPoolTaskExecutor executor(String prefix, int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix(prefix);
        executor.initialize();
        return executor;
    }

    public static <T> T await(CompletableFuture<T> future) throws Exception {
        try {
            return future.get(10, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * The exception a future failed with, unwrapped.
     */
    public static Throwable failureOf(CompletableFuture<?> future) throws InterruptedException, TimeoutException {
        try {
            future.get(10, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            return e.getCause();
        }
        throw new AssertionError("Expected the future to fail but it completed normally");
    }
}
