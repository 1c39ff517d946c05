package com.purchasingpower.ragstore.embedding;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous, concurrency-limited access to the configured {@link EmbeddingProvider}.
 *
 * <p>Cancelling a returned future interrupts the running provider call.
 */
public interface EmbeddingService {

    CompletableFuture<List<Double>> embed(String text);

    /**
     * Length of the vectors {@link #embed} produces.
     */
    int dimension();
}
