package com.purchasingpower.ragstore.embedding;

import java.util.List;

/**
 * Maps text to a fixed-length vector.
 *
 * <p>Implementations are blocking and may be slow; callers go through
 * {@link EmbeddingService}, which runs them on a bounded pool.
 */
public interface EmbeddingProvider {

    /**
     * Compute the embedding of {@code text}.
     *
     * @throws com.purchasingpower.ragstore.exception.UpstreamTimeoutException when retries are exhausted
     * @throws com.purchasingpower.ragstore.exception.UpstreamException on a non-retryable failure
     */
    List<Double> embed(String text);

    /**
     * Length of every vector this provider returns.
     */
    int dimension();
}
