package com.purchasingpower.ragstore.search;

import java.util.concurrent.CompletableFuture;

/**
 * Ranked retrieval over one index.
 *
 * <p>The strategy (vector, hybrid or graph-augmented) comes from
 * {@code app.search.strategy}. Results never contain chunks from another
 * index.
 */
public interface SearchService {

    /**
     * Run a search.
     *
     * <p>The returned future fails with:
     * <ul>
     *   <li>{@code ValidationException} - blank query, or top_k outside 1..max-top-k</li>
     *   <li>{@code NotFoundException} - unknown index</li>
     *   <li>{@code DimensionMismatchException} - supplied query vector of the wrong length</li>
     *   <li>{@code UpstreamTimeoutException} - deadline passed before ranking finished</li>
     * </ul>
     *
     * <p>Cancelling the future cancels any embedding call still in flight.
     */
    CompletableFuture<SearchResult> search(SearchQuery query);
}
