package com.purchasingpower.ragstore.search;

import com.purchasingpower.ragstore.model.SearchMode;

import java.util.List;

/**
 * Ranks the chunks of one index snapshot for a query.
 *
 * <p>Implementations are pure functions of the request: no I/O and no shared
 * state, so they can run on any thread.
 */
public interface RetrievalStrategy {

    SearchMode mode();

    /**
     * @return at most {@code request.getTopK()} chunks, best first
     */
    List<RankedChunk> rank(RetrievalRequest request);
}
