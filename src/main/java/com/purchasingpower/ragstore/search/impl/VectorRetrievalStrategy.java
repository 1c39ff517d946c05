package com.purchasingpower.ragstore.search.impl;

import com.purchasingpower.ragstore.model.DocumentChunk;
import com.purchasingpower.ragstore.model.SearchMode;
import com.purchasingpower.ragstore.search.RankedChunk;
import com.purchasingpower.ragstore.search.RetrievalRequest;
import com.purchasingpower.ragstore.search.RetrievalStrategy;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw cosine similarity; keywords are ignored.
 */
@Component
public class VectorRetrievalStrategy implements RetrievalStrategy {

    @Override
    public SearchMode mode() {
        return SearchMode.VECTOR;
    }

    @Override
    public List<RankedChunk> rank(RetrievalRequest request) {
        List<RankedChunk> ranked = new ArrayList<>();
        for (DocumentChunk chunk : request.getSnapshot().getChunks()) {
            ranked.add(new RankedChunk(chunk, Scoring.cosine(request.getQueryVector(), chunk.getEmbedding())));
        }
        ranked.sort(RankedChunk.BY_RELEVANCE);
        return new ArrayList<>(ranked.subList(0, Math.min(request.getTopK(), ranked.size())));
    }
}
