package com.purchasingpower.ragstore.search.impl;

import com.purchasingpower.ragstore.configuration.AppProperties;
import com.purchasingpower.ragstore.model.DocumentChunk;
import com.purchasingpower.ragstore.model.SearchMode;
import com.purchasingpower.ragstore.search.RankedChunk;
import com.purchasingpower.ragstore.search.RetrievalRequest;
import com.purchasingpower.ragstore.search.RetrievalStrategy;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fuses vector similarity with keyword overlap.
 *
 * <p>Both signals are min-max normalized over the index's chunks and combined
 * as {@code w * vector + (1 - w) * keyword}. Neither signal looks at a chunk's
 * position in its source document.
 */
@Component
public class HybridRetrievalStrategy implements RetrievalStrategy {

    private final double vectorWeight;

    @Autowired
    public HybridRetrievalStrategy(AppProperties props) {
        this(props.getSearch().getVectorWeight());
    }

    public HybridRetrievalStrategy(double vectorWeight) {
        this.vectorWeight = vectorWeight;
    }

    @Override
    public SearchMode mode() {
        return SearchMode.HYBRID;
    }

    @Override
    public List<RankedChunk> rank(RetrievalRequest request) {
        List<RankedChunk> all = scoreAll(request);
        return new ArrayList<>(all.subList(0, Math.min(request.getTopK(), all.size())));
    }

    /**
     * Fused scores for every chunk of the snapshot, best first.
     */
    List<RankedChunk> scoreAll(RetrievalRequest request) {
        List<DocumentChunk> chunks = request.getSnapshot().getChunks();
        double[] vector = new double[chunks.size()];
        double[] keyword = new double[chunks.size()];
        for (int i = 0; i < chunks.size(); i++) {
            DocumentChunk chunk = chunks.get(i);
            vector[i] = Scoring.cosine(request.getQueryVector(), chunk.getEmbedding());
            keyword[i] = Scoring.keywordScore(request.getTerms(), chunk);
        }

        double[] normalizedVector = Scoring.normalize(vector);
        double[] normalizedKeyword = Scoring.normalize(keyword);

        List<RankedChunk> ranked = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            double score = vectorWeight * normalizedVector[i] + (1.0 - vectorWeight) * normalizedKeyword[i];
            ranked.add(new RankedChunk(chunks.get(i), score));
        }
        ranked.sort(RankedChunk.BY_RELEVANCE);
        return ranked;
    }
}
