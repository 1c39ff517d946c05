package com.purchasingpower.ragstore.search;

import com.purchasingpower.ragstore.model.DocumentChunk;
import lombok.Value;

import java.util.Comparator;

/**
 * A chunk with its relevance score for one query.
 */
@Value
public class RankedChunk {

    /**
     * Score descending, then most recently updated, then doc id ascending.
     */
    public static final Comparator<RankedChunk> BY_RELEVANCE =
        Comparator.comparingDouble(RankedChunk::getScore).reversed()
            .thenComparing((RankedChunk ranked) -> ranked.getChunk().getUpdatedAt(), Comparator.reverseOrder())
            .thenComparing(ranked -> ranked.getChunk().getDocId());

    DocumentChunk chunk;
    double score;
}
