package com.purchasingpower.ragstore.search;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SearchResult {
    List<RankedChunk> chunks;

    /**
     * Synthesized answer, or null when no synthesizer produced one.
     */
    String answer;
}
