package com.purchasingpower.ragstore.search;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Turns retrieved chunks into a natural-language answer.
 *
 * <p>A future completing with {@code null} means no answer; the field is then
 * omitted from the response.
 */
public interface AnswerSynthesizer {

    CompletableFuture<String> synthesize(String query, List<RankedChunk> chunks);
}
