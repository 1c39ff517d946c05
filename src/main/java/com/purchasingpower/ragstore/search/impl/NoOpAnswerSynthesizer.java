package com.purchasingpower.ragstore.search.impl;

import com.purchasingpower.ragstore.search.AnswerSynthesizer;
import com.purchasingpower.ragstore.search.RankedChunk;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Default synthesizer: never produces an answer.
 */
@Component
public class NoOpAnswerSynthesizer implements AnswerSynthesizer {

    @Override
    public CompletableFuture<String> synthesize(String query, List<RankedChunk> chunks) {
        return CompletableFuture.completedFuture(null);
    }
}
