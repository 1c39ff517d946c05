package com.purchasingpower.ragstore.embedding.impl;

import com.purchasingpower.ragstore.configuration.AsyncConfig;
import com.purchasingpower.ragstore.embedding.EmbeddingProvider;
import com.purchasingpower.ragstore.embedding.EmbeddingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

@Slf4j
@Service
public class EmbeddingServiceImpl implements EmbeddingService {

    private final EmbeddingProvider provider;
    private final AsyncTaskExecutor executor;

    public EmbeddingServiceImpl(EmbeddingProvider provider,
                                @Qualifier(AsyncConfig.EMBEDDING_EXECUTOR) AsyncTaskExecutor executor) {
        this.provider = provider;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<List<Double>> embed(String text) {
        CompletableFuture<List<Double>> result = new CompletableFuture<>();
        Future<?> task = executor.submit(() -> {
            if (result.isDone()) {
                return;
            }
            try {
                result.complete(provider.embed(text));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((vector, error) -> {
            if (result.isCancelled()) {
                log.debug("Embedding request cancelled, interrupting provider call");
                task.cancel(true);
            }
        });
        return result;
    }

    @Override
    public int dimension() {
        return provider.dimension();
    }
}
