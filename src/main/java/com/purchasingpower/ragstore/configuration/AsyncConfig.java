package com.purchasingpower.ragstore.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for blocking work.
 *
 * <p>Store calls and embedding calls get separate pools so a slow embedding
 * endpoint never starves index and document operations. The embedding pool
 * size is the embedding concurrency limit.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    public static final String STORE_EXECUTOR = "storeExecutor";
    public static final String EMBEDDING_EXECUTOR = "embeddingExecutor";

    @Bean(name = STORE_EXECUTOR)
    public ThreadPoolTaskExecutor storeExecutor(AppProperties props) {
        ExecutorProperties settings = props.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getStorePoolSize());
        executor.setMaxPoolSize(settings.getStorePoolSize());
        executor.setQueueCapacity(settings.getStoreQueueCapacity());
        executor.setThreadNamePrefix("store-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("✅ Store executor configured: pool={}, queue={}",
            executor.getCorePoolSize(), settings.getStoreQueueCapacity());
        return executor;
    }

    @Bean(name = EMBEDDING_EXECUTOR)
    public ThreadPoolTaskExecutor embeddingExecutor(AppProperties props) {
        int concurrency = props.getEmbedding().getMaxConcurrency();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        // Unbounded queue: callers wait for a permit instead of being rejected.
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("embedding-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        log.info("✅ Embedding executor configured: concurrency={}", concurrency);
        return executor;
    }
}
