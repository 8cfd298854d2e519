package com.purchasingpower.etlinsight.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for semantic index calls.
 *
 * <p>Index queries run here so the caller can give up after the configured timeout
 * without holding any lock or partial state.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "semanticIndexExecutor")
    public ThreadPoolTaskExecutor semanticIndexExecutor(
            @Value("${catalog.search.executor.core-pool-size:4}") int corePoolSize,
            @Value("${catalog.search.executor.max-pool-size:16}") int maxPoolSize,
            @Value("${catalog.search.executor.queue-capacity:200}") int queueCapacity) {

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("semantic-index-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        log.info("Semantic index executor configured: core={}, max={}, queue={}",
            executor.getCorePoolSize(), executor.getMaxPoolSize(), queueCapacity);

        return executor;
    }
}
