package com.knowledge.sync.ingestion.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class ExecutorConfig {

    /**
     * Chunking, embedding and graph extraction. When the queue is full the calling sync thread runs
     * the work itself, which slows that sync down instead of rejecting the document.
     */
    @Bean(name = "extractionExecutor")
    public ThreadPoolTaskExecutor extractionExecutor(IngestionProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExtractionPoolSize());
        executor.setMaxPoolSize(properties.getExtractionPoolSize());
        executor.setQueueCapacity(properties.getExtractionQueueCapacity());
        executor.setThreadNamePrefix("extraction-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * Runs syncs that have a timeout. Sized to the concurrency bound, so a permit holder always gets a thread.
     */
    @Bean(name = "syncExecutor")
    public ThreadPoolTaskExecutor syncExecutor(IngestionProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getMaxConcurrentSyncs());
        executor.setMaxPoolSize(properties.getMaxConcurrentSyncs());
        executor.setQueueCapacity(properties.getMaxConcurrentSyncs());
        executor.setThreadNamePrefix("sync-");
        executor.initialize();
        return executor;
    }
}
