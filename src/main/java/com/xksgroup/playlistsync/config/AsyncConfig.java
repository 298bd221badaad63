package com.xksgroup.playlistsync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools of the sync engine. Sync flows and chunk writers get separate pools
 * so a writer can never wait for a slot taken by the flow that feeds it.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "syncExecutor")
    public ThreadPoolTaskExecutor syncExecutor(
            @Value("${playlist.sync.executor.core-pool-size:4}") int corePoolSize,
            @Value("${playlist.sync.executor.max-pool-size:8}") int maxPoolSize,
            @Value("${playlist.sync.executor.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("sync-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        log.info("Sync executor ready (core={}, max={}, queue={})", corePoolSize, maxPoolSize, queueCapacity);
        return executor;
    }

    @Bean(name = "chunkWriterExecutor")
    public ThreadPoolTaskExecutor chunkWriterExecutor(
            @Value("${playlist.sync.executor.max-pool-size:8}") int maxPoolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        // One writer per running sync, the producer must never run its own writer
        executor.setCorePoolSize(maxPoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(maxPoolSize * 4);
        executor.setThreadNamePrefix("chunk-writer-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }
}
