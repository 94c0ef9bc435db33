package com.example.renderflow_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for {@link com.example.renderflow_backend.service.BatchWorker}: claimed batches run on
 * {@code batchTaskExecutor}, their items fan out on {@code itemTaskExecutor}.
 */
@Configuration
@EnableConfigurationProperties(WorkerExecutorProperties.class)
public class WorkerExecutorConfig {

    @Bean(name = "batchTaskExecutor")
    public ThreadPoolTaskExecutor batchTaskExecutor(WorkerExecutorProperties properties) {
        int threads = Math.max(properties.getBatch().getThreads(), properties.getMaxConcurrentBatches());
        return pool(threads, properties.getBatch().getQueueCapacity(), "batch-");
    }

    @Bean(name = "itemTaskExecutor")
    public ThreadPoolTaskExecutor itemTaskExecutor(WorkerExecutorProperties properties) {
        return pool(properties.getItem().getThreads(), properties.getItem().getQueueCapacity(), "item-");
    }

    private static ThreadPoolTaskExecutor pool(int threads, int queueCapacity, String prefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, threads));
        executor.setMaxPoolSize(Math.max(1, threads));
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
