package com.finlens.backend.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncExecutorConfig {

    @Bean(name = "statementChunkTaskExecutor")
    public Executor statementChunkTaskExecutor(PipelineProperties pipelineProperties) {
        int workers = Math.max(1, pipelineProperties.getMaxWorkers());
        int chunkSize = Math.max(1, pipelineProperties.getChunkSize());
        int maxChunks = (pipelineProperties.getMaxRows() + chunkSize - 1) / chunkSize;
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        // Every chunk of a full batch must fit in the queue.
        executor.setQueueCapacity(Math.max(200, maxChunks));
        executor.setThreadNamePrefix("statement-chunk-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "exchangeRateTaskExecutor")
    public Executor exchangeRateTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("exchange-rate-");
        executor.initialize();
        return executor;
    }
}
