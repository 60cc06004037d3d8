package com.momoledger.config;

import com.momoledger.ingestion.config.IngestionProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. ingestion-executor runs the per-message save tasks of one batch;
 * it is sized to the batch so a whole batch is in flight at once.
 */
@Configuration
public class AsyncConfig {

    public static final String INGESTION_EXECUTOR = "ingestion-executor";

    @Bean(name = INGESTION_EXECUTOR)
    public Executor ingestionExecutor(IngestionProperties ingestionProperties) {
        int size = Math.max(1, ingestionProperties.getBatchSize());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(size);
        e.setMaxPoolSize(size);
        e.setThreadNamePrefix("ingestion-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.initialize();
        return e;
    }
}
