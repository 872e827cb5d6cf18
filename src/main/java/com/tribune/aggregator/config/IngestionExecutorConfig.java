package com.tribune.aggregator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class IngestionExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService ingestionExecutor(@Value("${ingestion.executor-threads:8}") int threads) {
        return Executors.newFixedThreadPool(threads);
    }
}
