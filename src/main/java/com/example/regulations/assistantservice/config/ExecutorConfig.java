package com.example.regulations.assistantservice.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Bounded pools for every blocking call the service makes. Each concern gets its own pool so a
 * slow embedding service cannot starve chat requests and the other way round.
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService embeddingBatchExecutor(RagProperties properties) {
        return fixed("embed-batch-", properties.getEmbedding().getConcurrency());
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService embeddingCallExecutor(RagProperties properties) {
        return fixed("embed-call-", properties.getEmbedding().getConcurrency() + properties.getLlm().getConcurrency());
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService llmExecutor(RagProperties properties) {
        return fixed("llm-", properties.getLlm().getConcurrency());
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService ingestionExecutor(RagProperties properties) {
        return fixed("ingest-", properties.getIngestion().getProcessingConcurrency());
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService ingestionRunExecutor() {
        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("ingest-run-"));
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    private static ExecutorService fixed(String prefix, int threads) {
        int size = Math.max(1, threads);
        log.debug("Creating pool {} with {} threads", prefix, size);
        return Executors.newFixedThreadPool(size, new CustomizableThreadFactory(prefix));
    }
}
