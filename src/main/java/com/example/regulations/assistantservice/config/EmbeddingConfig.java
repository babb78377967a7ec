package com.example.regulations.assistantservice.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class EmbeddingConfig {

    @Bean
    EmbeddingModel embeddingModel(
            @Value("${app.embedding.provider:ollama}") String provider,
            @Value("${app.embedding.base-url:http://localhost:11434}") String baseUrl,
            @Value("${app.embedding.api-key:}") String apiKey,
            @Value("${app.embedding.model-version:nomic-embed-text}") String model,
            @Value("${app.embedding.request-timeout:PT60S}") Duration timeout
    ) {
        if ("openai".equalsIgnoreCase(provider)) {
            return OpenAiEmbeddingModel.builder()
                    .baseUrl(baseUrl)
                    .apiKey(apiKey)
                    .modelName(model)
                    .timeout(timeout)
                    .build();
        }
        return OllamaEmbeddingModel.builder()
                .baseUrl(baseUrl)
                .modelName(model)
                .timeout(timeout)
                .build();
    }
}
