package com.example.regulations.assistantservice.config;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LlmConfig {

    @Bean
    ChatLanguageModel chatModel(
            @Value("${app.llm.provider:ollama}") String provider,
            @Value("${app.llm.base-url:http://localhost:11434}") String baseUrl,
            @Value("${app.llm.api-key:}") String apiKey,
            @Value("${app.llm.model:llama3.1}") String model,
            @Value("${app.llm.temperature:0.2}") double temperature,
            @Value("${app.llm.max-tokens:1024}") int maxTokens,
            @Value("${app.llm.request-timeout:PT120S}") Duration timeout) {
        if ("openai".equalsIgnoreCase(provider)) {
            return OpenAiChatModel.builder()
                    .baseUrl(baseUrl)
                    .apiKey(apiKey)
                    .modelName(model)
                    .temperature(temperature)
                    .maxTokens(maxTokens)
                    .timeout(timeout)
                    .build();
        }
        return OllamaChatModel.builder()
                .baseUrl(baseUrl)
                .modelName(model)
                .temperature(temperature)
                .numPredict(maxTokens)
                .timeout(timeout)
                .build();
    }
}
