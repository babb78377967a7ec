package com.example.regulations.assistantservice.service.query;

import java.util.concurrent.CompletableFuture;

/**
 * Async access to the chat model. Cancelling the returned future abandons the call.
 */
public interface LanguageModelClient {

    CompletableFuture<GenerationResponse> generate(GenerationRequest request);
}
