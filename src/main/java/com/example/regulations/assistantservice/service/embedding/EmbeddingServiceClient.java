package com.example.regulations.assistantservice.service.embedding;

import java.util.concurrent.CompletableFuture;

/**
 * Request/response contract of the external embedding runtime. Implementations must
 * honour {@link CompletableFuture#cancel(boolean)} by abandoning the call.
 */
public interface EmbeddingServiceClient {

    CompletableFuture<EmbeddingResponse> embed(EmbeddingRequest request);
}
