package com.example.regulations.assistantservice.error;

/**
 * Embedding service failure. Transient failures (timeouts, rate limits) are worth retrying;
 * dimension or model mismatches are not.
 */
public class EmbeddingException extends RegulationsAssistantException {

    private final boolean transientFailure;

    public EmbeddingException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public EmbeddingException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
