package com.example.regulations.assistantservice.error;

/**
 * Base type for failures raised by the ingestion and query pipelines.
 */
public class RegulationsAssistantException extends RuntimeException {

    public RegulationsAssistantException(String message) {
        super(message);
    }

    public RegulationsAssistantException(String message, Throwable cause) {
        super(message, cause);
    }
}
