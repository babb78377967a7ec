package com.example.regulations.assistantservice.error;

public class RetrievalException extends RegulationsAssistantException {

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
