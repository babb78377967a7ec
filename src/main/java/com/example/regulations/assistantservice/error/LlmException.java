package com.example.regulations.assistantservice.error;

public class LlmException extends RegulationsAssistantException {

    private final boolean timeout;

    public LlmException(String message) {
        super(message);
        this.timeout = false;
    }

    public LlmException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
