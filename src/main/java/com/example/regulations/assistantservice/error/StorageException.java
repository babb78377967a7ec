package com.example.regulations.assistantservice.error;

public class StorageException extends RegulationsAssistantException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
