package com.example.regulations.assistantservice.error;

/** Raised for an unusable segmentation configuration. */
public class ChunkingException extends RegulationsAssistantException {

    public ChunkingException(String message) {
        super(message);
    }
}
