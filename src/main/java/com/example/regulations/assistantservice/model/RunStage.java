package com.example.regulations.assistantservice.model;

/**
 * Stages of one ingestion run, in execution order.
 */
public enum RunStage {
    FETCHING,
    PROCESSING,
    EMBEDDING,
    COMMITTING;

    public boolean isAfter(RunStage other) {
        return other == null || ordinal() > other.ordinal();
    }
}
