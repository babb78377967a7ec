package com.example.regulations.assistantservice.model;

public enum SchedulerState {
    IDLE,
    FETCHING,
    PROCESSING,
    EMBEDDING,
    COMMITTING,
    FAILED;

    public static SchedulerState of(RunStage stage) {
        return SchedulerState.valueOf(stage.name());
    }

    public boolean isActive() {
        return this != IDLE && this != FAILED;
    }
}
