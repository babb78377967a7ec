package com.example.regulations.assistantservice.model;

public enum PendingStage {
    FETCHED,
    CHUNKED,
    EMBEDDED
}
