package com.example.regulations.assistantservice.model;

public enum RunStatus {
    SUCCESS,
    PARTIAL,
    FAILED
}
