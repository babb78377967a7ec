package com.example.regulations.assistantservice.model;

public enum RunTrigger {
    SCHEDULED,
    MANUAL,
    HISTORICAL
}
