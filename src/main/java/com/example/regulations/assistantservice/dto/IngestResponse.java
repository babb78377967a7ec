package com.example.regulations.assistantservice.dto;

public record IngestResponse(String status, String runId) {}
