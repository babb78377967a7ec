package com.example.regulations.assistantservice.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * @param history optional client-held history; replaces the server-side session history when present
 */
public record ChatRequest(
        String sessionId,
        @NotBlank String message,
        @Valid List<HistoryMessage> history,
        @Positive Integer timeoutSeconds
) {
    public record HistoryMessage(@NotBlank String role, String content) {}
}
