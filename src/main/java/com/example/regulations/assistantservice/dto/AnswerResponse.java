package com.example.regulations.assistantservice.dto;

import java.time.LocalDate;
import java.util.List;

public record AnswerResponse(
        String sessionId,
        String query,
        String answer,
        List<Citation> citations,
        Integer retrieved,
        String status
) {
    public record Citation(String documentNumber, String title, String agency, LocalDate publicationDate, double score) {}
}
