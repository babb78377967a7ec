package com.example.regulations.assistantservice.model;

import java.time.LocalDate;

/**
 * One ranked hit of a vector search. Lives only for the duration of a query.
 */
public record RetrievalResult(
        String documentId,
        int sequenceIndex,
        String text,
        int tokenCount,
        double similarity,
        double score,
        String title,
        String agencyId,
        String agencyName,
        LocalDate publicationDate
) {}
