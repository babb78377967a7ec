package com.example.regulations.assistantservice.service.query;

import java.time.LocalDate;

public record Citation(
        String documentId,
        String title,
        String agencyId,
        String agencyName,
        LocalDate publicationDate,
        double score
) {}
