package com.example.regulations.assistantservice.dto;

import com.example.regulations.assistantservice.model.RegulatoryDocument;

import java.time.LocalDate;

public record DocumentSummary(
        String documentNumber,
        String title,
        String agency,
        String documentType,
        LocalDate publicationDate,
        String url
) {
    public static DocumentSummary of(RegulatoryDocument doc) {
        return new DocumentSummary(doc.getSourceId(), doc.getTitle(), doc.getAgencyName(), doc.getDocumentType(),
                doc.getPublicationDate(), doc.getSourceUrl());
    }
}
