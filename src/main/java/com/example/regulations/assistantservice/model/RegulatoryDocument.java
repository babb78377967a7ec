// src/main/java/com/example/regulations/assistantservice/model/RegulatoryDocument.java
package com.example.regulations.assistantservice.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

@Document("documents")
@Data @Builder(toBuilder = true) @NoArgsConstructor @AllArgsConstructor
public class RegulatoryDocument {
    @Id
    private String sourceId;              // document_number assigned by the source API
    private String title;
    @Indexed
    private String agencyId;
    private String agencyName;
    private String documentType;
    @Indexed
    private LocalDate publicationDate;
    private String text;
    private String checksum;              // SHA-256 of the normalized content
    private String revision;              // source-side revision marker, if any
    private String sourceUrl;
    private Instant lastFetchedAt;
    private Instant lastModifiedAt;
    private String embeddingModelVersion;
    private String activeGeneration;      // chunk generation visible to readers
    private int chunkCount;
}
