// src/main/java/com/example/regulations/assistantservice/model/PendingDocument.java
package com.example.regulations.assistantservice.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A document that has been fetched but not yet committed to the vector store.
 * Survives restarts so an interrupted run can pick up where it stopped.
 */
@Document("pending_documents")
@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class PendingDocument {
    @Id
    private String sourceId;
    private RegulatoryDocument document;
    @Indexed
    private PendingStage stage;
    @Builder.Default
    private List<DocumentChunk> chunks = new ArrayList<>();
    private String runId;
    private int attempts;
    private String lastError;
    private Instant updatedAt;

    public static PendingDocument fetched(RegulatoryDocument document, String runId, Instant now) {
        return PendingDocument.builder()
                .sourceId(document.getSourceId())
                .document(document)
                .stage(PendingStage.FETCHED)
                .runId(runId)
                .updatedAt(now)
                .build();
    }
}
