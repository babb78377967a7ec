// src/main/java/com/example/regulations/assistantservice/model/IngestionCheckpoint.java
package com.example.regulations.assistantservice.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Single-record ingestion progress: the last good cursor plus the stage reached by the
 * run currently in flight (if any).
 */
@Document("ingestion_checkpoint")
@Data @Builder(toBuilder = true) @NoArgsConstructor @AllArgsConstructor
public class IngestionCheckpoint {
    public static final String DEFAULT_ID = "federal-register";

    @Id
    private String id;
    private LocalDate cursor;             // publication date the next run starts from
    private RunStatus lastRunStatus;
    private String lastRunId;
    private Instant lastRunFinishedAt;

    private String activeRunId;
    private RunTrigger activeRunTrigger;
    private LocalDate activeRunSince;
    private LocalDate activeRunUntil;
    private RunStage lastCompletedStage;
    private Instant updatedAt;

    public static IngestionCheckpoint empty() {
        return IngestionCheckpoint.builder().id(DEFAULT_ID).build();
    }

    public boolean hasActiveRun() {
        return activeRunId != null;
    }

    public void clearActiveRun() {
        activeRunId = null;
        activeRunTrigger = null;
        activeRunSince = null;
        activeRunUntil = null;
        lastCompletedStage = null;
    }
}
