// src/main/java/com/example/regulations/assistantservice/model/PipelineRun.java
package com.example.regulations.assistantservice.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

@Document("pipeline_runs")
@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class PipelineRun {
    @Id
    private String runId;
    private LocalDate runDate;
    private RunTrigger trigger;
    private LocalDate since;
    private LocalDate until;
    private int documentsFetched;
    private int documentsSkipped;
    private int recordsProcessed;         // documents committed to the vector store
    private int failedPages;
    private int failedDocuments;
    private int failedBatches;
    private boolean resumed;
    private RunStatus status;
    private String errorMessage;
    private Instant startedAt;
    private Instant finishedAt;
}
