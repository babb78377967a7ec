package com.example.regulations.assistantservice.service.scheduler;

import com.example.regulations.assistantservice.model.IngestionCheckpoint;
import com.example.regulations.assistantservice.model.PipelineRun;
import com.example.regulations.assistantservice.model.SchedulerState;

public record SchedulerStatus(SchedulerState state,
                              String activeRunId,
                              IngestionCheckpoint checkpoint,
                              PipelineRun lastRun,
                              long stagedDocuments) {}
