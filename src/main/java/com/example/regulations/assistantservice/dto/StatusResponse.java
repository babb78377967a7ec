package com.example.regulations.assistantservice.dto;

import com.example.regulations.assistantservice.model.PipelineRun;
import com.example.regulations.assistantservice.model.RunStage;
import com.example.regulations.assistantservice.model.RunStatus;
import com.example.regulations.assistantservice.model.SchedulerState;

import java.time.Instant;
import java.time.LocalDate;

public record StatusResponse(
        SchedulerState state,
        String activeRunId,
        RunStage lastCompletedStage,
        LocalDate cursor,
        RunStatus lastRunStatus,
        Instant lastRunFinishedAt,
        PipelineRun lastRun,
        long stagedDocuments,
        int activeSessions
) {}
