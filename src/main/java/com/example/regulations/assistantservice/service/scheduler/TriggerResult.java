package com.example.regulations.assistantservice.service.scheduler;

import com.example.regulations.assistantservice.model.PipelineRun;

/**
 * What happened to a run request.
 *
 * @param run the finished run for {@link Outcome#COMPLETED}, otherwise null
 */
public record TriggerResult(Outcome outcome, String runId, PipelineRun run) {

    public enum Outcome {
        COMPLETED,
        STARTED,
        /** another run was active; nothing was done */
        COALESCED
    }

    static TriggerResult completed(PipelineRun run) {
        return new TriggerResult(Outcome.COMPLETED, run.getRunId(), run);
    }

    static TriggerResult started(String runId) {
        return new TriggerResult(Outcome.STARTED, runId, null);
    }

    static TriggerResult coalesced(String activeRunId) {
        return new TriggerResult(Outcome.COALESCED, activeRunId, null);
    }
}
