package com.example.regulations.assistantservice.service.scheduler;

import com.example.regulations.assistantservice.model.IngestionCheckpoint;
import com.example.regulations.assistantservice.model.PipelineRun;

import java.util.List;

/**
 * Durable home of the ingestion checkpoint and the run log.
 */
public interface CheckpointStore {

    /**
     * @return the stored checkpoint, or {@link IngestionCheckpoint#empty()} on first use
     */
    IngestionCheckpoint load();

    void save(IngestionCheckpoint checkpoint);

    void recordRun(PipelineRun run);

    /**
     * @return most recent runs first
     */
    List<PipelineRun> recentRuns(int limit);
}
