package com.example.regulations.assistantservice.service.scheduler;

import com.example.regulations.assistantservice.error.StorageException;
import com.example.regulations.assistantservice.model.IngestionCheckpoint;
import com.example.regulations.assistantservice.model.PipelineRun;
import com.example.regulations.assistantservice.repo.IngestionCheckpointRepository;
import com.example.regulations.assistantservice.repo.PipelineRunRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.store.type", havingValue = "mongo", matchIfMissing = true)
public class MongoCheckpointStore implements CheckpointStore {

    private final IngestionCheckpointRepository checkpoints;
    private final PipelineRunRepository runs;

    @Override
    public IngestionCheckpoint load() {
        try {
            return checkpoints.findById(IngestionCheckpoint.DEFAULT_ID).orElseGet(IngestionCheckpoint::empty);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load ingestion checkpoint", e);
        }
    }

    @Override
    public void save(IngestionCheckpoint checkpoint) {
        try {
            checkpoints.save(checkpoint);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to save ingestion checkpoint", e);
        }
    }

    @Override
    public void recordRun(PipelineRun run) {
        try {
            runs.save(run);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to record pipeline run " + run.getRunId(), e);
        }
    }

    @Override
    public List<PipelineRun> recentRuns(int limit) {
        try {
            return runs.findAllByOrderByStartedAtDesc(PageRequest.of(0, Math.max(1, limit)));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list pipeline runs", e);
        }
    }
}
