package com.example.regulations.assistantservice.service.scheduler;

import com.example.regulations.assistantservice.model.IngestionCheckpoint;
import com.example.regulations.assistantservice.model.PipelineRun;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-local checkpoint store. Copies on the way in and out so callers cannot mutate
 * the stored state behind its back.
 */
@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory")
public class InMemoryCheckpointStore implements CheckpointStore {

    private IngestionCheckpoint checkpoint;
    private final Map<String, PipelineRun> runs = new LinkedHashMap<>();

    @Override
    public synchronized IngestionCheckpoint load() {
        return checkpoint == null ? IngestionCheckpoint.empty() : checkpoint.toBuilder().build();
    }

    @Override
    public synchronized void save(IngestionCheckpoint checkpoint) {
        this.checkpoint = checkpoint.toBuilder().build();
    }

    @Override
    public synchronized void recordRun(PipelineRun run) {
        runs.put(run.getRunId(), run);
    }

    @Override
    public synchronized List<PipelineRun> recentRuns(int limit) {
        List<PipelineRun> all = new ArrayList<>(runs.values());
        all.sort(Comparator.comparing(PipelineRun::getStartedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return List.copyOf(all.subList(0, Math.min(Math.max(0, limit), all.size())));
    }
}
