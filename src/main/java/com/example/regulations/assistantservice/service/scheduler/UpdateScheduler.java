// src/main/java/com/example/regulations/assistantservice/service/scheduler/UpdateScheduler.java
package com.example.regulations.assistantservice.service.scheduler;

import com.example.regulations.assistantservice.config.RagProperties;
import com.example.regulations.assistantservice.error.ChunkingException;
import com.example.regulations.assistantservice.error.IngestionException;
import com.example.regulations.assistantservice.error.StorageException;
import com.example.regulations.assistantservice.model.DocumentChunk;
import com.example.regulations.assistantservice.model.DocumentFingerprint;
import com.example.regulations.assistantservice.model.IngestionCheckpoint;
import com.example.regulations.assistantservice.model.PendingDocument;
import com.example.regulations.assistantservice.model.PendingStage;
import com.example.regulations.assistantservice.model.PipelineRun;
import com.example.regulations.assistantservice.model.RegulatoryDocument;
import com.example.regulations.assistantservice.model.RunStage;
import com.example.regulations.assistantservice.model.RunStatus;
import com.example.regulations.assistantservice.model.RunTrigger;
import com.example.regulations.assistantservice.model.SchedulerState;
import com.example.regulations.assistantservice.model.TextChunk;
import com.example.regulations.assistantservice.service.chunk.TextChunker;
import com.example.regulations.assistantservice.service.embedding.BatchEmbeddingResult;
import com.example.regulations.assistantservice.service.embedding.EmbeddingGenerator;
import com.example.regulations.assistantservice.service.ingest.IngestionClient;
import com.example.regulations.assistantservice.service.ingest.SourcePage;
import com.example.regulations.assistantservice.service.ingest.SourcePageSequence;
import com.example.regulations.assistantservice.service.store.VectorStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Drives ingestion runs: fetch new or changed documents, chunk them, embed the chunks and commit
 * them to the vector store.
 * <p>
 * Every completed stage is written to the {@link CheckpointStore}; documents in flight live in the
 * {@link StagingStore}. A run interrupted by a crash is resumed by the next trigger at the stage
 * after the last one recorded. At most one run is active at a time; triggers that arrive while one
 * is active are coalesced into a no-op.
 * <p>
 * The cursor only moves when every source page of a run was fetched and every fetched record was
 * staged. Documents whose chunking, embedding, staging or commit failed are counted against the run
 * (which ends {@link RunStatus#PARTIAL}) and are picked up again by the next run.
 */
@Slf4j
@Component
public class UpdateScheduler {

    private final IngestionClient ingestionClient;
    private final TextChunker chunker;
    private final EmbeddingGenerator embeddings;
    private final VectorStore vectorStore;
    private final CheckpointStore checkpointStore;
    private final StagingStore staging;
    private final ExecutorService workers;
    private final Executor runExecutor;
    private final int initialLookbackDays;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.IDLE);
    private volatile String activeRunId;
    private volatile PipelineRun lastRun;

    public UpdateScheduler(IngestionClient ingestionClient,
                           TextChunker chunker,
                           EmbeddingGenerator embeddings,
                           VectorStore vectorStore,
                           CheckpointStore checkpointStore,
                           StagingStore staging,
                           @Qualifier("ingestionExecutor") ExecutorService workers,
                           @Qualifier("ingestionRunExecutor") Executor runExecutor,
                           RagProperties properties,
                           Clock clock) {
        this.ingestionClient = ingestionClient;
        this.chunker = chunker;
        this.embeddings = embeddings;
        this.vectorStore = vectorStore;
        this.checkpointStore = checkpointStore;
        this.staging = staging;
        this.workers = workers;
        this.runExecutor = runExecutor;
        this.initialLookbackDays = properties.getIngestion().getInitialLookbackDays();
        this.clock = clock;
    }

    @Scheduled(cron = "${app.ingestion.cron:0 0 6 * * *}")
    public void scheduledRun() {
        TriggerResult result = trigger(RunTrigger.SCHEDULED);
        if (result.outcome() == TriggerResult.Outcome.COALESCED) {
            log.info("Scheduled ingestion skipped, run {} still active", result.runId());
        }
    }

    /**
     * Runs (or resumes) an incremental ingestion on the calling thread.
     */
    public TriggerResult trigger(RunTrigger trigger) {
        if (!running.compareAndSet(false, true)) {
            return TriggerResult.coalesced(activeRunId);
        }
        try {
            return TriggerResult.completed(execute(plan(trigger)));
        } finally {
            release();
        }
    }

    /**
     * Same as {@link #trigger(RunTrigger)} but returns as soon as the run is planned.
     */
    public TriggerResult triggerAsync(RunTrigger trigger) {
        if (!running.compareAndSet(false, true)) {
            return TriggerResult.coalesced(activeRunId);
        }
        return launch(() -> plan(trigger));
    }

    /**
     * Backfills an explicit publication-date range. The checkpoint cursor is left alone.
     */
    public TriggerResult runHistorical(LocalDate start, LocalDate end) {
        validateRange(start, end);
        if (!running.compareAndSet(false, true)) {
            return TriggerResult.coalesced(activeRunId);
        }
        try {
            return TriggerResult.completed(execute(historical(start, end)));
        } finally {
            release();
        }
    }

    public TriggerResult runHistoricalAsync(LocalDate start, LocalDate end) {
        validateRange(start, end);
        if (!running.compareAndSet(false, true)) {
            return TriggerResult.coalesced(activeRunId);
        }
        return launch(() -> historical(start, end));
    }

    public SchedulerState state() {
        return state.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    public SchedulerStatus status() {
        PipelineRun last = lastRun;
        if (last == null) {
            List<PipelineRun> recent = checkpointStore.recentRuns(1);
            last = recent.isEmpty() ? null : recent.get(0);
        }
        return new SchedulerStatus(state.get(), activeRunId, checkpointStore.load(), last, staging.count());
    }

    public List<PipelineRun> recentRuns(int limit) {
        return checkpointStore.recentRuns(limit);
    }

    private TriggerResult launch(Supplier<RunContext> planner) {
        RunContext run;
        try {
            run = planner.get();
        } catch (RuntimeException e) {
            release();
            throw e;
        }
        try {
            runExecutor.execute(() -> {
                try {
                    execute(run);
                } finally {
                    release();
                }
            });
        } catch (RejectedExecutionException e) {
            release();
            throw new IllegalStateException("Ingestion executor rejected run " + run.runId, e);
        }
        return TriggerResult.started(run.runId);
    }

    private void release() {
        activeRunId = null;
        running.set(false);
    }

    private static void validateRange(LocalDate start, LocalDate end) {
        if (start == null || end == null || end.isBefore(start)) {
            throw new IllegalArgumentException("Invalid date range " + start + " .. " + end);
        }
    }

    // --- planning ---

    private RunContext plan(RunTrigger trigger) {
        IngestionCheckpoint checkpoint = checkpointStore.load();
        Instant now = clock.instant();
        if (checkpoint.hasActiveRun()) {
            log.info("Resuming run {} after stage {}", checkpoint.getActiveRunId(), checkpoint.getLastCompletedStage());
            RunContext run = new RunContext(checkpoint.getActiveRunId(), checkpoint.getActiveRunTrigger(),
                    checkpoint.getActiveRunSince(), checkpoint.getActiveRunUntil(), checkpoint.getLastCompletedStage(),
                    true, checkpoint, now);
            activeRunId = run.runId;
            return run;
        }
        LocalDate today = LocalDate.now(clock);
        LocalDate since = checkpoint.getCursor() != null ? checkpoint.getCursor() : today.minusDays(initialLookbackDays);
        String runId = UUID.randomUUID().toString();
        checkpoint.setActiveRunId(runId);
        checkpoint.setActiveRunTrigger(trigger);
        checkpoint.setActiveRunSince(since);
        checkpoint.setActiveRunUntil(today);
        checkpoint.setLastCompletedStage(null);
        checkpoint.setUpdatedAt(now);
        checkpointStore.save(checkpoint);
        activeRunId = runId;
        return new RunContext(runId, trigger, since, today, null, false, checkpoint, now);
    }

    private RunContext historical(LocalDate start, LocalDate end) {
        String runId = UUID.randomUUID().toString();
        activeRunId = runId;
        return new RunContext(runId, RunTrigger.HISTORICAL, start, end, null, false, null, clock.instant());
    }

    // --- execution ---

    private PipelineRun execute(RunContext run) {
        log.info("Ingestion run {} ({}) started for {} .. {}{}", run.runId, run.trigger, run.since,
                run.until == null ? "open" : run.until, run.resumed ? " [resumed]" : "");
        try {
            for (RunStage stage : RunStage.values()) {
                if (!stage.isAfter(run.resumeAfter)) {
                    continue;
                }
                state.set(SchedulerState.of(stage));
                switch (stage) {
                    case FETCHING -> fetch(run);
                    case PROCESSING -> process(run);
                    case EMBEDDING -> embed(run);
                    case COMMITTING -> commit(run);
                }
                markStage(run, stage);
            }
            return complete(run);
        } catch (RuntimeException e) {
            return fail(run, e);
        }
    }

    private void fetch(RunContext run) {
        SourcePageSequence pages = run.historical()
                ? ingestionClient.fetchBetween(run.since, run.until)
                : ingestionClient.fetchSince(run.since);
        int succeeded = 0;
        IngestionException firstError = null;
        for (SourcePage page : pages) {
            if (!page.succeeded()) {
                run.failedPages.incrementAndGet();
                if (firstError == null) {
                    firstError = page.error();
                }
                continue;
            }
            succeeded++;
            run.skipped.addAndGet(page.skippedRecords());
            run.unstaged.addAndGet(page.failedRecords());
            run.failedDocuments.addAndGet(page.failedRecords());
            stageCandidates(run, page.documents());
        }
        if (succeeded == 0) {
            throw firstError != null ? firstError
                    : new IngestionException("Source returned no pages", 1, null);
        }
        if ((run.failedPages.get() > 0 || run.unstaged.get() > 0) && run.checkpoint != null) {
            // keep the cursor where it was so the next run refetches what is missing
            run.checkpoint.setActiveRunUntil(run.since);
            run.until = run.since;
        }
        log.info("Run {}: {} documents staged, {} unchanged or skipped, {} not staged, {} pages failed", run.runId,
                run.fetched.get(), run.skipped.get(), run.unstaged.get(), run.failedPages.get());
    }

    private void stageCandidates(RunContext run, List<RegulatoryDocument> documents) {
        if (documents.isEmpty()) {
            return;
        }
        Map<String, DocumentFingerprint> stored = vectorStore.findFingerprints(
                documents.stream().map(RegulatoryDocument::getSourceId).toList());
        List<PendingDocument> pending = new ArrayList<>();
        for (RegulatoryDocument doc : documents) {
            if (ingestionClient.needsProcessing(doc, stored.get(doc.getSourceId()), embeddings.modelVersion())) {
                pending.add(PendingDocument.fetched(doc, run.runId, clock.instant()));
            } else {
                run.skipped.incrementAndGet();
            }
        }
        if (pending.isEmpty()) {
            return;
        }
        try {
            staging.saveAll(pending);
            run.fetched.addAndGet(pending.size());
        } catch (StorageException e) {
            log.warn("Staging {} documents as a batch failed, staging one by one: {}", pending.size(), e.getMessage());
            for (PendingDocument doc : pending) {
                if (save(run, doc)) {
                    run.fetched.incrementAndGet();
                } else {
                    run.unstaged.incrementAndGet();
                }
            }
        }
    }

    private void process(RunContext run) {
        List<PendingDocument> fetched = staging.findByStage(PendingStage.FETCHED);
        forEachParallel(fetched, pending -> {
            RegulatoryDocument doc = pending.getDocument();
            try {
                List<TextChunk> pieces = chunker.chunk(doc.getText());
                List<DocumentChunk> chunks = new ArrayList<>(pieces.size());
                for (TextChunk piece : pieces) {
                    chunks.add(DocumentChunk.builder()
                            .documentId(doc.getSourceId())
                            .sequenceIndex(piece.sequenceIndex())
                            .text(piece.text())
                            .startOffset(piece.startOffset())
                            .endOffset(piece.endOffset())
                            .tokenCount(piece.tokenCount())
                            .build());
                }
                pending.setChunks(chunks);
                pending.setStage(PendingStage.CHUNKED);
            } catch (ChunkingException e) {
                log.error("Chunking {} failed: {}", doc.getSourceId(), e.getMessage());
                markFailed(run, pending, e.getMessage());
                restage(pending);
                return;
            }
            pending.setUpdatedAt(clock.instant());
            save(run, pending);
        });
        log.debug("Run {}: chunked {} documents", run.runId, fetched.size());
    }

    private void embed(RunContext run) {
        List<PendingDocument> chunked = staging.findByStage(PendingStage.CHUNKED);
        if (chunked.isEmpty()) {
            return;
        }
        List<String> texts = new ArrayList<>();
        for (PendingDocument pending : chunked) {
            pending.getChunks().forEach(c -> texts.add(c.getText()));
        }
        BatchEmbeddingResult result = texts.isEmpty()
                ? new BatchEmbeddingResult(0, List.of())
                : embeddings.embedBatches(texts);
        run.failedBatches.addAndGet(result.failedBatches().size());
        String modelVersion = embeddings.modelVersion();
        String batchError = result.failedBatches().isEmpty() ? null : result.failedBatches().get(0).error().getMessage();

        int offset = 0;
        for (PendingDocument pending : chunked) {
            List<DocumentChunk> chunks = pending.getChunks();
            List<DocumentChunk> embedded = new ArrayList<>(chunks.size());
            boolean complete = true;
            for (int i = 0; i < chunks.size(); i++) {
                float[] vector = result.vectorFor(offset + i);
                if (vector == null) {
                    complete = false;
                    break;
                }
                embedded.add(chunks.get(i).toBuilder()
                        .embedding(DocumentChunk.toList(vector))
                        .modelVersion(modelVersion)
                        .build());
            }
            offset += chunks.size();
            if (complete) {
                pending.setChunks(embedded);
                pending.setDocument(pending.getDocument().toBuilder().embeddingModelVersion(modelVersion).build());
                pending.setStage(PendingStage.EMBEDDED);
                pending.setUpdatedAt(clock.instant());
                save(run, pending);
            } else {
                markFailed(run, pending, batchError);
                restage(pending);
            }
        }
    }

    private void commit(RunContext run) {
        List<PendingDocument> embedded = staging.findByStage(PendingStage.EMBEDDED);
        forEachParallel(embedded, pending -> {
            try {
                vectorStore.upsertDocument(pending.getDocument(), pending.getChunks());
            } catch (StorageException e) {
                log.error("Committing {} failed: {}", pending.getSourceId(), e.getMessage());
                markFailed(run, pending, e.getMessage());
                restage(pending);
                return;
            }
            run.processed.incrementAndGet();
            try {
                staging.delete(pending.getSourceId());
            } catch (StorageException e) {
                // committing an EMBEDDED entry again is idempotent
                log.warn("Committed {} but could not unstage it: {}", pending.getSourceId(), e.getMessage());
            }
        });
    }

    /**
     * Writes the document's new stage. A failed write leaves the previous stage in place and counts
     * the document as failed for this run.
     *
     * @return false when the write failed
     */
    private boolean save(RunContext run, PendingDocument pending) {
        try {
            staging.save(pending);
            return true;
        } catch (StorageException e) {
            log.error("Staging {} at {} failed: {}", pending.getSourceId(), pending.getStage(), e.getMessage());
            markFailed(run, pending, e.getMessage());
            return false;
        }
    }

    // records the failure on an entry that is already counted as failed
    private void restage(PendingDocument pending) {
        pending.setUpdatedAt(clock.instant());
        try {
            staging.save(pending);
        } catch (StorageException e) {
            log.error("Could not record failure of {}: {}", pending.getSourceId(), e.getMessage());
        }
    }

    private void markFailed(RunContext run, PendingDocument pending, String error) {
        pending.setAttempts(pending.getAttempts() + 1);
        pending.setLastError(error);
        run.failedDocuments.incrementAndGet();
    }

    private void markStage(RunContext run, RunStage stage) {
        if (run.checkpoint == null) {
            return;
        }
        run.checkpoint.setLastCompletedStage(stage);
        run.checkpoint.setUpdatedAt(clock.instant());
        checkpointStore.save(run.checkpoint);
        log.debug("Run {}: stage {} complete", run.runId, stage);
    }

    private PipelineRun complete(RunContext run) {
        boolean degraded = run.failedPages.get() > 0 || run.failedDocuments.get() > 0 || run.failedBatches.get() > 0;
        RunStatus status = degraded ? RunStatus.PARTIAL : RunStatus.SUCCESS;
        PipelineRun record = run.toRecord(status, null, clock.instant());
        if (run.checkpoint != null) {
            IngestionCheckpoint checkpoint = run.checkpoint;
            if (run.until != null) {
                checkpoint.setCursor(run.until);
            }
            finish(checkpoint, record);
        }
        checkpointStore.recordRun(record);
        lastRun = record;
        state.set(SchedulerState.IDLE);
        log.info("Ingestion run {} finished {}: {} committed, {} failed documents, {} failed batches, {} failed pages",
                run.runId, status, record.getRecordsProcessed(), record.getFailedDocuments(),
                record.getFailedBatches(), record.getFailedPages());
        return record;
    }

    private PipelineRun fail(RunContext run, RuntimeException error) {
        SchedulerState failedIn = state.getAndSet(SchedulerState.FAILED);
        log.error("Ingestion run {} failed in state {}: {}", run.runId, failedIn, error.getMessage(), error);
        PipelineRun record = run.toRecord(RunStatus.FAILED, error.getMessage(), clock.instant());
        try {
            if (run.checkpoint != null) {
                finish(run.checkpoint, record);
            }
            checkpointStore.recordRun(record);
        } catch (StorageException e) {
            log.error("Could not record failure of run {}: {}", run.runId, e.getMessage());
        }
        lastRun = record;
        state.set(SchedulerState.IDLE);
        return record;
    }

    private void finish(IngestionCheckpoint checkpoint, PipelineRun record) {
        checkpoint.clearActiveRun();
        checkpoint.setLastRunStatus(record.getStatus());
        checkpoint.setLastRunId(record.getRunId());
        checkpoint.setLastRunFinishedAt(record.getFinishedAt());
        checkpoint.setUpdatedAt(record.getFinishedAt());
        checkpointStore.save(checkpoint);
    }

    private <T> void forEachParallel(List<T> items, Consumer<T> action) {
        CompletableFuture<?>[] futures = items.stream()
                .map(item -> CompletableFuture.runAsync(() -> action.accept(item), workers))
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(futures).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static final class RunContext {
        final String runId;
        final RunTrigger trigger;
        final LocalDate since;
        LocalDate until;
        final RunStage resumeAfter;
        final boolean resumed;
        final IngestionCheckpoint checkpoint;
        final Instant startedAt;

        final AtomicInteger fetched = new AtomicInteger();
        final AtomicInteger skipped = new AtomicInteger();
        final AtomicInteger processed = new AtomicInteger();
        final AtomicInteger failedPages = new AtomicInteger();
        final AtomicInteger unstaged = new AtomicInteger();
        final AtomicInteger failedDocuments = new AtomicInteger();
        final AtomicInteger failedBatches = new AtomicInteger();

        RunContext(String runId, RunTrigger trigger, LocalDate since, LocalDate until, RunStage resumeAfter,
                   boolean resumed, IngestionCheckpoint checkpoint, Instant startedAt) {
            this.runId = runId;
            this.trigger = trigger == null ? RunTrigger.SCHEDULED : trigger;
            this.since = since;
            this.until = until;
            this.resumeAfter = resumeAfter;
            this.resumed = resumed;
            this.checkpoint = checkpoint;
            this.startedAt = startedAt;
        }

        boolean historical() {
            return trigger == RunTrigger.HISTORICAL;
        }

        PipelineRun toRecord(RunStatus status, String error, Instant finishedAt) {
            return PipelineRun.builder()
                    .runId(runId)
                    .runDate(startedAt.atZone(ZoneOffset.UTC).toLocalDate())
                    .trigger(trigger)
                    .since(since)
                    .until(until)
                    .documentsFetched(fetched.get())
                    .documentsSkipped(skipped.get())
                    .recordsProcessed(processed.get())
                    .failedPages(failedPages.get())
                    .failedDocuments(failedDocuments.get())
                    .failedBatches(failedBatches.get())
                    .resumed(resumed)
                    .status(status)
                    .errorMessage(error)
                    .startedAt(startedAt)
                    .finishedAt(finishedAt)
                    .build();
        }
    }
}
