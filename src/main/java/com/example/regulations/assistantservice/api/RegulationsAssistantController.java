// src/main/java/com/example/regulations/assistantservice/api/RegulationsAssistantController.java
package com.example.regulations.assistantservice.api;

import com.example.regulations.assistantservice.dto.AnswerResponse;
import com.example.regulations.assistantservice.dto.ChatRequest;
import com.example.regulations.assistantservice.dto.DocumentSummary;
import com.example.regulations.assistantservice.dto.HistoricalRunRequest;
import com.example.regulations.assistantservice.dto.IngestResponse;
import com.example.regulations.assistantservice.dto.StatusResponse;
import com.example.regulations.assistantservice.model.Agency;
import com.example.regulations.assistantservice.model.DocumentStats;
import com.example.regulations.assistantservice.model.IngestionCheckpoint;
import com.example.regulations.assistantservice.model.RunTrigger;
import com.example.regulations.assistantservice.service.query.ConversationTurn;
import com.example.regulations.assistantservice.service.query.QueryAnswer;
import com.example.regulations.assistantservice.service.query.QueryEngine;
import com.example.regulations.assistantservice.service.query.SessionContext;
import com.example.regulations.assistantservice.service.scheduler.SchedulerStatus;
import com.example.regulations.assistantservice.service.scheduler.TriggerResult;
import com.example.regulations.assistantservice.service.scheduler.UpdateScheduler;
import com.example.regulations.assistantservice.service.session.ChatSessionService;
import com.example.regulations.assistantservice.service.store.VectorStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/regulations")
@RequiredArgsConstructor
public class RegulationsAssistantController {

    private final QueryEngine queryEngine;
    private final ChatSessionService sessions;
    private final UpdateScheduler scheduler;
    private final VectorStore vectorStore;

    @PostMapping("/chat")
    public AnswerResponse chat(@Valid @RequestBody ChatRequest req) {
        String sessionId = req.sessionId() != null && !req.sessionId().isBlank()
                ? req.sessionId()
                : UUID.randomUUID().toString();
        SessionContext context = req.history() != null
                ? new SessionContext(sessionId, req.history().stream().map(RegulationsAssistantController::toTurn).toList())
                : sessions.context(sessionId);
        Duration timeout = req.timeoutSeconds() != null ? Duration.ofSeconds(req.timeoutSeconds()) : null;

        QueryAnswer answer = queryEngine.answer(req.message(), context, timeout);
        sessions.record(sessionId, req.message(), answer.answer());

        List<AnswerResponse.Citation> citations = answer.citations().stream()
                .map(c -> new AnswerResponse.Citation(c.documentId(), c.title(), c.agencyName(), c.publicationDate(), c.score()))
                .toList();
        return new AnswerResponse(sessionId, req.message(), answer.answer(), citations, answer.retrievedCount(), "success");
    }

    @PostMapping("/ingest")
    public ResponseEntity<IngestResponse> ingest() {
        return accepted(scheduler.triggerAsync(RunTrigger.MANUAL));
    }

    @PostMapping("/ingest/historical")
    public ResponseEntity<IngestResponse> ingestHistorical(@Valid @RequestBody HistoricalRunRequest req) {
        return accepted(scheduler.runHistoricalAsync(req.startDate(), req.endDate()));
    }

    @GetMapping("/status")
    public StatusResponse status() {
        SchedulerStatus status = scheduler.status();
        IngestionCheckpoint checkpoint = status.checkpoint();
        return new StatusResponse(status.state(), status.activeRunId(), checkpoint.getLastCompletedStage(),
                checkpoint.getCursor(), checkpoint.getLastRunStatus(), checkpoint.getLastRunFinishedAt(),
                status.lastRun(), status.stagedDocuments(), sessions.activeSessions());
    }

    @GetMapping("/documents/recent")
    public List<DocumentSummary> recentDocuments(@RequestParam(defaultValue = "7") int days,
                                                 @RequestParam(defaultValue = "20") int limit) {
        if (days < 0 || limit <= 0 || limit > 500) {
            throw new IllegalArgumentException("days must be >= 0 and limit between 1 and 500");
        }
        return vectorStore.recentDocuments(days, limit).stream().map(DocumentSummary::of).toList();
    }

    @GetMapping("/documents")
    public List<DocumentSummary> documentsByAgency(@RequestParam String agency,
                                                   @RequestParam(defaultValue = "20") int limit) {
        if (agency.isBlank() || limit <= 0 || limit > 500) {
            throw new IllegalArgumentException("agency is required and limit must be between 1 and 500");
        }
        return vectorStore.documentsByAgency(agency.trim(), limit).stream().map(DocumentSummary::of).toList();
    }

    @GetMapping("/documents/stats")
    public DocumentStats stats() {
        return vectorStore.stats();
    }

    @GetMapping("/agencies")
    public List<Agency> agencies() {
        return vectorStore.agencies();
    }

    @DeleteMapping("/sessions/{id}")
    public Map<String, Object> clearSession(@PathVariable String id) {
        return Map.of("sessionId", id, "cleared", sessions.clear(id));
    }

    private static ResponseEntity<IngestResponse> accepted(TriggerResult result) {
        HttpStatus status = result.outcome() == TriggerResult.Outcome.COALESCED ? HttpStatus.CONFLICT : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status)
                .body(new IngestResponse(result.outcome().name().toLowerCase(Locale.ROOT), result.runId()));
    }

    private static ConversationTurn toTurn(ChatRequest.HistoryMessage m) {
        ConversationTurn.Role role = "assistant".equalsIgnoreCase(m.role())
                ? ConversationTurn.Role.ASSISTANT
                : ConversationTurn.Role.USER;
        return new ConversationTurn(role, m.content() == null ? "" : m.content());
    }
}
