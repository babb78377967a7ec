package com.example.regulations.assistantservice.api;

import com.example.regulations.assistantservice.error.LlmException;
import com.example.regulations.assistantservice.error.RetrievalException;
import com.example.regulations.assistantservice.model.Agency;
import com.example.regulations.assistantservice.model.IngestionCheckpoint;
import com.example.regulations.assistantservice.model.RunStatus;
import com.example.regulations.assistantservice.model.RunTrigger;
import com.example.regulations.assistantservice.model.SchedulerState;
import com.example.regulations.assistantservice.model.SearchFilters;
import com.example.regulations.assistantservice.service.query.Citation;
import com.example.regulations.assistantservice.service.query.ConversationTurn;
import com.example.regulations.assistantservice.service.query.QueryAnswer;
import com.example.regulations.assistantservice.service.query.QueryEngine;
import com.example.regulations.assistantservice.service.query.SessionContext;
import com.example.regulations.assistantservice.service.scheduler.SchedulerStatus;
import com.example.regulations.assistantservice.service.scheduler.TriggerResult;
import com.example.regulations.assistantservice.service.scheduler.UpdateScheduler;
import com.example.regulations.assistantservice.service.session.ChatSessionService;
import com.example.regulations.assistantservice.service.store.VectorStore;
import com.example.regulations.assistantservice.support.TestData;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RegulationsAssistantController.class)
class RegulationsAssistantControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private QueryEngine queryEngine;
    @MockBean
    private ChatSessionService sessions;
    @MockBean
    private UpdateScheduler scheduler;
    @MockBean
    private VectorStore vectorStore;

    private static QueryAnswer answer(String text) {
        return new QueryAnswer(text,
                List.of(new Citation("2024-100", "Ozone Standard", "epa", "Environmental Protection Agency",
                        LocalDate.of(2024, 3, 1), 0.82)),
                SearchFilters.none(), 3, 1);
    }

    @Test
    void chatAnswersAndRecordsTheTurn() throws Exception {
        when(sessions.context("s1")).thenReturn(new SessionContext("s1", List.of()));
        when(queryEngine.answer(eq("What about ozone?"), any(), isNull())).thenReturn(answer("It was tightened."));

        mvc.perform(post("/api/regulations/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s1\",\"message\":\"What about ozone?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.sessionId").value("s1"))
                .andExpect(jsonPath("$.answer").value("It was tightened."))
                .andExpect(jsonPath("$.retrieved").value(3))
                .andExpect(jsonPath("$.citations[0].documentNumber").value("2024-100"))
                .andExpect(jsonPath("$.citations[0].agency").value("Environmental Protection Agency"))
                .andExpect(jsonPath("$.citations[0].publicationDate").value("2024-03-01"));

        verify(sessions).record("s1", "What about ozone?", "It was tightened.");
    }

    @Test
    void clientHistoryReplacesSessionHistory() throws Exception {
        when(queryEngine.answer(anyString(), any(), any())).thenReturn(answer("ok"));

        mvc.perform(post("/api/regulations/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"message":"And since 2023?","timeoutSeconds":10,
                                 "history":[{"role":"user","content":"EPA rules"},{"role":"assistant","content":"Two found"}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").isNotEmpty());

        ArgumentCaptor<SessionContext> context = ArgumentCaptor.forClass(SessionContext.class);
        verify(queryEngine).answer(eq("And since 2023?"), context.capture(), eq(Duration.ofSeconds(10)));
        assertThat(context.getValue().history()).containsExactly(
                ConversationTurn.user("EPA rules"), ConversationTurn.assistant("Two found"));
        verify(sessions, never()).context(anyString());
    }

    @Test
    void blankMessageIsBadRequest() throws Exception {
        mvc.perform(post("/api/regulations/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void retrievalFailureIsServiceUnavailable() throws Exception {
        when(sessions.context(anyString())).thenReturn(SessionContext.empty());
        when(queryEngine.answer(anyString(), any(), any()))
                .thenThrow(new RetrievalException("store down", null));

        mvc.perform(post("/api/regulations/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"ozone\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("RETRIEVAL_FAILED"));
        verify(sessions, never()).record(anyString(), anyString(), anyString());
    }

    @Test
    void modelTimeoutIsGatewayTimeout() throws Exception {
        when(sessions.context(anyString())).thenReturn(SessionContext.empty());
        when(queryEngine.answer(anyString(), any(), any()))
                .thenThrow(new LlmException("slow", null, true));

        mvc.perform(post("/api/regulations/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"ozone\"}"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.code").value("LLM_TIMEOUT"));
    }

    @Test
    void ingestStartsRunOrReportsConflict() throws Exception {
        when(scheduler.triggerAsync(RunTrigger.MANUAL))
                .thenReturn(new TriggerResult(TriggerResult.Outcome.STARTED, "run-1", null))
                .thenReturn(new TriggerResult(TriggerResult.Outcome.COALESCED, "run-1", null));

        mvc.perform(post("/api/regulations/ingest"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("started"))
                .andExpect(jsonPath("$.runId").value("run-1"));
        mvc.perform(post("/api/regulations/ingest"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("coalesced"));
    }

    @Test
    void historicalRunWithInvertedRangeIsBadRequest() throws Exception {
        when(scheduler.runHistoricalAsync(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1)))
                .thenThrow(new IllegalArgumentException("Invalid date range"));

        mvc.perform(post("/api/regulations/ingest/historical")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"startDate\":\"2024-02-01\",\"endDate\":\"2024-01-01\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid date range"));
    }

    @Test
    void statusReportsCheckpoint() throws Exception {
        IngestionCheckpoint checkpoint = IngestionCheckpoint.empty();
        checkpoint.setCursor(LocalDate.of(2024, 5, 3));
        checkpoint.setLastRunStatus(RunStatus.PARTIAL);
        when(scheduler.status()).thenReturn(new SchedulerStatus(SchedulerState.IDLE, null, checkpoint, null, 2));
        when(sessions.activeSessions()).thenReturn(5);

        mvc.perform(get("/api/regulations/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("IDLE"))
                .andExpect(jsonPath("$.cursor").value("2024-05-03"))
                .andExpect(jsonPath("$.lastRunStatus").value("PARTIAL"))
                .andExpect(jsonPath("$.stagedDocuments").value(2))
                .andExpect(jsonPath("$.activeSessions").value(5));
    }

    @Test
    void recentDocumentsRejectsOversizedLimit() throws Exception {
        mvc.perform(get("/api/regulations/documents/recent").param("limit", "1000"))
                .andExpect(status().isBadRequest());
        verify(vectorStore, never()).recentDocuments(anyInt(), anyInt());
    }

    @Test
    void documentsOfOneAgencyNewestFirst() throws Exception {
        when(vectorStore.documentsByAgency("environmental-protection-agency", 5)).thenReturn(List.of(
                TestData.document("2024-300", "environmental-protection-agency", LocalDate.of(2024, 5, 2), "later"),
                TestData.document("2024-200", "environmental-protection-agency", LocalDate.of(2024, 4, 9), "earlier")));

        mvc.perform(get("/api/regulations/documents")
                        .param("agency", "environmental-protection-agency")
                        .param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].documentNumber").value("2024-300"))
                .andExpect(jsonPath("$[1].publicationDate").value("2024-04-09"));
    }

    @Test
    void documentsWithoutAgencyAreBadRequest() throws Exception {
        mvc.perform(get("/api/regulations/documents"))
                .andExpect(status().isBadRequest());
        mvc.perform(get("/api/regulations/documents").param("agency", " "))
                .andExpect(status().isBadRequest());
        mvc.perform(get("/api/regulations/documents").param("agency", "epa").param("limit", "0"))
                .andExpect(status().isBadRequest());
        verify(vectorStore, never()).documentsByAgency(anyString(), anyInt());
    }

    @Test
    void agenciesAndSessionClear() throws Exception {
        when(vectorStore.agencies()).thenReturn(List.of(new Agency("epa", "Environmental Protection Agency")));
        when(sessions.clear("s1")).thenReturn(true);

        mvc.perform(get("/api/regulations/agencies"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("epa"));
        mvc.perform(delete("/api/regulations/sessions/s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cleared").value(true));
    }
}
