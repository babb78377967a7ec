package com.example.regulations.assistantservice.service.query;

import com.example.regulations.assistantservice.config.RagProperties;
import com.example.regulations.assistantservice.error.LlmException;
import com.example.regulations.assistantservice.error.RetrievalException;
import com.example.regulations.assistantservice.error.StorageException;
import com.example.regulations.assistantservice.service.embedding.EmbeddingGenerator;
import com.example.regulations.assistantservice.service.store.InMemoryVectorStore;
import com.example.regulations.assistantservice.service.store.RecencyScorer;
import com.example.regulations.assistantservice.service.store.VectorStore;
import com.example.regulations.assistantservice.support.BagOfWordsEmbeddingClient;
import com.example.regulations.assistantservice.support.MutableClock;
import com.example.regulations.assistantservice.support.TestData;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class QueryEngineTest {

    private MutableClock clock;
    private RagProperties properties;
    private ExecutorService executor;
    private BagOfWordsEmbeddingClient embeddingClient;
    private InMemoryVectorStore store;
    private ScriptedModel model;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-03T12:00:00Z");
        properties = TestData.properties();
        properties.getQuery().getAgencyAliases().put("EPA", "epa");
        properties.getQuery().setHistoryTurns(2);
        executor = Executors.newFixedThreadPool(2);
        embeddingClient = new BagOfWordsEmbeddingClient(TestData.MODEL, TestData.DIMENSION);
        store = new InMemoryVectorStore(new RecencyScorer(properties, clock), clock);
        model = new ScriptedModel();

        store.upsertDocument(TestData.document("2024-100", "epa", LocalDate.of(2024, 3, 1), "ozone"),
                TestData.chunks("2024-100", "ground level ozone standard tightened for power plants"));
        store.upsertDocument(TestData.document("2024-200", "faa", LocalDate.of(2024, 3, 2), "drones"),
                TestData.chunks("2024-200", "drone pilots must register unmanned aircraft"));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private QueryEngine engine(VectorStore vectorStore) {
        return new QueryEngine(
                new QueryFilterExtractor(properties, vectorStore, clock),
                new EmbeddingGenerator(embeddingClient, executor, properties),
                vectorStore,
                new ContextAssembler(),
                new RegulationPromptBuilder(),
                model,
                properties);
    }

    @Test
    void answersFromRetrievedPassagesWithCitations() {
        model.reply = request -> "  The ozone standard was tightened (2024-100).  ";

        QueryAnswer answer = engine(store).answer("What changed in the ozone standard?", SessionContext.empty());

        assertThat(answer.answer()).isEqualTo("The ozone standard was tightened (2024-100).");
        assertThat(answer.citations()).extracting(Citation::documentId).first().isEqualTo("2024-100");
        assertThat(answer.retrievedCount()).isEqualTo(2);
        GenerationRequest sent = model.requests.get(0);
        assertThat(sent.systemPrompt()).contains("Federal Register");
        assertThat(sent.userMessage())
                .contains("QUESTION: What changed in the ozone standard?")
                .contains("ground level ozone standard");
    }

    @Test
    void agencyInQuestionRestrictsTheSearch() {
        model.reply = request -> "answer";

        QueryAnswer answer = engine(store).answer("What has EPA said about drones?", SessionContext.empty());

        assertThat(answer.filters().agencyId()).isEqualTo("epa");
        assertThat(answer.citations()).extracting(Citation::documentId).containsExactly("2024-100");
        assertThat(model.requests.get(0).userMessage()).contains("restricted to agency epa");
    }

    @Test
    void noMatchesStillAsksTheModelWithoutCitations() {
        model.reply = request -> "I could not find anything.";

        QueryAnswer answer = engine(store).answer("EPA rules between 1990 and 1991", SessionContext.empty());

        assertThat(answer.citations()).isEmpty();
        assertThat(answer.includedCount()).isZero();
        assertThat(model.requests.get(0).userMessage()).contains(RegulationPromptBuilder.NO_MATCHES);
    }

    @Test
    void onlyTheLastHistoryTurnsAreSent() {
        model.reply = request -> "answer";
        SessionContext session = new SessionContext("s1", List.of(
                ConversationTurn.user("first"), ConversationTurn.assistant("one"),
                ConversationTurn.user("second"), ConversationTurn.assistant("two")));

        engine(store).answer("And drones?", session);

        assertThat(model.requests.get(0).history()).extracting(ConversationTurn::content)
                .containsExactly("second", "two");
    }

    @Test
    void blankQuestionIsRejected() {
        assertThatThrownBy(() -> engine(store).answer(" ", SessionContext.empty()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(model.requests).isEmpty();
    }

    @Test
    void embeddingFailureIsARetrievalError() {
        embeddingClient.failWhen(text -> new IllegalStateException("model not loaded"));

        assertThatThrownBy(() -> engine(store).answer("ozone", SessionContext.empty()))
                .isInstanceOf(RetrievalException.class);
        assertThat(model.requests).isEmpty();
    }

    @Test
    void storeFailureIsARetrievalError() {
        VectorStore broken = mock(VectorStore.class);
        when(broken.agencies()).thenReturn(List.of());
        when(broken.search(any(), any(), anyInt())).thenThrow(new StorageException("connection reset", null));

        assertThatThrownBy(() -> engine(broken).answer("ozone", SessionContext.empty()))
                .isInstanceOf(RetrievalException.class)
                .hasMessageContaining("connection reset");
        assertThat(model.requests).isEmpty();
    }

    @Test
    void slowModelTimesOutAndIsCancelled() {
        model.hang = true;

        assertThatThrownBy(() -> engine(store).answer("ozone", SessionContext.empty(), Duration.ofMillis(50)))
                .isInstanceOfSatisfying(LlmException.class, e -> assertThat(e.isTimeout()).isTrue());
        assertThat(model.lastFuture.isCancelled()).isTrue();
    }

    @Test
    void slowRetrievalCountsAgainstTheSameTimeout() {
        embeddingClient.failWhen(text -> {
            sleep(Duration.ofMillis(150));
            return null;
        });

        assertThatThrownBy(() -> engine(store).answer("ozone", SessionContext.empty(), Duration.ofMillis(50)))
                .isInstanceOfSatisfying(LlmException.class, e -> assertThat(e.isTimeout()).isTrue());
        assertThat(model.requests).isEmpty();
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    void emptyModelResponseIsAnError() {
        model.reply = request -> "   ";

        assertThatThrownBy(() -> engine(store).answer("ozone", SessionContext.empty()))
                .isInstanceOfSatisfying(LlmException.class, e -> assertThat(e.isTimeout()).isFalse());
    }

    @Test
    void modelFailureIsAnLlmError() {
        model.reply = request -> {
            throw new IllegalStateException("HTTP 500 from provider");
        };

        assertThatThrownBy(() -> engine(store).answer("ozone", SessionContext.empty()))
                .isInstanceOf(LlmException.class)
                .hasMessageContaining("HTTP 500");
    }

    static class ScriptedModel implements LanguageModelClient {
        final List<GenerationRequest> requests = new ArrayList<>();
        volatile Function<GenerationRequest, String> reply = request -> "ok";
        volatile boolean hang;
        volatile CompletableFuture<GenerationResponse> lastFuture;

        @Override
        public CompletableFuture<GenerationResponse> generate(GenerationRequest request) {
            requests.add(request);
            if (hang) {
                lastFuture = new CompletableFuture<>();
                return lastFuture;
            }
            try {
                lastFuture = CompletableFuture.completedFuture(new GenerationResponse(reply.apply(request), "test-llm"));
            } catch (RuntimeException e) {
                lastFuture = CompletableFuture.failedFuture(e);
            }
            return lastFuture;
        }
    }
}
