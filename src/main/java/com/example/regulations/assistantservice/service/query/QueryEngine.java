// src/main/java/com/example/regulations/assistantservice/service/query/QueryEngine.java
package com.example.regulations.assistantservice.service.query;

import com.example.regulations.assistantservice.config.RagProperties;
import com.example.regulations.assistantservice.error.EmbeddingException;
import com.example.regulations.assistantservice.error.LlmException;
import com.example.regulations.assistantservice.error.RetrievalException;
import com.example.regulations.assistantservice.error.StorageException;
import com.example.regulations.assistantservice.model.RetrievalResult;
import com.example.regulations.assistantservice.model.SearchFilters;
import com.example.regulations.assistantservice.service.embedding.EmbeddingGenerator;
import com.example.regulations.assistantservice.service.store.VectorStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Answers a question from retrieved Federal Register passages: extract filters, embed the
 * question, search, pack the context and ask the language model.
 * <p>
 * Retrieval failures are raised as {@link RetrievalException} before the model is called, so no
 * ungrounded answer is produced. A question with no matches still goes to the model with an
 * explicit "no matching documents" context and comes back without citations.
 */
@Slf4j
@Service
public class QueryEngine {

    private final QueryFilterExtractor filterExtractor;
    private final EmbeddingGenerator embeddings;
    private final VectorStore vectorStore;
    private final ContextAssembler contextAssembler;
    private final RegulationPromptBuilder promptBuilder;
    private final LanguageModelClient languageModel;
    private final RagProperties.Query settings;

    public QueryEngine(QueryFilterExtractor filterExtractor,
                       EmbeddingGenerator embeddings,
                       VectorStore vectorStore,
                       ContextAssembler contextAssembler,
                       RegulationPromptBuilder promptBuilder,
                       LanguageModelClient languageModel,
                       RagProperties properties) {
        this.filterExtractor = filterExtractor;
        this.embeddings = embeddings;
        this.vectorStore = vectorStore;
        this.contextAssembler = contextAssembler;
        this.promptBuilder = promptBuilder;
        this.languageModel = languageModel;
        this.settings = properties.getQuery();
    }

    public QueryAnswer answer(String question, SessionContext session) {
        return answer(question, session, settings.getTimeout());
    }

    /**
     * @throws RetrievalException if the question cannot be embedded or the store cannot be searched
     * @throws LlmException if generation fails or returns nothing, or if the whole question (retrieval
     *         included) exceeds {@code timeout}
     */
    public QueryAnswer answer(String question, SessionContext session, Duration timeout) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question must not be blank");
        }
        SessionContext context = session == null ? SessionContext.empty() : session;
        Duration budget = timeout == null ? settings.getTimeout() : timeout;
        long started = System.nanoTime();

        SearchFilters filters = filterExtractor.extract(question).orElse(SearchFilters.none());
        List<RetrievalResult> hits = retrieve(question, filters);
        AssembledContext assembled = contextAssembler.assemble(hits, settings.getContextTokenBudget());

        GenerationRequest request = new GenerationRequest(
                promptBuilder.systemPrompt(),
                context.lastTurns(settings.getHistoryTurns()),
                promptBuilder.buildUserMessage(question, assembled, filters));
        Duration remaining = budget.minusNanos(System.nanoTime() - started);
        if (remaining.isZero() || remaining.isNegative()) {
            throw new LlmException("Question used up its " + budget.toMillis() + " ms budget before generation",
                    null, true);
        }
        String answer = generate(request, remaining, budget);

        log.info("Answered question for session {} in {} ms ({} hits, {} in context, filters {})",
                context.sessionId(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started),
                hits.size(), assembled.included().size(), filters.isEmpty() ? "none" : filters);
        return new QueryAnswer(answer, assembled.citations(), filters, hits.size(), assembled.included().size());
    }

    private List<RetrievalResult> retrieve(String question, SearchFilters filters) {
        float[] vector;
        try {
            vector = embeddings.embedQuery(question);
        } catch (EmbeddingException e) {
            throw new RetrievalException("Could not embed question: " + e.getMessage(), e);
        }
        try {
            return vectorStore.search(vector, filters, settings.getTopK());
        } catch (StorageException e) {
            throw new RetrievalException("Vector search failed: " + e.getMessage(), e);
        }
    }

    private String generate(GenerationRequest request, Duration remaining, Duration budget) {
        CompletableFuture<GenerationResponse> future = languageModel.generate(request);
        GenerationResponse response;
        try {
            response = future.get(remaining.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new LlmException("Language model did not answer within the " + budget.toMillis() + " ms budget",
                    e, true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new LlmException("Language model call failed: " + cause.getMessage(), cause, false);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while waiting for the language model", e, false);
        }
        if (response == null || response.text() == null || response.text().isBlank()) {
            throw new LlmException("Language model returned an empty response");
        }
        return response.text().strip();
    }
}
