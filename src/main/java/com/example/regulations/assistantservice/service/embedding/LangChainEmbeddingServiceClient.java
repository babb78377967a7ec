package com.example.regulations.assistantservice.service.embedding;

import com.example.regulations.assistantservice.service.support.AsyncCalls;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

@Slf4j
@Component
public class LangChainEmbeddingServiceClient implements EmbeddingServiceClient {

    private final EmbeddingModel embeddingModel;
    private final ExecutorService executor;
    private final String modelName;

    public LangChainEmbeddingServiceClient(EmbeddingModel embeddingModel,
                                           @Qualifier("embeddingCallExecutor") ExecutorService executor,
                                           @Value("${app.embedding.model-version:nomic-embed-text}") String modelName) {
        this.embeddingModel = embeddingModel;
        this.executor = executor;
        this.modelName = modelName;
    }

    @Override
    public CompletableFuture<EmbeddingResponse> embed(EmbeddingRequest request) {
        List<TextSegment> segments = request.texts().stream()
                .map(TextSegment::from)
                .toList();
        return AsyncCalls.submit(executor, () -> {
            Response<List<Embedding>> response = embeddingModel.embedAll(segments);
            List<float[]> vectors = response.content().stream()
                    .map(Embedding::vector)
                    .toList();
            int dimension = vectors.isEmpty() ? 0 : vectors.get(0).length;
            log.debug("Embedded {} texts with {} (dim={})", segments.size(), modelName, dimension);
            return new EmbeddingResponse(modelName, dimension, vectors);
        });
    }
}
