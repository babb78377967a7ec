// src/main/java/com/example/regulations/assistantservice/service/embedding/EmbeddingGenerator.java
package com.example.regulations.assistantservice.service.embedding;

import com.example.regulations.assistantservice.config.RagProperties;
import com.example.regulations.assistantservice.error.EmbeddingException;
import com.example.regulations.assistantservice.service.support.Hashing;
import com.example.regulations.assistantservice.service.support.TransientFailures;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns chunk texts into vectors through the external embedding service.
 * <p>
 * Texts are cached by (content hash, model version), sent in bounded batches on a fixed
 * pool, and each batch is retried with exponential backoff on transient failures. A batch
 * that still fails is reported in the result without cancelling its siblings.
 */
@Slf4j
@Component
public class EmbeddingGenerator {

    private final EmbeddingServiceClient client;
    private final ExecutorService batchExecutor;
    private final Retry retry;
    private final Cache<CacheKey, float[]> cache;
    private final String modelVersion;
    private final int dimension;
    private final int batchSize;
    private final Duration batchTimeout;

    record CacheKey(String contentHash, String modelVersion) {}

    public EmbeddingGenerator(EmbeddingServiceClient client,
                              @Qualifier("embeddingBatchExecutor") ExecutorService batchExecutor,
                              RagProperties properties) {
        RagProperties.Embedding cfg = properties.getEmbedding();
        this.client = client;
        this.batchExecutor = batchExecutor;
        this.modelVersion = cfg.getModelVersion();
        this.dimension = cfg.getDimension();
        this.batchSize = Math.max(1, cfg.getBatchSize());
        this.batchTimeout = cfg.getBatchTimeout();
        this.cache = Caffeine.newBuilder()
                .maximumSize(cfg.getCacheSize())
                .build();
        this.retry = Retry.of("embedding-batch", RetryConfig.custom()
                .maxAttempts(Math.max(1, cfg.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(cfg.getInitialBackoff(), cfg.getBackoffMultiplier()))
                .retryOnException(TransientFailures::isTransient)
                .build());
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying embedding batch (attempt {}): {}", event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().toString()));
    }

    public String modelVersion() {
        return modelVersion;
    }

    public int dimension() {
        return dimension;
    }

    /**
     * Embeds all texts, batch by batch, with at most the executor's pool size in flight.
     */
    public BatchEmbeddingResult embedBatches(List<String> texts) {
        List<CompletableFuture<BatchEmbeddingResult.Batch>> futures = new ArrayList<>();
        int index = 0;
        for (int offset = 0; offset < texts.size(); offset += batchSize) {
            int batchIndex = index++;
            int start = offset;
            List<String> batch = List.copyOf(texts.subList(offset, Math.min(texts.size(), offset + batchSize)));
            futures.add(CompletableFuture.supplyAsync(() -> runBatch(batchIndex, start, batch), batchExecutor));
        }
        List<BatchEmbeddingResult.Batch> batches = futures.stream()
                .map(CompletableFuture::join)
                .toList();
        long failed = batches.stream().filter(b -> !b.succeeded()).count();
        if (failed > 0) {
            log.warn("{} of {} embedding batches failed", failed, batches.size());
        }
        return new BatchEmbeddingResult(texts.size(), batches);
    }

    /**
     * Embeds a single query on the calling thread.
     *
     * @throws EmbeddingException when the service cannot produce a valid vector
     */
    public float[] embedQuery(String text) {
        BatchEmbeddingResult.Batch batch = runBatch(0, 0, List.of(text));
        if (!batch.succeeded()) {
            throw batch.error();
        }
        return batch.vectors().get(0);
    }

    private BatchEmbeddingResult.Batch runBatch(int batchIndex, int offset, List<String> texts) {
        try {
            float[][] out = new float[texts.size()][];
            List<Integer> missing = new ArrayList<>();
            for (int i = 0; i < texts.size(); i++) {
                float[] cached = cache.getIfPresent(keyOf(texts.get(i)));
                if (cached != null) {
                    out[i] = cached.clone();
                } else {
                    missing.add(i);
                }
            }
            if (!missing.isEmpty()) {
                List<String> toSend = missing.stream().map(texts::get).toList();
                List<float[]> fresh = callWithRetry(batchIndex, toSend);
                for (int k = 0; k < missing.size(); k++) {
                    int i = missing.get(k);
                    out[i] = fresh.get(k);
                    cache.put(keyOf(texts.get(i)), fresh.get(k).clone());
                }
            }
            log.debug("Embedding batch {} done ({} texts, {} from cache)", batchIndex, texts.size(),
                    texts.size() - missing.size());
            return new BatchEmbeddingResult.Batch(batchIndex, offset, texts.size(), List.of(out), null);
        } catch (EmbeddingException e) {
            log.error("Embedding batch {} failed: {}", batchIndex, e.getMessage());
            return new BatchEmbeddingResult.Batch(batchIndex, offset, texts.size(), List.of(), e);
        }
    }

    private List<float[]> callWithRetry(int batchIndex, List<String> texts) {
        try {
            return Retry.decorateCallable(retry, () -> callOnce(texts)).call();
        } catch (EmbeddingException e) {
            throw e;
        } catch (Exception e) {
            throw new EmbeddingException("Embedding batch " + batchIndex + " failed: " + e.getMessage(), e,
                    TransientFailures.isTransient(e));
        }
    }

    private List<float[]> callOnce(List<String> texts) throws Exception {
        CompletableFuture<EmbeddingResponse> future = client.embed(new EmbeddingRequest(texts, modelVersion));
        EmbeddingResponse response;
        try {
            response = future.get(batchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while waiting for embeddings", e, false);
        }
        return validate(response, texts.size());
    }

    private List<float[]> validate(EmbeddingResponse response, int expected) {
        if (response == null || response.vectors() == null) {
            throw new EmbeddingException("Embedding service returned no vectors", false);
        }
        if (response.modelVersion() != null && !modelVersion.equals(response.modelVersion())) {
            throw new EmbeddingException("Embedding model mismatch: expected " + modelVersion
                    + " but service reported " + response.modelVersion(), false);
        }
        if (response.vectors().size() != expected) {
            throw new EmbeddingException("Expected " + expected + " vectors, got " + response.vectors().size(), false);
        }
        for (float[] vector : response.vectors()) {
            if (vector == null || vector.length != dimension) {
                throw new EmbeddingException("Vector dimension " + (vector == null ? 0 : vector.length)
                        + " does not match declared dimension " + dimension + " of " + modelVersion, false);
            }
        }
        return response.vectors();
    }

    private CacheKey keyOf(String text) {
        return new CacheKey(Hashing.sha256(text), modelVersion);
    }
}
