package com.example.regulations.assistantservice.service.embedding;

import com.example.regulations.assistantservice.config.RagProperties;
import com.example.regulations.assistantservice.error.EmbeddingException;
import com.example.regulations.assistantservice.support.BagOfWordsEmbeddingClient;
import com.example.regulations.assistantservice.support.TestData;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbeddingGeneratorTest {

    private ExecutorService executor;
    private RagProperties properties;
    private BagOfWordsEmbeddingClient client;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        properties = TestData.properties();
        client = new BagOfWordsEmbeddingClient(TestData.MODEL, TestData.DIMENSION);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private EmbeddingGenerator generator(EmbeddingServiceClient c) {
        return new EmbeddingGenerator(c, executor, properties);
    }

    private static List<String> texts(int n) {
        return IntStream.range(0, n).mapToObj(i -> "passage number " + i + " about rule " + i).toList();
    }

    @Test
    void embedsInBatchesAndKeepsOrder() {
        List<String> texts = texts(10);

        BatchEmbeddingResult result = generator(client).embedBatches(texts);

        assertThat(result.batches()).hasSize(3);
        assertThat(result.allSucceeded()).isTrue();
        assertThat(client.calls()).extracting(List::size).containsExactlyInAnyOrder(4, 4, 2);
        for (int i = 0; i < texts.size(); i++) {
            assertThat(result.vectorFor(i)).containsExactly(BagOfWordsEmbeddingClient.vectorOf(texts.get(i), TestData.DIMENSION));
        }
    }

    @Test
    void cachedTextsAreNotResent() {
        EmbeddingGenerator generator = generator(client);
        generator.embedBatches(texts(6));
        int sent = client.textsSent();

        BatchEmbeddingResult again = generator.embedBatches(texts(8));

        assertThat(again.allSucceeded()).isTrue();
        assertThat(client.textsSent() - sent).isEqualTo(2);
    }

    @Test
    void callersCannotCorruptCachedVectors() {
        EmbeddingGenerator generator = generator(client);
        float[] expected = BagOfWordsEmbeddingClient.vectorOf("ozone limits", TestData.DIMENSION);

        float[] first = generator.embedQuery("ozone limits");
        Arrays.fill(first, 0f);
        float[] cached = generator.embedQuery("ozone limits");
        cached[0] = 42f;
        float[] again = generator.embedQuery("ozone limits");

        assertThat(client.textsSent()).isEqualTo(1);
        assertThat(again).containsExactly(expected);
    }

    @Test
    void transientFailuresAreRetried() {
        AtomicInteger failures = new AtomicInteger();
        client.failWhen(text -> failures.getAndIncrement() < 2 ? new RuntimeException("429 Too Many Requests") : null);

        BatchEmbeddingResult result = generator(client).embedBatches(texts(3));

        assertThat(result.allSucceeded()).isTrue();
        assertThat(client.calls()).hasSize(3);
    }

    @Test
    void failedBatchDoesNotAffectOthers() {
        List<String> texts = texts(12);
        String poisoned = texts.get(5);
        client.failWhen(text -> text.equals(poisoned) ? new RuntimeException("service timed out") : null);

        BatchEmbeddingResult result = generator(client).embedBatches(texts);

        assertThat(result.failedBatches()).extracting(BatchEmbeddingResult.Batch::index).containsExactly(1);
        assertThat(result.failedBatches().get(0).error().isTransientFailure()).isTrue();
        assertThat(result.vectorFor(5)).isNull();
        assertThat(result.vectorFor(4)).isNull();
        assertThat(result.vectorFor(0)).isNotNull();
        assertThat(result.vectorFor(11)).isNotNull();
    }

    @Test
    void wrongDimensionFailsWithoutRetry() {
        AtomicInteger calls = new AtomicInteger();
        EmbeddingServiceClient shortVectors = request -> {
            calls.incrementAndGet();
            List<float[]> vectors = new ArrayList<>();
            request.texts().forEach(t -> vectors.add(new float[TestData.DIMENSION - 1]));
            return CompletableFuture.completedFuture(new EmbeddingResponse(TestData.MODEL, TestData.DIMENSION - 1, vectors));
        };

        BatchEmbeddingResult result = generator(shortVectors).embedBatches(List.of("a text"));

        assertThat(result.allSucceeded()).isFalse();
        EmbeddingException error = result.failedBatches().get(0).error();
        assertThat(error.isTransientFailure()).isFalse();
        assertThat(error.getMessage()).contains("dimension");
        assertThat(calls).hasValue(1);
    }

    @Test
    void modelVersionMismatchIsFatal() {
        EmbeddingServiceClient otherModel = request -> CompletableFuture.completedFuture(new EmbeddingResponse(
                "another-model", TestData.DIMENSION,
                request.texts().stream().map(t -> new float[TestData.DIMENSION]).toList()));

        assertThatThrownBy(() -> generator(otherModel).embedQuery("question"))
                .isInstanceOf(EmbeddingException.class)
                .hasMessageContaining("another-model");
    }

    @Test
    void slowBatchTimesOutAfterRetries() {
        properties.getEmbedding().setBatchTimeout(Duration.ofMillis(50));
        List<CompletableFuture<EmbeddingResponse>> issued = new ArrayList<>();
        EmbeddingServiceClient hanging = request -> {
            CompletableFuture<EmbeddingResponse> never = new CompletableFuture<>();
            issued.add(never);
            return never;
        };

        BatchEmbeddingResult result = generator(hanging).embedBatches(List.of("slow text"));

        EmbeddingException error = result.failedBatches().get(0).error();
        assertThat(error.isTransientFailure()).isTrue();
        assertThat(error).hasRootCauseInstanceOf(TimeoutException.class);
        assertThat(issued).hasSize(3).allMatch(CompletableFuture::isCancelled);
    }

    @Test
    void queryEmbeddingFailureIsRaised() {
        client.failWhen(text -> new IllegalStateException("bad request"));

        assertThatThrownBy(() -> generator(client).embedQuery("what changed"))
                .isInstanceOf(EmbeddingException.class);
        assertThat(client.calls()).hasSize(1);
    }
}
