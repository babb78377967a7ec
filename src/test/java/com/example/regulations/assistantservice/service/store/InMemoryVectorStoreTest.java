package com.example.regulations.assistantservice.service.store;

import com.example.regulations.assistantservice.error.StorageException;
import com.example.regulations.assistantservice.model.Agency;
import com.example.regulations.assistantservice.model.DocumentChunk;
import com.example.regulations.assistantservice.model.DocumentStats;
import com.example.regulations.assistantservice.model.RetrievalResult;
import com.example.regulations.assistantservice.model.SearchFilters;
import com.example.regulations.assistantservice.support.BagOfWordsEmbeddingClient;
import com.example.regulations.assistantservice.support.MutableClock;
import com.example.regulations.assistantservice.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static com.example.regulations.assistantservice.support.TestData.chunks;
import static com.example.regulations.assistantservice.support.TestData.document;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryVectorStoreTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

    private InMemoryVectorStore store;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2024-06-01T12:00:00Z");
        store = new InMemoryVectorStore(new RecencyScorer(TestData.properties(), clock), clock);
    }

    private static float[] query(String text) {
        return BagOfWordsEmbeddingClient.vectorOf(text, TestData.DIMENSION);
    }

    @Test
    void searchRanksByScoreAndHonoursK() {
        store.upsertDocument(document("2024-001", "environmental-protection-agency", TODAY, "air"),
                chunks("2024-001", "air quality standards for ozone", "vehicle emission testing rules"));
        store.upsertDocument(document("2024-002", "food-and-drug-administration", TODAY, "food"),
                chunks("2024-002", "food labeling requirements", "drug approval pathway"));

        List<RetrievalResult> hits = store.search(query("ozone air quality standards"), SearchFilters.none(), 3);

        assertThat(hits).hasSize(3);
        assertThat(hits.get(0).text()).isEqualTo("air quality standards for ozone");
        for (int i = 1; i < hits.size(); i++) {
            assertThat(hits.get(i - 1).score()).isGreaterThanOrEqualTo(hits.get(i).score());
        }
    }

    @Test
    void filtersRestrictAgencyAndDateRange() {
        store.upsertDocument(document("a", "environmental-protection-agency", TODAY.minusDays(400), "x"),
                chunks("a", "water rule text"));
        store.upsertDocument(document("b", "environmental-protection-agency", TODAY.minusDays(3), "y"),
                chunks("b", "water rule text"));
        store.upsertDocument(document("c", "securities-and-exchange-commission", TODAY.minusDays(3), "z"),
                chunks("c", "water rule text"));

        SearchFilters epaRecent = new SearchFilters("environmental-protection-agency", TODAY.minusDays(30), TODAY);
        List<RetrievalResult> hits = store.search(query("water rule"), epaRecent, 10);

        assertThat(hits).extracting(RetrievalResult::documentId).containsExactly("b");
        assertThat(store.search(query("water rule"), SearchFilters.agency("ENVIRONMENTAL-PROTECTION-AGENCY"), 10))
                .extracting(RetrievalResult::documentId).containsExactlyInAnyOrder("a", "b");
    }

    @Test
    void newerDocumentWinsOnEqualSimilarity() {
        store.upsertDocument(document("old", "agency", TODAY.minusYears(3), "t"), chunks("old", "identical passage"));
        store.upsertDocument(document("new", "agency", TODAY.minusDays(1), "t"), chunks("new", "identical passage"));

        List<RetrievalResult> hits = store.search(query("identical passage"), SearchFilters.none(), 2);

        assertThat(hits).extracting(RetrievalResult::documentId).containsExactly("new", "old");
        assertThat(hits.get(0).similarity()).isEqualTo(hits.get(1).similarity());
    }

    @Test
    void upsertReplacesEveryChunk() {
        store.upsertDocument(document("d", "agency", TODAY, "v1"), chunks("d", "first version one", "first version two", "first version three"));
        store.upsertDocument(document("d", "agency", TODAY, "v2"), chunks("d", "second version"));

        assertThat(store.findChunks("d")).extracting(DocumentChunk::getText).containsExactly("second version");
        assertThat(store.search(query("first version"), SearchFilters.none(), 10))
                .extracting(RetrievalResult::text).containsExactly("second version");
        assertThat(store.findDocument("d")).get().extracting(d -> d.getChunkCount()).isEqualTo(1);
    }

    @Test
    void readersNeverSeeAMixOfChunkGenerations() {
        List<DocumentChunk> versionA = chunks("mixed", "alpha one", "alpha two", "alpha three");
        List<DocumentChunk> versionB = chunks("mixed", "beta one", "beta two");
        store.upsertDocument(document("mixed", "agency", TODAY, "a"), versionA);

        AtomicBoolean stop = new AtomicBoolean();
        CompletableFuture<Void> writer = CompletableFuture.runAsync(() -> {
            for (int i = 0; i < 500; i++) {
                store.upsertDocument(document("mixed", "agency", TODAY, i % 2 == 0 ? "b" : "a"), i % 2 == 0 ? versionB : versionA);
            }
            stop.set(true);
        });
        List<Set<String>> observed = new ArrayList<>();
        while (!stop.get()) {
            observed.add(store.search(query("alpha beta one two three"), SearchFilters.none(), 10).stream()
                    .map(h -> h.text().split(" ")[0])
                    .collect(Collectors.toSet()));
        }
        writer.join();

        assertThat(observed).allSatisfy(prefixes -> assertThat(prefixes).hasSize(1));
    }

    @Test
    void invalidChunkSetsAreRejected() {
        List<DocumentChunk> gap = new ArrayList<>(chunks("g", "one", "two", "three"));
        gap.remove(1);
        assertThatThrownBy(() -> store.upsertDocument(document("g", "agency", TODAY, "g"), gap))
                .isInstanceOf(StorageException.class);

        List<DocumentChunk> mixed = new ArrayList<>(chunks("m", "one", "two"));
        mixed.set(1, mixed.get(1).toBuilder().modelVersion("other").build());
        assertThatThrownBy(() -> store.upsertDocument(document("m", "agency", TODAY, "m"), mixed))
                .isInstanceOf(StorageException.class);

        List<DocumentChunk> unembedded = List.of(chunks("u", "one").get(0).toBuilder().embedding(null).build());
        assertThatThrownBy(() -> store.upsertDocument(document("u", "agency", TODAY, "u"), unembedded))
                .isInstanceOf(StorageException.class);

        assertThat(store.findDocument("g")).isEmpty();
    }

    @Test
    void fingerprintsCarryChecksumAndModel() {
        store.upsertDocument(document("f", "agency", TODAY, "content"), chunks("f", "content"));

        assertThat(store.findFingerprints(List.of("f", "missing")))
                .containsOnlyKeys("f")
                .extractingByKey("f")
                .satisfies(fp -> {
                    assertThat(fp.modelVersion()).isEqualTo(TestData.MODEL);
                    assertThat(fp.checksum()).isEqualTo(document("f", "agency", TODAY, "content").getChecksum());
                });
    }

    @Test
    void agenciesRecentDocumentsAndStats() {
        store.upsertDocument(document("r1", "environmental-protection-agency", TODAY.minusDays(2), "a"), chunks("r1", "a"));
        store.upsertDocument(document("r2", "food-and-drug-administration", TODAY.minusDays(1), "b"), chunks("r2", "b", "c"));
        store.upsertDocument(document("r3", "food-and-drug-administration", TODAY.minusDays(90), "c"), chunks("r3", "d"));

        assertThat(store.agencies()).extracting(Agency::id)
                .containsExactly("environmental-protection-agency", "food-and-drug-administration");
        assertThat(store.recentDocuments(7, 10)).extracting(d -> d.getSourceId()).containsExactly("r2", "r1");

        DocumentStats stats = store.stats();
        assertThat(stats.totalDocuments()).isEqualTo(3);
        assertThat(stats.totalChunks()).isEqualTo(4);
        assertThat(stats.documentTypes()).containsExactly(new DocumentStats.TypeCount("Rule", 3));
        assertThat(stats.recentActivity()).extracting(DocumentStats.DayCount::date)
                .containsExactly(TODAY.minusDays(1), TODAY.minusDays(2));
    }

    @Test
    void documentsByAgencyAreNewestFirstAndLimited() {
        store.upsertDocument(document("a1", "food-and-drug-administration", TODAY.minusDays(30), "a"), chunks("a1", "a"));
        store.upsertDocument(document("a2", "food-and-drug-administration", TODAY.minusDays(1), "b"), chunks("a2", "b"));
        store.upsertDocument(document("a3", "food-and-drug-administration", TODAY.minusDays(1), "c"), chunks("a3", "c"));
        store.upsertDocument(document("b1", "environmental-protection-agency", TODAY, "d"), chunks("b1", "d"));

        assertThat(store.documentsByAgency("food-and-drug-administration", 10)).extracting(d -> d.getSourceId())
                .containsExactly("a2", "a3", "a1");
        assertThat(store.documentsByAgency("food-and-drug-administration", 2)).extracting(d -> d.getSourceId())
                .containsExactly("a2", "a3");
        assertThat(store.documentsByAgency("unknown-agency", 10)).isEmpty();
    }
}
