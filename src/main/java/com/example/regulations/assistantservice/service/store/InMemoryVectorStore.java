package com.example.regulations.assistantservice.service.store;

import com.example.regulations.assistantservice.model.Agency;
import com.example.regulations.assistantservice.model.DocumentChunk;
import com.example.regulations.assistantservice.model.DocumentFingerprint;
import com.example.regulations.assistantservice.model.DocumentStats;
import com.example.regulations.assistantservice.model.RegulatoryDocument;
import com.example.regulations.assistantservice.model.RetrievalResult;
import com.example.regulations.assistantservice.model.SearchFilters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Process-local store for development and tests. Each document and its chunks live in one
 * immutable entry, so replacing the entry is the per-document atomic swap.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory")
public class InMemoryVectorStore implements VectorStore {

    private record Entry(RegulatoryDocument document, List<DocumentChunk> chunks) {}

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final RecencyScorer scorer;
    private final Clock clock;

    public InMemoryVectorStore(RecencyScorer scorer, Clock clock) {
        this.scorer = scorer;
        this.clock = clock;
    }

    @Override
    public void upsertDocument(RegulatoryDocument document, List<DocumentChunk> chunks) {
        ChunkConstraints.check(document, chunks);
        String generation = UUID.randomUUID().toString();
        RegulatoryDocument stored = document.toBuilder()
                .activeGeneration(generation)
                .chunkCount(chunks.size())
                .embeddingModelVersion(chunks.isEmpty() ? document.getEmbeddingModelVersion() : chunks.get(0).getModelVersion())
                .build();
        List<DocumentChunk> copies = chunks.stream()
                .map(c -> c.toBuilder()
                        .id(stored.getSourceId() + ":" + generation + ":" + c.getSequenceIndex())
                        .documentId(stored.getSourceId())
                        .generation(generation)
                        .agencyId(stored.getAgencyId())
                        .publicationDate(stored.getPublicationDate())
                        .build())
                .toList();
        entries.put(stored.getSourceId(), new Entry(stored, copies));
        log.debug("Stored {} chunks for {}", copies.size(), stored.getSourceId());
    }

    @Override
    public List<RetrievalResult> search(float[] queryVector, SearchFilters filters, int k) {
        SearchFilters f = filters == null ? SearchFilters.none() : filters;
        List<RetrievalResult> hits = new ArrayList<>();
        for (Entry entry : List.copyOf(entries.values())) {
            RegulatoryDocument doc = entry.document();
            if (!f.matches(doc.getAgencyId(), doc.getPublicationDate())) {
                continue;
            }
            for (DocumentChunk chunk : entry.chunks()) {
                double similarity = VectorMath.cosine(queryVector, chunk.embeddingArray());
                hits.add(new RetrievalResult(doc.getSourceId(), chunk.getSequenceIndex(), chunk.getText(),
                        chunk.getTokenCount(), similarity, scorer.score(similarity, doc.getPublicationDate()),
                        doc.getTitle(), doc.getAgencyId(), doc.getAgencyName(), doc.getPublicationDate()));
            }
        }
        return hits.stream()
                .sorted(RecencyScorer.RANKING)
                .limit(Math.max(0, k))
                .toList();
    }

    @Override
    public Optional<RegulatoryDocument> findDocument(String sourceId) {
        return Optional.ofNullable(entries.get(sourceId)).map(Entry::document);
    }

    @Override
    public List<DocumentChunk> findChunks(String sourceId) {
        Entry entry = entries.get(sourceId);
        return entry == null ? List.of() : entry.chunks();
    }

    @Override
    public Map<String, DocumentFingerprint> findFingerprints(Collection<String> sourceIds) {
        Map<String, DocumentFingerprint> out = new LinkedHashMap<>();
        for (String id : sourceIds) {
            Entry entry = entries.get(id);
            if (entry != null) {
                out.put(id, new DocumentFingerprint(entry.document().getChecksum(),
                        entry.document().getEmbeddingModelVersion()));
            }
        }
        return out;
    }

    @Override
    public List<Agency> agencies() {
        return entries.values().stream()
                .map(Entry::document)
                .filter(d -> d.getAgencyId() != null)
                .collect(Collectors.toMap(RegulatoryDocument::getAgencyId,
                        d -> new Agency(d.getAgencyId(), d.getAgencyName()), (a, b) -> a, TreeMap::new))
                .values().stream().toList();
    }

    @Override
    public List<RegulatoryDocument> recentDocuments(int days, int limit) {
        LocalDate since = LocalDate.now(clock).minusDays(days);
        return entries.values().stream()
                .map(Entry::document)
                .filter(d -> d.getPublicationDate() != null && !d.getPublicationDate().isBefore(since))
                .sorted(Comparator.comparing(RegulatoryDocument::getPublicationDate).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public List<RegulatoryDocument> documentsByAgency(String agencyId, int limit) {
        return entries.values().stream()
                .map(Entry::document)
                .filter(d -> Objects.equals(agencyId, d.getAgencyId()))
                .sorted(Comparator.comparing(RegulatoryDocument::getPublicationDate,
                                Comparator.nullsLast(Comparator.reverseOrder()))
                        .thenComparing(RegulatoryDocument::getSourceId))
                .limit(Math.max(1, limit))
                .toList();
    }

    @Override
    public DocumentStats stats() {
        List<RegulatoryDocument> docs = entries.values().stream().map(Entry::document).toList();
        long chunks = entries.values().stream().mapToLong(e -> e.chunks().size()).sum();
        List<DocumentStats.TypeCount> types = docs.stream()
                .collect(Collectors.groupingBy(d -> d.getDocumentType() == null ? "unknown" : d.getDocumentType(),
                        Collectors.counting()))
                .entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .limit(5)
                .map(e -> new DocumentStats.TypeCount(e.getKey(), e.getValue()))
                .toList();
        LocalDate since = LocalDate.now(clock).minusDays(30);
        List<DocumentStats.DayCount> activity = docs.stream()
                .map(RegulatoryDocument::getPublicationDate)
                .filter(d -> d != null && !d.isBefore(since))
                .collect(Collectors.groupingBy(Function.identity(), TreeMap::new, Collectors.counting()))
                .descendingMap().entrySet().stream()
                .limit(10)
                .map(e -> new DocumentStats.DayCount(e.getKey(), e.getValue()))
                .toList();
        return new DocumentStats(docs.size(), chunks, types, activity);
    }
}
