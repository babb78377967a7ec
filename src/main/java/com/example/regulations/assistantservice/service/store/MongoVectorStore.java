// src/main/java/com/example/regulations/assistantservice/service/store/MongoVectorStore.java
package com.example.regulations.assistantservice.service.store;

import com.example.regulations.assistantservice.config.RagProperties;
import com.example.regulations.assistantservice.error.StorageException;
import com.example.regulations.assistantservice.model.Agency;
import com.example.regulations.assistantservice.model.DocumentChunk;
import com.example.regulations.assistantservice.model.DocumentFingerprint;
import com.example.regulations.assistantservice.model.DocumentStats;
import com.example.regulations.assistantservice.model.RegulatoryDocument;
import com.example.regulations.assistantservice.model.RetrievalResult;
import com.example.regulations.assistantservice.model.SearchFilters;
import com.example.regulations.assistantservice.repo.DocumentChunkRepository;
import com.example.regulations.assistantservice.repo.RegulatoryDocumentRepository;
import com.mongodb.MongoException;
import com.mongodb.client.AggregateIterable;
import com.mongodb.client.MongoCollection;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoDB-backed store. Chunks are written under a fresh generation id; flipping the
 * document's {@code activeGeneration} (a single-document write) publishes them, after which
 * the previous generation is deleted. Searches drop hits from inactive generations.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "mongo", matchIfMissing = true)
public class MongoVectorStore implements VectorStore {

    private final MongoTemplate mongoTemplate;
    private final RegulatoryDocumentRepository documentRepository;
    private final DocumentChunkRepository chunkRepository;
    private final RecencyScorer scorer;
    private final RagProperties.Vector settings;
    private final Clock clock;

    public MongoVectorStore(MongoTemplate mongoTemplate,
                            RegulatoryDocumentRepository documentRepository,
                            DocumentChunkRepository chunkRepository,
                            RecencyScorer scorer,
                            RagProperties properties,
                            Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.documentRepository = documentRepository;
        this.chunkRepository = chunkRepository;
        this.scorer = scorer;
        this.settings = properties.getVector();
        this.clock = clock;
    }

    @Override
    public void upsertDocument(RegulatoryDocument document, List<DocumentChunk> chunks) {
        ChunkConstraints.check(document, chunks);
        String id = document.getSourceId();
        String generation = UUID.randomUUID().toString();
        List<DocumentChunk> rows = chunks.stream()
                .map(c -> c.toBuilder()
                        .id(null)
                        .documentId(id)
                        .generation(generation)
                        .agencyId(document.getAgencyId())
                        .publicationDate(document.getPublicationDate())
                        .build())
                .toList();
        try {
            if (!rows.isEmpty()) {
                mongoTemplate.insertAll(rows);
            }
            RegulatoryDocument published = document.toBuilder()
                    .activeGeneration(generation)
                    .chunkCount(rows.size())
                    .embeddingModelVersion(rows.isEmpty() ? document.getEmbeddingModelVersion() : rows.get(0).getModelVersion())
                    .build();
            documentRepository.save(published);
        } catch (DataAccessException | MongoException e) {
            discardGeneration(id, generation);
            throw new StorageException("Failed to store document " + id, e);
        }
        try {
            mongoTemplate.remove(new Query(where("documentId").is(id).and("generation").ne(generation)),
                    DocumentChunk.class);
        } catch (DataAccessException | MongoException e) {
            // stale generations are invisible to readers; the next upsert removes them
            log.warn("Could not delete superseded chunks of {}: {}", id, e.getMessage());
        }
        log.debug("Stored {} chunks for {} (generation {})", rows.size(), id, generation);
    }

    @Override
    public List<RetrievalResult> search(float[] queryVector, SearchFilters filters, int k) {
        SearchFilters f = filters == null ? SearchFilters.none() : filters;
        if (k <= 0) {
            return List.of();
        }
        try {
            List<ScoredChunk> candidates = settings.isUseAtlasVector()
                    ? atlasCandidates(queryVector, f, k)
                    : scanCandidates(queryVector, f);
            return rank(candidates, f, k);
        } catch (DataAccessException | MongoException e) {
            throw new StorageException("Vector search failed", e);
        }
    }

    @Override
    public Optional<RegulatoryDocument> findDocument(String sourceId) {
        try {
            return documentRepository.findById(sourceId);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load document " + sourceId, e);
        }
    }

    @Override
    public List<DocumentChunk> findChunks(String sourceId) {
        try {
            return documentRepository.findById(sourceId)
                    .map(doc -> chunkRepository.findByDocumentIdAndGenerationOrderBySequenceIndex(sourceId,
                            doc.getActiveGeneration()))
                    .orElse(List.of());
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load chunks of " + sourceId, e);
        }
    }

    @Override
    public Map<String, DocumentFingerprint> findFingerprints(Collection<String> sourceIds) {
        if (sourceIds.isEmpty()) {
            return Map.of();
        }
        try {
            Query query = new Query(where("_id").in(sourceIds));
            query.fields().include("checksum").include("embeddingModelVersion");
            Map<String, DocumentFingerprint> out = new HashMap<>();
            for (RegulatoryDocument doc : mongoTemplate.find(query, RegulatoryDocument.class)) {
                out.put(doc.getSourceId(), new DocumentFingerprint(doc.getChecksum(), doc.getEmbeddingModelVersion()));
            }
            return out;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read document checksums", e);
        }
    }

    @Override
    public List<Agency> agencies() {
        try {
            Aggregation agg = Aggregation.newAggregation(
                    Aggregation.match(where("agencyId").ne(null)),
                    Aggregation.group("agencyId").first("agencyName").as("name"),
                    Aggregation.sort(Sort.Direction.ASC, "_id"));
            return mongoTemplate.aggregate(agg, RegulatoryDocument.class, Document.class)
                    .getMappedResults().stream()
                    .map(d -> new Agency(d.getString("_id"), d.getString("name")))
                    .toList();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list agencies", e);
        }
    }

    @Override
    public List<RegulatoryDocument> recentDocuments(int days, int limit) {
        try {
            return documentRepository.findByPublicationDateGreaterThanEqualOrderByPublicationDateDesc(
                    LocalDate.now(clock).minusDays(days), PageRequest.of(0, Math.max(1, limit)));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list recent documents", e);
        }
    }

    @Override
    public List<RegulatoryDocument> documentsByAgency(String agencyId, int limit) {
        try {
            return documentRepository.findByAgencyIdOrderByPublicationDateDescSourceIdAsc(agencyId,
                    PageRequest.of(0, Math.max(1, limit)));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list documents of agency " + agencyId, e);
        }
    }

    @Override
    public DocumentStats stats() {
        try {
            long documents = documentRepository.count();
            long chunks = chunkRepository.count();
            List<DocumentStats.TypeCount> types = mongoTemplate.aggregate(Aggregation.newAggregation(
                            Aggregation.group("documentType").count().as("count"),
                            Aggregation.sort(Sort.Direction.DESC, "count"),
                            Aggregation.limit(5)), RegulatoryDocument.class, Document.class)
                    .getMappedResults().stream()
                    .map(d -> new DocumentStats.TypeCount(
                            d.get("_id") == null ? "unknown" : d.get("_id").toString(),
                            ((Number) d.get("count")).longValue()))
                    .toList();
            List<DocumentStats.DayCount> activity = mongoTemplate.aggregate(Aggregation.newAggregation(
                            Aggregation.match(where("publicationDate").gte(LocalDate.now(clock).minusDays(30))),
                            Aggregation.group("publicationDate").count().as("count"),
                            Aggregation.sort(Sort.Direction.DESC, "_id"),
                            Aggregation.limit(10)), RegulatoryDocument.class, Document.class)
                    .getMappedResults().stream()
                    .map(d -> new DocumentStats.DayCount(toLocalDate(d.get("_id")),
                            ((Number) d.get("count")).longValue()))
                    .toList();
            return new DocumentStats(documents, chunks, types, activity);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to compute document statistics", e);
        }
    }

    private record ScoredChunk(DocumentChunk chunk, double similarity) {}

    private List<ScoredChunk> atlasCandidates(float[] queryVector, SearchFilters filters, int k) {
        int limit = k * Math.max(1, settings.getCandidateMultiplier());
        MongoCollection<Document> col = mongoTemplate.getCollection(mongoTemplate.getCollectionName(DocumentChunk.class));
        Document vectorSearch = new Document("index", settings.getIndexName())
                .append("path", "embedding")
                .append("queryVector", DocumentChunk.toList(queryVector))
                .append("numCandidates", Math.max(200, limit * 10))
                .append("limit", limit);
        Document filter = atlasFilter(filters);
        if (filter != null) {
            vectorSearch.append("filter", filter);
        }
        List<Document> pipeline = List.of(
                new Document("$vectorSearch", vectorSearch),
                new Document("$addFields", new Document("score", new Document("$meta", "vectorSearchScore"))),
                new Document("$project", new Document("embedding", 0)));

        AggregateIterable<Document> agg = col.aggregate(pipeline);
        List<ScoredChunk> out = new ArrayList<>();
        for (Document d : agg) {
            DocumentChunk chunk = mongoTemplate.getConverter().read(DocumentChunk.class, d);
            Number score = (Number) d.get("score");
            out.add(new ScoredChunk(chunk, score == null ? 0.0 : score.doubleValue()));
        }
        return out;
    }

    Document atlasFilter(SearchFilters filters) {
        List<Document> clauses = new ArrayList<>();
        if (filters.agencyId() != null) {
            clauses.add(new Document("agencyId", new Document("$eq", filters.agencyId())));
        }
        if (filters.publishedFrom() != null) {
            clauses.add(new Document("publicationDate", new Document("$gte", toMongo(filters.publishedFrom()))));
        }
        if (filters.publishedTo() != null) {
            clauses.add(new Document("publicationDate", new Document("$lte", toMongo(filters.publishedTo()))));
        }
        if (clauses.isEmpty()) {
            return null;
        }
        return clauses.size() == 1 ? clauses.get(0) : new Document("$and", clauses);
    }

    // Fallback: compute cosine in Java against every chunk that passes the filters
    private List<ScoredChunk> scanCandidates(float[] queryVector, SearchFilters filters) {
        Criteria criteria = new Criteria();
        List<Criteria> parts = new ArrayList<>();
        if (filters.agencyId() != null) {
            parts.add(where("agencyId").is(filters.agencyId()));
        }
        if (filters.publishedFrom() != null) {
            parts.add(where("publicationDate").gte(filters.publishedFrom()));
        }
        if (filters.publishedTo() != null) {
            parts.add(where("publicationDate").lte(filters.publishedTo()));
        }
        if (!parts.isEmpty()) {
            criteria = new Criteria().andOperator(parts.toArray(new Criteria[0]));
        }
        return mongoTemplate.find(new Query(criteria), DocumentChunk.class).stream()
                .map(c -> new ScoredChunk(c, VectorMath.cosine(queryVector, c.embeddingArray())))
                .toList();
    }

    private List<RetrievalResult> rank(List<ScoredChunk> candidates, SearchFilters filters, int k) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        Set<String> ids = candidates.stream().map(c -> c.chunk().getDocumentId()).collect(Collectors.toCollection(HashSet::new));
        Map<String, RegulatoryDocument> docs = documentRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(RegulatoryDocument::getSourceId, Function.identity()));
        return candidates.stream()
                .filter(c -> {
                    RegulatoryDocument doc = docs.get(c.chunk().getDocumentId());
                    return doc != null
                            && Objects.equals(c.chunk().getGeneration(), doc.getActiveGeneration())
                            && filters.matches(doc.getAgencyId(), doc.getPublicationDate());
                })
                .map(c -> {
                    RegulatoryDocument doc = docs.get(c.chunk().getDocumentId());
                    DocumentChunk chunk = c.chunk();
                    return new RetrievalResult(doc.getSourceId(), chunk.getSequenceIndex(), chunk.getText(),
                            chunk.getTokenCount(), c.similarity(), scorer.score(c.similarity(), doc.getPublicationDate()),
                            doc.getTitle(), doc.getAgencyId(), doc.getAgencyName(), doc.getPublicationDate());
                })
                .sorted(RecencyScorer.RANKING)
                .limit(k)
                .toList();
    }

    private void discardGeneration(String documentId, String generation) {
        try {
            mongoTemplate.remove(new Query(where("documentId").is(documentId).and("generation").is(generation)),
                    DocumentChunk.class);
        } catch (DataAccessException | MongoException e) {
            log.warn("Could not clean up unpublished chunks of {}: {}", documentId, e.getMessage());
        }
    }

    private Object toMongo(LocalDate date) {
        return mongoTemplate.getConverter().convertToMongoType(date);
    }

    private static LocalDate toLocalDate(Object value) {
        if (value instanceof Date date) {
            return date.toInstant().atZone(ZoneId.systemDefault()).toLocalDate();
        }
        return value == null ? null : LocalDate.parse(value.toString());
    }
}
