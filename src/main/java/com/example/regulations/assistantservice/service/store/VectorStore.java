package com.example.regulations.assistantservice.service.store;

import com.example.regulations.assistantservice.model.Agency;
import com.example.regulations.assistantservice.model.DocumentChunk;
import com.example.regulations.assistantservice.model.DocumentFingerprint;
import com.example.regulations.assistantservice.model.DocumentStats;
import com.example.regulations.assistantservice.model.RegulatoryDocument;
import com.example.regulations.assistantservice.model.RetrievalResult;
import com.example.regulations.assistantservice.model.SearchFilters;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns persistence of documents and their embedded chunks.
 * <p>
 * All methods throw {@link com.example.regulations.assistantservice.error.StorageException}
 * on constraint violations or lost connectivity; callers get no partial results.
 */
public interface VectorStore {

    /**
     * Replaces every chunk of {@code document} with {@code chunks}. Readers see either the old
     * chunk set or the new one, never a mix.
     */
    void upsertDocument(RegulatoryDocument document, List<DocumentChunk> chunks);

    /**
     * @return at most {@code k} hits ordered by non-increasing score, all satisfying {@code filters}
     */
    List<RetrievalResult> search(float[] queryVector, SearchFilters filters, int k);

    Optional<RegulatoryDocument> findDocument(String sourceId);

    List<DocumentChunk> findChunks(String sourceId);

    Map<String, DocumentFingerprint> findFingerprints(Collection<String> sourceIds);

    List<Agency> agencies();

    List<RegulatoryDocument> recentDocuments(int days, int limit);

    /**
     * @return up to {@code limit} documents of one agency, newest publication first
     */
    List<RegulatoryDocument> documentsByAgency(String agencyId, int limit);

    DocumentStats stats();
}
