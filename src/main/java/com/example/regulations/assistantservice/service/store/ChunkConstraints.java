package com.example.regulations.assistantservice.service.store;

import com.example.regulations.assistantservice.error.StorageException;
import com.example.regulations.assistantservice.model.DocumentChunk;
import com.example.regulations.assistantservice.model.RegulatoryDocument;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Objects;

/**
 * Integrity rules every store enforces before accepting a chunk set.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class ChunkConstraints {

    static void check(RegulatoryDocument document, List<DocumentChunk> chunks) {
        if (document == null || document.getSourceId() == null || document.getSourceId().isBlank()) {
            throw new StorageException("Document without source id cannot be stored");
        }
        String id = document.getSourceId();
        String version = null;
        int dimension = -1;
        for (int i = 0; i < chunks.size(); i++) {
            DocumentChunk chunk = chunks.get(i);
            if (chunk.getSequenceIndex() != i) {
                throw new StorageException("Chunk sequence of " + id + " is not gapless at position " + i);
            }
            if (chunk.getEmbedding() == null || chunk.getEmbedding().isEmpty()) {
                throw new StorageException("Chunk " + i + " of " + id + " has no embedding");
            }
            if (i == 0) {
                version = chunk.getModelVersion();
                dimension = chunk.getEmbedding().size();
            } else if (!Objects.equals(version, chunk.getModelVersion()) || dimension != chunk.getEmbedding().size()) {
                throw new StorageException("Chunks of " + id + " mix embedding model versions");
            }
        }
    }
}
