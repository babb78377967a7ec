// src/main/java/com/example/regulations/assistantservice/repo/DocumentChunkRepository.java
package com.example.regulations.assistantservice.repo;

import com.example.regulations.assistantservice.model.DocumentChunk;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface DocumentChunkRepository extends MongoRepository<DocumentChunk, String> {

    List<DocumentChunk> findByDocumentIdAndGenerationOrderBySequenceIndex(String documentId, String generation);
}
