package com.example.regulations.assistantservice.repo;

import com.example.regulations.assistantservice.model.PendingDocument;
import com.example.regulations.assistantservice.model.PendingStage;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface PendingDocumentRepository extends MongoRepository<PendingDocument, String> {

    List<PendingDocument> findByStage(PendingStage stage);
}
