// src/main/java/com/example/regulations/assistantservice/repo/RegulatoryDocumentRepository.java
package com.example.regulations.assistantservice.repo;

import com.example.regulations.assistantservice.model.RegulatoryDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.LocalDate;
import java.util.List;

public interface RegulatoryDocumentRepository extends MongoRepository<RegulatoryDocument, String> {

    List<RegulatoryDocument> findByPublicationDateGreaterThanEqualOrderByPublicationDateDesc(LocalDate since, Pageable page);

    List<RegulatoryDocument> findByAgencyIdOrderByPublicationDateDescSourceIdAsc(String agencyId, Pageable page);
}
