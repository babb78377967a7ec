package com.example.regulations.assistantservice.repo;

import com.example.regulations.assistantservice.model.IngestionCheckpoint;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface IngestionCheckpointRepository extends MongoRepository<IngestionCheckpoint, String> {
}
