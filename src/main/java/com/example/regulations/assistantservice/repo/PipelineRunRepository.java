package com.example.regulations.assistantservice.repo;

import com.example.regulations.assistantservice.model.PipelineRun;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface PipelineRunRepository extends MongoRepository<PipelineRun, String> {

    List<PipelineRun> findAllByOrderByStartedAtDesc(Pageable page);
}
