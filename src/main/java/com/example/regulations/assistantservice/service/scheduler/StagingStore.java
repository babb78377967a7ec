package com.example.regulations.assistantservice.service.scheduler;

import com.example.regulations.assistantservice.model.PendingDocument;
import com.example.regulations.assistantservice.model.PendingStage;

import java.util.List;

/**
 * Fetched documents waiting to be chunked, embedded or committed. Entries outlive a run so an
 * interrupted or partially failed run can be picked up by the next one.
 */
public interface StagingStore {

    void save(PendingDocument pending);

    void saveAll(List<PendingDocument> pending);

    List<PendingDocument> findByStage(PendingStage stage);

    void delete(String sourceId);

    long count();
}
