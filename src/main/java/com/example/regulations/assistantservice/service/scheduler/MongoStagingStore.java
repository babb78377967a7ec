package com.example.regulations.assistantservice.service.scheduler;

import com.example.regulations.assistantservice.error.StorageException;
import com.example.regulations.assistantservice.model.PendingDocument;
import com.example.regulations.assistantservice.model.PendingStage;
import com.example.regulations.assistantservice.repo.PendingDocumentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.store.type", havingValue = "mongo", matchIfMissing = true)
public class MongoStagingStore implements StagingStore {

    private final PendingDocumentRepository repository;

    @Override
    public void save(PendingDocument pending) {
        try {
            repository.save(pending);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to stage " + pending.getSourceId(), e);
        }
    }

    @Override
    public void saveAll(List<PendingDocument> pending) {
        if (pending.isEmpty()) {
            return;
        }
        try {
            repository.saveAll(pending);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to stage " + pending.size() + " documents", e);
        }
    }

    @Override
    public List<PendingDocument> findByStage(PendingStage stage) {
        try {
            return repository.findByStage(stage);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read staged documents", e);
        }
    }

    @Override
    public void delete(String sourceId) {
        try {
            repository.deleteById(sourceId);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to unstage " + sourceId, e);
        }
    }

    @Override
    public long count() {
        try {
            return repository.count();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to count staged documents", e);
        }
    }
}
