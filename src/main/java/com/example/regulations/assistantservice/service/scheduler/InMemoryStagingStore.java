package com.example.regulations.assistantservice.service.scheduler;

import com.example.regulations.assistantservice.model.PendingDocument;
import com.example.regulations.assistantservice.model.PendingStage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory")
public class InMemoryStagingStore implements StagingStore {

    private final Map<String, PendingDocument> pending = new ConcurrentHashMap<>();

    @Override
    public void save(PendingDocument document) {
        pending.put(document.getSourceId(), copy(document));
    }

    @Override
    public void saveAll(List<PendingDocument> documents) {
        documents.forEach(this::save);
    }

    @Override
    public List<PendingDocument> findByStage(PendingStage stage) {
        List<PendingDocument> out = new ArrayList<>();
        for (PendingDocument p : pending.values()) {
            if (p.getStage() == stage) {
                out.add(copy(p));
            }
        }
        out.sort(Comparator.comparing(PendingDocument::getSourceId));
        return out;
    }

    @Override
    public void delete(String sourceId) {
        pending.remove(sourceId);
    }

    @Override
    public long count() {
        return pending.size();
    }

    private static PendingDocument copy(PendingDocument p) {
        return PendingDocument.builder()
                .sourceId(p.getSourceId())
                .document(p.getDocument() == null ? null : p.getDocument().toBuilder().build())
                .stage(p.getStage())
                .chunks(new ArrayList<>(p.getChunks() == null ? List.of() : p.getChunks()))
                .runId(p.getRunId())
                .attempts(p.getAttempts())
                .lastError(p.getLastError())
                .updatedAt(p.getUpdatedAt())
                .build();
    }
}
