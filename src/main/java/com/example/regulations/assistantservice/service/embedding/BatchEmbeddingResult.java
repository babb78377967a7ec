package com.example.regulations.assistantservice.service.embedding;

import com.example.regulations.assistantservice.error.EmbeddingException;

import java.util.List;

/**
 * Per-batch outcome of {@link EmbeddingGenerator#embedBatches(List)}. A failed batch leaves
 * its texts without vectors; other batches are unaffected.
 */
public record BatchEmbeddingResult(int textCount, List<Batch> batches) {

    public record Batch(int index, int offset, int size, List<float[]> vectors, EmbeddingException error) {
        public boolean succeeded() {
            return error == null;
        }
    }

    /**
     * @return the vector for the input text at {@code textIndex}, or null if its batch failed
     */
    public float[] vectorFor(int textIndex) {
        for (Batch batch : batches) {
            if (textIndex >= batch.offset() && textIndex < batch.offset() + batch.size()) {
                return batch.succeeded() ? batch.vectors().get(textIndex - batch.offset()) : null;
            }
        }
        throw new IndexOutOfBoundsException("No batch covers text " + textIndex);
    }

    public List<Batch> failedBatches() {
        return batches.stream().filter(b -> !b.succeeded()).toList();
    }

    public boolean allSucceeded() {
        return batches.stream().allMatch(Batch::succeeded);
    }
}
