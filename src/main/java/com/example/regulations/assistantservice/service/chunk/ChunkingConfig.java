package com.example.regulations.assistantservice.service.chunk;

import com.example.regulations.assistantservice.error.ChunkingException;

public record ChunkingConfig(int maxTokens, int overlapTokens) {

    public ChunkingConfig validate() {
        if (maxTokens <= 0) {
            throw new ChunkingException("max_tokens must be positive, was " + maxTokens);
        }
        if (overlapTokens < 0) {
            throw new ChunkingException("overlap_tokens must not be negative, was " + overlapTokens);
        }
        if (overlapTokens >= maxTokens) {
            throw new ChunkingException("overlap_tokens (" + overlapTokens
                    + ") must be smaller than max_tokens (" + maxTokens + ")");
        }
        return this;
    }
}
