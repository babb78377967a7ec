package com.example.regulations.assistantservice.service.query;

import com.example.regulations.assistantservice.model.RetrievalResult;

import java.util.List;

/**
 * @param included chunks placed in the prompt, in rank order; the last one may be truncated
 * @param citations distinct documents behind {@code included}, in rank order
 * @param tokenCount chunk tokens used, never above the budget
 */
public record AssembledContext(List<RetrievalResult> included, List<Citation> citations, int tokenCount) {

    public boolean isEmpty() {
        return included.isEmpty();
    }
}
