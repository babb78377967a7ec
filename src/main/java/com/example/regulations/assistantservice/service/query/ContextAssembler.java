package com.example.regulations.assistantservice.service.query;

import com.example.regulations.assistantservice.model.RetrievalResult;
import com.example.regulations.assistantservice.service.chunk.TextTokenizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Packs ranked chunks into a token budget. Chunks are taken in rank order; the first one that
 * does not fit is cut down to the remaining budget and assembly stops there.
 */
@Component
public class ContextAssembler {

    public AssembledContext assemble(List<RetrievalResult> ranked, int tokenBudget) {
        List<RetrievalResult> included = new ArrayList<>();
        Map<String, Citation> citations = new LinkedHashMap<>();
        int used = 0;
        for (RetrievalResult hit : ranked) {
            int remaining = tokenBudget - used;
            if (remaining <= 0) {
                break;
            }
            int tokens = hit.tokenCount() > 0 ? hit.tokenCount() : TextTokenizer.count(hit.text());
            RetrievalResult piece = hit;
            if (tokens > remaining) {
                piece = truncated(hit, remaining);
                tokens = remaining;
            }
            included.add(piece);
            citations.putIfAbsent(hit.documentId(), new Citation(hit.documentId(), hit.title(), hit.agencyId(),
                    hit.agencyName(), hit.publicationDate(), hit.score()));
            used += tokens;
        }
        return new AssembledContext(List.copyOf(included), List.copyOf(citations.values()), used);
    }

    private static RetrievalResult truncated(RetrievalResult hit, int maxTokens) {
        return new RetrievalResult(hit.documentId(), hit.sequenceIndex(), TextTokenizer.truncate(hit.text(), maxTokens),
                maxTokens, hit.similarity(), hit.score(), hit.title(), hit.agencyId(), hit.agencyName(),
                hit.publicationDate());
    }
}
