// src/main/java/com/example/regulations/assistantservice/service/query/RegulationPromptBuilder.java
package com.example.regulations.assistantservice.service.query;

import com.example.regulations.assistantservice.model.RetrievalResult;
import com.example.regulations.assistantservice.model.SearchFilters;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class RegulationPromptBuilder {

    static final String NO_MATCHES = "No matching documents were found in the Federal Register database for this question.";

    static final String SYSTEM_PROMPT = """
            You are a helpful Federal Register document assistant. You answer questions about federal \
            documents, regulations, and government publications using passages retrieved from the \
            Federal Register database.
            When presenting results, summarize the key information clearly and cite the document numbers \
            you relied on. Be helpful, accurate, and informative in your responses.""";

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String buildUserMessage(String question, AssembledContext context, SearchFilters filters) {
        return String.format("""
            CONTEXT:
            %s
            %s
            QUESTION: %s

            INSTRUCTIONS:
            - Answer based only on the information provided in the context above
            - Mention document numbers, agencies, and publication dates when available
            - If the context does not answer the question, say so clearly
            - Be concise but complete in your response

            ANSWER:""", formatContext(context), formatFilters(filters), question);
    }

    private static String formatContext(AssembledContext context) {
        if (context.isEmpty()) {
            return NO_MATCHES + "\n";
        }
        StringBuilder sb = new StringBuilder();
        for (RetrievalResult hit : context.included()) {
            sb.append("Document ").append(hit.documentId());
            if (hit.title() != null) {
                sb.append(" \"").append(hit.title()).append('"');
            }
            sb.append(" (").append(hit.agencyName() == null ? "unknown agency" : hit.agencyName());
            if (hit.publicationDate() != null) {
                sb.append(", published ").append(hit.publicationDate());
            }
            sb.append(String.format(Locale.ROOT, ", score: %.3f", hit.score())).append("):\n");
            sb.append(hit.text()).append("\n\n");
        }
        return sb.toString();
    }

    private static String formatFilters(SearchFilters filters) {
        if (filters == null || filters.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("Search was restricted to");
        if (filters.agencyId() != null) {
            sb.append(" agency ").append(filters.agencyId());
        }
        if (filters.publishedFrom() != null) {
            sb.append(" published from ").append(filters.publishedFrom());
        }
        if (filters.publishedTo() != null) {
            sb.append(" published through ").append(filters.publishedTo());
        }
        return sb.append(".\n").toString();
    }
}
