package com.example.regulations.assistantservice.service.query;

import java.util.List;

/**
 * Conversation the question belongs to; history is oldest first.
 */
public record SessionContext(String sessionId, List<ConversationTurn> history) {

    public SessionContext {
        history = history == null ? List.of() : List.copyOf(history);
    }

    public static SessionContext empty() {
        return new SessionContext(null, List.of());
    }

    /**
     * @return at most the last {@code turns} entries
     */
    public List<ConversationTurn> lastTurns(int turns) {
        if (turns <= 0) {
            return List.of();
        }
        return history.subList(Math.max(0, history.size() - turns), history.size());
    }
}
