package com.example.regulations.assistantservice.service.session;

import com.example.regulations.assistantservice.config.RagProperties;
import com.example.regulations.assistantservice.service.query.ConversationTurn;
import com.example.regulations.assistantservice.service.query.SessionContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory chat history per session. Each session keeps its most recent turns only and is
 * dropped after sitting idle longer than {@code app.session.timeout}.
 */
@Slf4j
@Service
public class ChatSessionService {

    private record Session(List<ConversationTurn> turns, Instant lastActivity) {}

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Duration timeout;
    private final int maxHistory;
    private final Clock clock;

    public ChatSessionService(RagProperties properties, Clock clock) {
        this.timeout = properties.getSession().getTimeout();
        this.maxHistory = Math.max(2, properties.getSession().getMaxHistory());
        this.clock = clock;
    }

    public List<ConversationTurn> history(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return List.of();
        }
        if (isExpired(session, clock.instant())) {
            sessions.remove(sessionId, session);
            return List.of();
        }
        return session.turns();
    }

    public SessionContext context(String sessionId) {
        return new SessionContext(sessionId, history(sessionId));
    }

    /**
     * Appends one question/answer exchange and trims the history to its newest entries.
     */
    public void record(String sessionId, String question, String answer) {
        Instant now = clock.instant();
        sessions.compute(sessionId, (id, current) -> {
            List<ConversationTurn> turns = new ArrayList<>();
            if (current != null && !isExpired(current, now)) {
                turns.addAll(current.turns());
            }
            turns.add(ConversationTurn.user(question));
            turns.add(ConversationTurn.assistant(answer));
            if (turns.size() > maxHistory) {
                turns = turns.subList(turns.size() - maxHistory, turns.size());
            }
            return new Session(List.copyOf(turns), now);
        });
    }

    public boolean clear(String sessionId) {
        boolean removed = sessions.remove(sessionId) != null;
        if (removed) {
            log.info("Cleared session {}", sessionId);
        }
        return removed;
    }

    public int activeSessions() {
        return sessions.size();
    }

    @Scheduled(fixedDelayString = "${app.session.sweep-interval:PT5M}")
    public void sweep() {
        evictExpired();
    }

    public int evictExpired() {
        Instant now = clock.instant();
        int before = sessions.size();
        sessions.entrySet().removeIf(e -> isExpired(e.getValue(), now));
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.info("Evicted {} idle chat sessions", evicted);
        }
        return evicted;
    }

    private boolean isExpired(Session session, Instant now) {
        return session.lastActivity().plus(timeout).isBefore(now);
    }
}
