package com.example.regulations.assistantservice.service.session;

import com.example.regulations.assistantservice.config.RagProperties;
import com.example.regulations.assistantservice.service.query.ConversationTurn;
import com.example.regulations.assistantservice.support.MutableClock;
import com.example.regulations.assistantservice.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ChatSessionServiceTest {

    private MutableClock clock;
    private ChatSessionService sessions;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-03T12:00:00Z");
        RagProperties properties = TestData.properties();
        properties.getSession().setTimeout(Duration.ofMinutes(30));
        properties.getSession().setMaxHistory(4);
        sessions = new ChatSessionService(properties, clock);
    }

    @Test
    void recordsTurnsInOrder() {
        sessions.record("s1", "What is new?", "Two rules.");

        assertThat(sessions.history("s1")).containsExactly(
                ConversationTurn.user("What is new?"), ConversationTurn.assistant("Two rules."));
        assertThat(sessions.context("s1").sessionId()).isEqualTo("s1");
        assertThat(sessions.history("other")).isEmpty();
    }

    @Test
    void keepsOnlyTheNewestTurns() {
        sessions.record("s1", "q1", "a1");
        sessions.record("s1", "q2", "a2");
        sessions.record("s1", "q3", "a3");

        assertThat(sessions.history("s1")).extracting(ConversationTurn::content)
                .containsExactly("q2", "a2", "q3", "a3");
    }

    @Test
    void idleSessionExpires() {
        sessions.record("s1", "q1", "a1");
        clock.advance(Duration.ofMinutes(31));

        assertThat(sessions.history("s1")).isEmpty();

        sessions.record("s1", "q2", "a2");
        assertThat(sessions.history("s1")).extracting(ConversationTurn::content).containsExactly("q2", "a2");
    }

    @Test
    void activityKeepsSessionAlive() {
        sessions.record("s1", "q1", "a1");
        clock.advance(Duration.ofMinutes(20));
        sessions.record("s1", "q2", "a2");
        clock.advance(Duration.ofMinutes(20));

        assertThat(sessions.history("s1")).hasSize(4);
    }

    @Test
    void sweepEvictsOnlyIdleSessions() {
        sessions.record("old", "q", "a");
        clock.advance(Duration.ofMinutes(40));
        sessions.record("fresh", "q", "a");

        assertThat(sessions.evictExpired()).isEqualTo(1);
        assertThat(sessions.activeSessions()).isEqualTo(1);
        assertThat(sessions.history("fresh")).isNotEmpty();
    }

    @Test
    void clearRemovesSession() {
        sessions.record("s1", "q", "a");

        assertThat(sessions.clear("s1")).isTrue();
        assertThat(sessions.clear("s1")).isFalse();
        assertThat(sessions.history("s1")).isEmpty();
    }
}
