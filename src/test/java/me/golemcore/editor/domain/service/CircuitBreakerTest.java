package me.golemcore.editor.domain.service;

import me.golemcore.editor.domain.model.CircuitState;
import me.golemcore.editor.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CircuitBreakerTest {

    private static final String TOOL = "replace_in_file";

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        breaker = new CircuitBreaker(3, Duration.ofSeconds(60), clock);
    }

    @Test
    void shouldOpenAfterThresholdConsecutiveFailures() {
        breaker.recordFailure(TOOL);
        breaker.recordFailure(TOOL);
        assertFalse(breaker.isOpen(TOOL));

        breaker.recordFailure(TOOL);

        assertTrue(breaker.isOpen(TOOL));
        assertEquals(3, breaker.getState(TOOL).failureCount());
    }

    @Test
    void shouldResetCountOnSuccess() {
        breaker.recordFailure(TOOL);
        breaker.recordFailure(TOOL);
        breaker.recordSuccess(TOOL);
        breaker.recordFailure(TOOL);

        assertFalse(breaker.isOpen(TOOL));
        assertEquals(1, breaker.getState(TOOL).failureCount());
    }

    @Test
    void shouldCloseOnceCooldownElapsed() {
        openCircuit();

        clock.advance(Duration.ofSeconds(59));
        assertTrue(breaker.isOpen(TOOL));

        clock.advance(Duration.ofSeconds(1));
        assertFalse(breaker.isOpen(TOOL));
        assertEquals(CircuitState.closed(), breaker.getState(TOOL));
    }

    @Test
    void shouldCloseOnManualReset() {
        openCircuit();

        breaker.reset(TOOL);

        assertFalse(breaker.isOpen(TOOL));
        assertTrue(breaker.snapshot().isEmpty());
    }

    @Test
    void shouldTrackToolsIndependently() {
        openCircuit();

        assertFalse(breaker.isOpen("write_to_file"));
        assertEquals(1, breaker.snapshot().size());
    }

    private void openCircuit() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure(TOOL);
        }
    }
}
