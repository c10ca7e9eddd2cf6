package me.golemcore.editor.domain.model;

import java.time.Instant;

/**
 * Failure bookkeeping for one tool name.
 */
public record CircuitState(int failureCount, Instant lastFailure, boolean open) {

    public static CircuitState closed() {
        return new CircuitState(0, null, false);
    }
}
