package me.golemcore.editor.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.editor.domain.model.CircuitState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-tool circuit breaker shared by all runs.
 *
 * <p>
 * A tool's circuit opens after {@code threshold} consecutive failed attempts
 * and closes again once {@code cooldown} has passed since the last failure,
 * on the next success, or on an explicit {@link #reset(String)}. All updates
 * go through atomic map operations, so concurrent runs observe a consistent
 * state per tool.
 */
@Slf4j
public class CircuitBreaker {

    private final int threshold;
    private final Duration cooldown;
    private final Clock clock;
    private final Map<String, CircuitState> states = new ConcurrentHashMap<>();

    public CircuitBreaker(int threshold, Duration cooldown, Clock clock) {
        this.threshold = threshold;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    public boolean isOpen(String toolName) {
        CircuitState state = states.computeIfPresent(toolName, (name, current) -> {
            if (current.open() && cooledDown(current)) {
                log.info("[Circuit] Cooldown elapsed, closing circuit for '{}'", name);
                return null;
            }
            return current;
        });
        return state != null && state.open();
    }

    public void recordFailure(String toolName) {
        Instant now = clock.instant();
        states.compute(toolName, (name, current) -> {
            int failures = current != null ? current.failureCount() + 1 : 1;
            boolean open = failures >= threshold;
            if (open && (current == null || !current.open())) {
                log.warn("[Circuit] Opening circuit for '{}' after {} consecutive failures", name, failures);
            }
            return new CircuitState(failures, now, open);
        });
    }

    public void recordSuccess(String toolName) {
        states.remove(toolName);
    }

    public void reset(String toolName) {
        if (states.remove(toolName) != null) {
            log.info("[Circuit] Circuit for '{}' reset", toolName);
        }
    }

    public CircuitState getState(String toolName) {
        isOpen(toolName);
        return states.getOrDefault(toolName, CircuitState.closed());
    }

    public Map<String, CircuitState> snapshot() {
        return new TreeMap<>(states);
    }

    private boolean cooledDown(CircuitState state) {
        return state.lastFailure() != null
                && !clock.instant().isBefore(state.lastFailure().plus(cooldown));
    }
}
