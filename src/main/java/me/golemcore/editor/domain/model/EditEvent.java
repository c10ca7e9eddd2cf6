package me.golemcore.editor.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Progress event emitted by the orchestration loop to observers.
 */
@Builder
public record EditEvent(EditEventType type, Instant timestamp, String runId, String documentId, Integer iteration,
        Map<String, Object> payload) {
}
