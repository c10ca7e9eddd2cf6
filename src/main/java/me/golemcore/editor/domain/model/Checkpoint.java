package me.golemcore.editor.domain.model;

import java.time.Instant;

/**
 * Immutable document snapshot taken after a successful mutation.
 */
public record Checkpoint(String id, DocumentState state, int iteration, String description, Instant createdAt) {
}
