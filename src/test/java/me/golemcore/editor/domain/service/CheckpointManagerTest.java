package me.golemcore.editor.domain.service;

import me.golemcore.editor.domain.model.Checkpoint;
import me.golemcore.editor.domain.model.DocumentState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CheckpointManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private CheckpointManager manager;

    @BeforeEach
    void setUp() {
        manager = new CheckpointManager(3, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldEvictOldestBeyondCapacity() {
        for (int i = 0; i < 5; i++) {
            manager.create(doc("v" + i), i, "step " + i);
        }

        List<Checkpoint> checkpoints = manager.list();
        assertEquals(3, checkpoints.size());
        assertEquals("step 2", checkpoints.get(0).description());
        assertEquals("v4", manager.getLatest().orElseThrow().state().content());
    }

    @Test
    void shouldGenerateDistinctIdsWithinSameMillisecond() {
        Checkpoint first = manager.create(doc("a"), 0, "Initial state");
        Checkpoint second = manager.create(doc("b"), 0, "After write_to_file");

        assertNotEquals(first.id(), second.id());
        assertTrue(first.id().startsWith("cp_" + NOW.toEpochMilli() + "_0"));
        assertEquals(NOW, second.createdAt());
    }

    @Test
    void shouldLookUpByIdAndDistance() {
        Checkpoint first = manager.create(doc("a"), 0, "first");
        manager.create(doc("b"), 1, "second");

        assertEquals(Optional.of(first), manager.get(first.id()));
        assertEquals("a", manager.getFromIterationsAgo(1).orElseThrow().state().content());
        assertTrue(manager.getFromIterationsAgo(2).isEmpty());
        assertTrue(manager.getFromIterationsAgo(-1).isEmpty());
    }

    @Test
    void shouldDropNewerCheckpointsOnRollback() {
        Checkpoint first = manager.create(doc("a"), 0, "first");
        manager.create(doc("b"), 1, "second");
        manager.create(doc("c"), 2, "third");

        Optional<DocumentState> restored = manager.rollbackTo(first.id());

        assertEquals("a", restored.orElseThrow().content());
        assertEquals(1, manager.size());
        assertTrue(manager.rollbackTo("cp_missing").isEmpty());
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        assertThrows(IllegalArgumentException.class, () -> new CheckpointManager(0, clock));
    }

    private static DocumentState doc(String content) {
        return new DocumentState("doc-1", "notes.md", "markdown", content);
    }
}
