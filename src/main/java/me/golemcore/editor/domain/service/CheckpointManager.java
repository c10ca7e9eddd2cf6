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
import me.golemcore.editor.domain.model.Checkpoint;
import me.golemcore.editor.domain.model.DocumentState;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Bounded FIFO of document snapshots for one run. The oldest checkpoint is
 * evicted when capacity is exceeded. Rollback is an explicit escape hatch and
 * never part of the normal path.
 */
@Slf4j
public class CheckpointManager {

    public static final int DEFAULT_CAPACITY = 10;

    private final int capacity;
    private final Clock clock;
    private final Deque<Checkpoint> checkpoints = new ArrayDeque<>();
    private int sequence;

    public CheckpointManager(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    public synchronized Checkpoint create(DocumentState state, int iteration, String description) {
        Instant now = clock.instant();
        // sequence disambiguates checkpoints created within the same millisecond
        String id = "cp_" + now.toEpochMilli() + "_" + iteration + "_" + sequence++;
        Checkpoint checkpoint = new Checkpoint(id, state, iteration, description, now);
        checkpoints.addLast(checkpoint);
        while (checkpoints.size() > capacity) {
            Checkpoint evicted = checkpoints.removeFirst();
            log.trace("[Checkpoint] Evicted {}", evicted.id());
        }
        log.debug("[Checkpoint] Created {} ({})", checkpoint.id(), description);
        return checkpoint;
    }

    public synchronized List<Checkpoint> list() {
        return List.copyOf(checkpoints);
    }

    public synchronized Optional<Checkpoint> get(String id) {
        return checkpoints.stream().filter(cp -> cp.id().equals(id)).findFirst();
    }

    public synchronized Optional<Checkpoint> getLatest() {
        return Optional.ofNullable(checkpoints.peekLast());
    }

    /**
     * Returns the checkpoint {@code n} entries before the latest one.
     */
    public synchronized Optional<Checkpoint> getFromIterationsAgo(int n) {
        List<Checkpoint> ordered = new ArrayList<>(checkpoints);
        int index = ordered.size() - 1 - n;
        if (n < 0 || index < 0) {
            return Optional.empty();
        }
        return Optional.of(ordered.get(index));
    }

    /**
     * Drops every checkpoint created after {@code id} and returns the state it
     * holds.
     */
    public synchronized Optional<DocumentState> rollbackTo(String id) {
        if (get(id).isEmpty()) {
            return Optional.empty();
        }
        Iterator<Checkpoint> descending = checkpoints.descendingIterator();
        while (descending.hasNext()) {
            Checkpoint checkpoint = descending.next();
            if (checkpoint.id().equals(id)) {
                log.info("[Checkpoint] Rolled back to {}", id);
                return Optional.of(checkpoint.state());
            }
            descending.remove();
        }
        return Optional.empty();
    }

    public synchronized void clear() {
        checkpoints.clear();
    }

    public synchronized int size() {
        return checkpoints.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
