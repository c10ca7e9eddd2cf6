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
import me.golemcore.editor.domain.model.EditEvent;
import me.golemcore.editor.domain.model.EditEventType;
import me.golemcore.editor.port.outbound.EditEventSink;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds progress events and hands them to every registered sink. Delivery is
 * best effort: a failing sink is logged and skipped, and the loop continues
 * exactly as it would with no sinks at all.
 */
@Slf4j
public class EditEventPublisher {

    private final Clock clock;
    private final List<EditEventSink> sinks;

    public EditEventPublisher(Clock clock, List<EditEventSink> sinks) {
        this.clock = clock;
        this.sinks = sinks != null ? List.copyOf(sinks) : List.of();
    }

    public EditEvent emit(String runId, String documentId, Integer iteration, EditEventType type,
            Map<String, Object> payload) {
        Map<String, Object> safePayload = new LinkedHashMap<>();
        if (payload != null) {
            payload.forEach((key, value) -> {
                if (value != null) {
                    safePayload.put(key, value);
                }
            });
        }
        EditEvent event = EditEvent.builder()
                .type(type)
                .timestamp(Instant.now(clock))
                .runId(runId)
                .documentId(documentId)
                .iteration(iteration)
                .payload(safePayload)
                .build();

        for (EditEventSink sink : sinks) {
            try {
                sink.onEvent(event);
            } catch (Exception e) { // NOSONAR - observers must never affect orchestration
                log.warn("[Events] Sink {} failed on {}: {}", sink.getClass().getSimpleName(), type, e.getMessage());
            }
        }
        return event;
    }
}
