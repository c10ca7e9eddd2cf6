package me.golemcore.editor.adapter.outbound.event;

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
import org.springframework.stereotype.Component;

/**
 * Writes edit events to the log. Content snapshots are logged by size only.
 */
@Component
@Slf4j
public class LoggingEditEventSink implements EditEventSink {

    @Override
    public void onEvent(EditEvent event) {
        if (!log.isDebugEnabled()) {
            return;
        }
        Object payload = event.type() == EditEventType.CONTENT_CHANGE
                ? "diff=" + event.payload().get("diff")
                : event.payload();
        log.debug("[Events] run={} iteration={} {} {}", shortId(event.runId()), event.iteration(), event.type(),
                payload);
    }

    private static String shortId(String runId) {
        return runId != null && runId.length() > 8 ? runId.substring(0, 8) : runId;
    }
}
