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

import lombok.RequiredArgsConstructor;
import me.golemcore.editor.domain.model.EditEvent;
import me.golemcore.editor.port.outbound.EditEventSink;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Republishes edit events on the Spring application event bus, so any
 * {@code @EventListener(EditEvent.class)} method can observe runs.
 */
@Component
@RequiredArgsConstructor
public class SpringEditEventSink implements EditEventSink {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void onEvent(EditEvent event) {
        eventPublisher.publishEvent(event);
    }
}
