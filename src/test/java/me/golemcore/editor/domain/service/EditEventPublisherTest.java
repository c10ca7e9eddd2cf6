package me.golemcore.editor.domain.service;

import me.golemcore.editor.domain.model.EditEvent;
import me.golemcore.editor.domain.model.EditEventType;
import me.golemcore.editor.port.outbound.EditEventSink;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class EditEventPublisherTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void shouldStampEventAndDropNullPayloadValues() {
        EditEventSink sink = mock(EditEventSink.class);
        EditEventPublisher publisher = new EditEventPublisher(clock, List.of(sink));
        Map<String, Object> payload = new HashMap<>();
        payload.put("tool", "write_to_file");
        payload.put("failureKind", null);

        EditEvent event = publisher.emit("run-1", "doc-1", 2, EditEventType.TOOL_RESULT, payload);

        assertEquals(NOW, event.timestamp());
        assertEquals(2, event.iteration());
        assertEquals(Map.of("tool", "write_to_file"), event.payload());
        assertFalse(event.payload().containsKey("failureKind"));
        verify(sink).onEvent(event);
    }

    @Test
    void shouldKeepNotifyingSinksWhenOneFails() {
        EditEventSink failing = mock(EditEventSink.class);
        EditEventSink healthy = mock(EditEventSink.class);
        doThrow(new IllegalStateException("sink down")).when(failing).onEvent(any());
        EditEventPublisher publisher = new EditEventPublisher(clock, List.of(failing, healthy));

        EditEvent event = publisher.emit("run-1", null, null, EditEventType.START, null);

        verify(healthy).onEvent(event);
        assertEquals(Map.of(), event.payload());
    }
}
