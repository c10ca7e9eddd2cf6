package me.golemcore.editor.domain.service;

import me.golemcore.editor.domain.model.Message;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class TranscriptTrimmerTest {

    private final TranscriptTrimmer trimmer = new TranscriptTrimmer(6, 4);

    @Test
    void shouldLeaveShortTranscriptUntouched() {
        List<Message> transcript = List.of(Message.system("sys"), Message.user("u1"), Message.assistant("a1"));

        assertEquals(transcript, trimmer.trim(transcript));
    }

    @Test
    void shouldKeepSystemMessagesAndMostRecentTurns() {
        Message system = Message.system("sys");
        List<Message> transcript = new ArrayList<>(List.of(system));
        for (int i = 1; i <= 4; i++) {
            transcript.add(Message.user("u" + i));
            transcript.add(Message.assistant("a" + i));
        }

        List<Message> trimmed = trimmer.trim(transcript);

        assertEquals(5, trimmed.size());
        assertSame(system, trimmed.get(0));
        assertEquals(List.of("u3", "a3", "u4", "a4"),
                trimmed.subList(1, 5).stream().map(Message::getContent).toList());
    }
}
