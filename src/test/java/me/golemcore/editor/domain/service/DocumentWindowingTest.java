package me.golemcore.editor.domain.service;

import me.golemcore.editor.domain.model.DocumentWindow;
import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentWindowingTest {

    private final DocumentWindowing windowing = new DocumentWindowing(100, 100_000, 20);

    @Test
    void shouldReturnSmallDocumentUnchanged() {
        DocumentWindow window = windowing.window("a\nb\nc", null);

        assertEquals("a\nb\nc", window.content());
        assertFalse(window.isPartial());
        assertEquals(3, window.totalLines());
    }

    @Test
    void shouldCenterWindowOnFocus() {
        DocumentWindow window = windowing.window(lines(300), "LINE 150");

        assertTrue(window.isPartial());
        assertTrue(window.moreBefore());
        assertTrue(window.moreAfter());
        assertTrue(window.startLine() <= 150 && window.endLine() >= 150);
        assertTrue(window.content().contains("150| line 150"));
    }

    @Test
    void shouldShowDocumentHeadWithoutFocus() {
        DocumentWindow window = windowing.window(lines(300), null);

        assertEquals(1, window.startLine());
        assertEquals(100, window.endLine());
        assertTrue(window.content().startsWith("1| line 1"));
        assertFalse(window.moreBefore());
    }

    @Test
    void shouldWindowWhenCharacterLimitExceeded() {
        DocumentWindowing tight = new DocumentWindowing(1_000, 50, 20);

        DocumentWindow window = tight.window(lines(10), null);

        assertEquals(10, window.endLine());
        assertTrue(window.content().startsWith("1| "));
    }

    @Test
    void shouldSummarizeAddedAndRemovedLines() {
        String summary = DocumentWindowing.diffSummary("keep\nold one\nold two", "keep\nnew one");

        assertEquals("+1/-2 lines\n+ new one\n- old one\n- old two", summary);
    }

    private static String lines(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(i -> "line " + i).collect(Collectors.joining("\n"));
    }
}
