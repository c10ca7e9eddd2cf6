package me.golemcore.editor.tools;

import me.golemcore.editor.domain.model.DocumentState;
import me.golemcore.editor.domain.model.ToolContext;
import me.golemcore.editor.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReadDocumentToolTest {

    @Test
    void shouldReturnContentWithoutMutation() throws Exception {
        ReadDocumentTool tool = new ReadDocumentTool();
        ToolContext context = new ToolContext("run-1", new DocumentState("doc-1", "notes.md", "markdown", "a\nb"));

        ToolResult result = tool.execute(Map.of(), context).get();

        assertTrue(result.isSuccess());
        assertFalse(result.hasNewContent());
        assertEquals("Read notes.md", result.getMessage());
        assertEquals(Map.of("content", "a\nb", "lines", 2), result.getData());
        assertTrue(tool.getDefinition().isParallelSafe());
    }
}
