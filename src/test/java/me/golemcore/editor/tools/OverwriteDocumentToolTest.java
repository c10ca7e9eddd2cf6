package me.golemcore.editor.tools;

import me.golemcore.editor.domain.model.DocumentState;
import me.golemcore.editor.domain.model.ToolContext;
import me.golemcore.editor.domain.model.ToolFailureKind;
import me.golemcore.editor.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class OverwriteDocumentToolTest {

    private final OverwriteDocumentTool tool = new OverwriteDocumentTool();
    private final ToolContext context = new ToolContext("run-1", new DocumentState("doc-1", "a.txt", null, "old"));

    @Test
    void shouldReplaceWholeDocument() throws Exception {
        ToolResult result = tool.execute(Map.of("content", "new\ncontent"), context).get();

        assertEquals("new\ncontent", result.getNewContent());
        assertEquals("Wrote 2 lines", result.getMessage());
    }

    @Test
    void shouldRejectBlankContent() throws Exception {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("content", "  \n ");

        ToolResult result = tool.execute(parameters, context).get();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.STRUCTURAL, result.getFailureKind());
        assertEquals("No content provided", result.getMessage());
    }
}
