package me.golemcore.editor.domain.service;

import me.golemcore.editor.domain.model.DocumentState;
import me.golemcore.editor.domain.model.ToolFailureKind;
import me.golemcore.editor.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolFailureGuidanceTest {

    private static final DocumentState DOCUMENT = new DocumentState("doc-1", "notes.md", "markdown",
            "line\n".repeat(20).strip());

    @Test
    void shouldShowDocumentHeadWhenSearchTextMissing() {
        ToolResult result = failure("replace_in_file", ToolFailureKind.STRUCTURAL,
                "Search text not found in document. Tried: \"foo\"");

        String guidance = ToolFailureGuidance.forFailure(result, DOCUMENT);

        assertTrue(guidance.startsWith("Your SEARCH text was not found in the document"));
        assertTrue(guidance.contains("... (5 more lines)"));
        assertTrue(guidance.contains("<write_to_file>\n<path>notes.md</path>"));
    }

    @Test
    void shouldShowPatchFormatForMalformedPatch() {
        ToolResult result = failure("replace_in_file", ToolFailureKind.STRUCTURAL,
                "No SEARCH/REPLACE blocks found - use the block format");

        String guidance = ToolFailureGuidance.forFailure(result, DOCUMENT);

        assertTrue(guidance.contains("<<<<<<< SEARCH\n[exact text from the document]\n======= REPLACE"));
    }

    @Test
    void shouldSuggestAnotherToolWhenCircuitOpen() {
        ToolResult result = failure("replace_in_file", ToolFailureKind.CIRCUIT_OPEN,
                "Tool replace_in_file temporarily disabled due to repeated failures");

        String guidance = ToolFailureGuidance.forFailure(result, DOCUMENT);

        assertTrue(guidance.startsWith("The tool replace_in_file is temporarily disabled"));
        assertTrue(guidance.contains("[COMPLETE NEW DOCUMENT CONTENT]"));
    }

    @Test
    void shouldFallBackToGenericGuidance() {
        ToolResult result = failure("search_files", ToolFailureKind.STRUCTURAL, "Invalid search pattern: bad");

        String guidance = ToolFailureGuidance.forFailure(result, DOCUMENT);

        assertTrue(guidance.startsWith("The tool call search_files failed: Invalid search pattern: bad"));
    }

    @Test
    void shouldEmbedCurrentContentInPrematureClaimGuidance() {
        String guidance = ToolFailureGuidance.forPrematureClaim(DOCUMENT);

        assertTrue(guidance.startsWith("You claimed the goal is achieved but you didn't make any changes"));
        assertTrue(guidance.contains("Current content:\n```\nline\nline"));
    }

    private static ToolResult failure(String tool, ToolFailureKind kind, String message) {
        return ToolResult.failure(kind, message).toBuilder().toolName(tool).build();
    }
}
