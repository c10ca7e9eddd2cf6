package me.golemcore.editor.domain.service;

import me.golemcore.editor.domain.model.DocumentState;
import me.golemcore.editor.domain.model.EditComplexity;
import me.golemcore.editor.domain.model.EditGoal;
import me.golemcore.editor.domain.model.SubGoal;
import me.golemcore.editor.domain.model.ToolFailureKind;
import me.golemcore.editor.domain.model.ToolResult;
import me.golemcore.editor.domain.model.VerificationResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EditPromptBuilderTest {

    private static final DocumentState DOCUMENT = new DocumentState("doc-1", "app.js", "js", """
            import fs from 'fs';
            export function load() {
              return fs.readFileSync('a');
            }
            class Store {}
            const save = (x) => x;""");

    private final EditPromptBuilder builder = new EditPromptBuilder(new DocumentWindowing(400, 40_000, 20));

    // --- system prompt ---

    @Test
    void shouldOfferOnlyOverwriteForTrivialGoals() {
        String prompt = builder.systemPrompt(EditGoal.of("rename load", EditComplexity.TRIVIAL), DOCUMENT);

        assertTrue(prompt.contains("<write_to_file>"));
        assertFalse(prompt.contains("<replace_in_file>"));
        assertFalse(prompt.contains("OUTLINE"));
        assertTrue(prompt.endsWith("reply with \"GOAL ACHIEVED\" and no tool call."));
    }

    @Test
    void shouldAddOutlineAndPlanningForComplexGoals() {
        String prompt = builder.systemPrompt(EditGoal.of("refactor the store", EditComplexity.COMPLEX), DOCUMENT);

        assertTrue(prompt.contains("<replace_in_file>"));
        assertTrue(prompt.contains("<search_files>"));
        assertTrue(prompt.contains("OUTLINE: L2: load | L5: Store | L6: save"));
        assertTrue(prompt.contains("Work through the sub-goals in order."));
    }

    @Test
    void shouldSkipOutlineForUnknownLanguage() {
        DocumentState notes = new DocumentState("doc-2", "notes", "markdown", "# Title\nclass notes");

        assertEquals("", EditPromptBuilder.outline(notes));
    }

    // --- iteration prompt ---

    @Test
    void shouldAskForFirstChange() {
        String prompt = builder.iterationPrompt(context(0, 0, DOCUMENT).build());

        assertTrue(prompt.startsWith("ITERATION 1/12\nProgress: [.....] 0 changes\nGOAL: tidy up"));
        assertTrue(prompt.contains("```js\nimport fs from 'fs';"));
        assertFalse(prompt.contains("CHANGES SO FAR"));
        assertTrue(prompt.endsWith("Make the change now with one tool call."));
    }

    @Test
    void shouldReportLastResultWarningsAndChanges() {
        DocumentState edited = DOCUMENT.withContent(DOCUMENT.content().replace("'a'", "'b'"));
        List<SubGoal> subGoals = List.of(
                SubGoal.builder().index(0).description("swap path").status(SubGoal.Status.DONE).build(),
                SubGoal.builder().index(1).description("add docs").status(SubGoal.Status.IN_PROGRESS).build());

        String prompt = builder.iterationPrompt(context(2, 1, edited)
                .subGoals(subGoals)
                .lastToolName("replace_in_file")
                .lastResult(ToolResult.builder().success(true).message("Applied 1 replacement(s)").build())
                .lastVerification(VerificationResult.builder()
                        .warnings(List.of("Large change ratio: 40% of document modified"))
                        .build())
                .build());

        assertTrue(prompt.contains("Progress: [#....] 1 changes"));
        assertTrue(prompt.contains("  [x] 1. swap path\n  [>] 2. add docs"));
        assertTrue(prompt.contains("Last: replace_in_file -> OK Applied 1 replacement(s)"));
        assertTrue(prompt.contains("VERIFIER WARNINGS:\n  - Large change ratio"));
        assertTrue(prompt.contains("CHANGES SO FAR: +1/-1 lines"));
        assertTrue(prompt.endsWith("reply \"GOAL ACHIEVED\" if the goal is met."));
    }

    @Test
    void shouldMarkFailedToolAndPartialWindow() {
        StringBuilder big = new StringBuilder();
        for (int i = 1; i <= 600; i++) {
            big.append("row ").append(i).append('\n');
        }
        DocumentState large = new DocumentState("doc-3", "rows.txt", null, big.toString());

        String prompt = builder.iterationPrompt(context(1, 0, large)
                .lastToolName("replace_in_file")
                .lastResult(ToolResult.failure(ToolFailureKind.STRUCTURAL, "Search text not found"))
                .build());

        assertTrue(prompt.contains("Last: replace_in_file -> FAILED Search text not found"));
        assertTrue(prompt.contains("CURRENT DOCUMENT (lines 1-400 of 601):"));
    }

    @Test
    void shouldEstimateTokensFromLength() {
        assertEquals(0, EditPromptBuilder.estimateTokens(null));
        assertEquals(3, EditPromptBuilder.estimateTokens("0123456789"));
    }

    private static EditPromptBuilder.IterationContext.IterationContextBuilder context(int iteration, int changes,
            DocumentState current) {
        return EditPromptBuilder.IterationContext.builder()
                .iteration(iteration)
                .maxIterations(12)
                .changesApplied(changes)
                .goal(EditGoal.of("tidy up", EditComplexity.SIMPLE))
                .subGoals(List.of())
                .original(DOCUMENT)
                .current(current);
    }
}
