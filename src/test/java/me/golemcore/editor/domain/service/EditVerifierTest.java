package me.golemcore.editor.domain.service;

import me.golemcore.editor.domain.model.EditComplexity;
import me.golemcore.editor.domain.model.VerificationResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EditVerifierTest {

    private static final String BEFORE = String.join("\n",
            "function a() {", "  return 1;", "}", "", "function b() {", "  return 2;", "}", "",
            "function c() {", "  return 3;", "}");

    private final EditVerifier verifier = new EditVerifier();

    @Test
    void shouldPassSmallBalancedEdit() {
        String after = BEFORE.replace("return 2;", "return 20;");

        VerificationResult result = verifier.verify(BEFORE, after, "return 20 from b", "js");

        assertEquals("+1 lines, -1 lines", result.getDiffSummary());
        assertEquals(1, result.getLinesAdded());
        assertEquals(1, result.getLinesRemoved());
        assertTrue(result.isSyntaxValid());
        assertFalse(result.isUnexpectedChanges());
        assertFalse(result.hasWarnings());
        assertEquals(1.0, result.getConfidence());
    }

    @Test
    void shouldWarnWhenNothingChanged() {
        VerificationResult result = verifier.verify(BEFORE, BEFORE, "anything", "js");

        assertEquals(0.0, result.getConfidence());
        assertTrue(result.getWarnings().get(0).startsWith("Edit produced no changes"));
    }

    @Test
    void shouldFlagUnbalancedBrackets() {
        String after = BEFORE.replace("  return 3;\n}", "  return 3;");

        VerificationResult result = verifier.verify(BEFORE, after, "drop a line", "js");

        assertFalse(result.isSyntaxValid());
        assertTrue(result.getWarnings().contains("Possible syntax issue: unclosed '{'"));
        assertEquals(0.6 * 0.9, result.getConfidence(), 1e-9);
    }

    @Test
    void shouldSkipBracketCheckForProse() {
        VerificationResult result = verifier.verify("Intro (draft", "Intro (final draft", "edit", "markdown");

        assertTrue(result.isSyntaxValid());
    }

    @Test
    void shouldScaleChangeAllowanceWithComplexity() {
        String after = BEFORE.replace("return 1;", "return 10;").replace("return 2;", "return 20;");

        VerificationResult trivial = verifier.verify(BEFORE, after, "bump values", "js", EditComplexity.TRIVIAL);
        VerificationResult complex = verifier.verify(BEFORE, after, "bump values", "js", EditComplexity.COMPLEX);

        assertTrue(trivial.isUnexpectedChanges());
        assertTrue(trivial.getWarnings().get(0).startsWith("Large change ratio: 36%"));
        assertFalse(complex.isUnexpectedChanges());
    }

    @Test
    void shouldAllowLargeChangesWhenRewriteRequested() {
        VerificationResult result = verifier.verify(BEFORE, "const x = 1;", "Rewrite the module", "js");

        assertFalse(result.isUnexpectedChanges());
    }

    @Test
    void shouldNeverFlagSingleLineDocumentAsUnexpected() {
        VerificationResult result = verifier.verify("hello", "goodbye", "change word", "text",
                EditComplexity.TRIVIAL);

        assertFalse(result.isUnexpectedChanges());
    }

    @Test
    void shouldIgnoreBracketsInsideStrings() {
        assertNull(EditVerifier.checkBrackets("const s = \"{[(\";\nfoo(s);"));
        assertEquals("unexpected ')'", EditVerifier.checkBrackets("foo());"));
    }
}
