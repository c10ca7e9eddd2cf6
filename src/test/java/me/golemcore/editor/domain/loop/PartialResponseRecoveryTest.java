package me.golemcore.editor.domain.loop;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PartialResponseRecoveryTest {

    private static final String CODE_LINE = "export function step(n) { return n + 1; }\n";

    @Test
    void shouldCloseSubstantialTruncatedOverwrite() {
        String partial = "<write_to_file>\n<content>\n" + CODE_LINE.repeat(20);

        Optional<String> completed = PartialResponseRecovery.completeOverwrite(partial);

        assertTrue(completed.isPresent());
        assertTrue(completed.get().endsWith("\n</content>\n</write_to_file>"));
    }

    @Test
    void shouldRejectShortTruncatedOverwrite() {
        String partial = "<write_to_file>\n<content>\n" + CODE_LINE;

        assertTrue(PartialResponseRecovery.isTruncatedOverwrite(partial));
        assertFalse(PartialResponseRecovery.completeOverwrite(partial).isPresent());
    }

    @Test
    void shouldRejectProseWithoutCodeStructure() {
        String partial = "<write_to_file>\n<content>\n" + "lorem ipsum dolor sit amet\n".repeat(40);

        assertFalse(PartialResponseRecovery.completeOverwrite(partial).isPresent());
    }

    @Test
    void shouldIgnoreCompleteOverwrite() {
        String complete = "<write_to_file>\n<content>\nx\n</content>\n</write_to_file>";

        assertFalse(PartialResponseRecovery.isTruncatedOverwrite(complete));
    }
}
