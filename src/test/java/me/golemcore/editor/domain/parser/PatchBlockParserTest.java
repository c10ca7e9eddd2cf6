package me.golemcore.editor.domain.parser;

import me.golemcore.editor.domain.model.PatchBlock;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatchBlockParserTest {

    private final PatchBlockParser parser = new PatchBlockParser();

    @Test
    void shouldParseMultipleCanonicalBlocksWithoutCorrections() {
        PatchBlockParser.Result result = parser.parse("""
                <<<<<<< SEARCH
                alpha
                ======= REPLACE
                ALPHA
                >>>>>>> REPLACE

                <<<<<<< SEARCH
                beta
                gamma
                ======= REPLACE
                BETA
                >>>>>>> REPLACE""");

        assertEquals(List.of(new PatchBlock("alpha", "ALPHA"), new PatchBlock("beta\ngamma", "BETA")),
                result.blocks());
        assertTrue(result.corrections().isEmpty());
    }

    @Test
    void shouldAllowEmptyReplacement() {
        PatchBlockParser.Result result = parser.parse("<<<<<<< SEARCH\nremove me\n======= REPLACE\n>>>>>>> REPLACE");

        assertEquals(1, result.blocks().size());
        assertEquals("", result.blocks().get(0).replace());
    }

    @Test
    void shouldReportTrimmedAndNormalizedMarkers() {
        PatchBlockParser.Result result = parser.parse("  <<<<<<< SEARCH  \nold\n=====\nnew\n>>>> replace");

        assertEquals(1, result.blocks().size());
        assertEquals(List.of(
                "Trimmed whitespace around search marker",
                "Normalized separator marker '====='",
                "Normalized end marker '>>>> replace'"), result.corrections());
    }

    @Test
    void shouldCloseBlockAtEndOfInput() {
        PatchBlockParser.Result result = parser.parse("<<<<<<< SEARCH\nold\n======= REPLACE\nnew");

        assertEquals(List.of(new PatchBlock("old", "new")), result.blocks());
        assertTrue(result.corrections().contains("Closed unterminated patch block at end of input"));
    }

    @Test
    void shouldDropBlockWithoutSeparator() {
        PatchBlockParser.Result result = parser.parse("<<<<<<< SEARCH\nold\n>>>>>>> REPLACE");

        assertTrue(result.isEmpty());
        assertTrue(result.corrections().contains("Dropped patch block without a separator marker"));
    }

    @Test
    void shouldSkipBlockWithEmptySearchText() {
        PatchBlockParser.Result result = parser.parse("<<<<<<< SEARCH\n\n======= REPLACE\nnew\n>>>>>>> REPLACE");

        assertTrue(result.isEmpty());
        assertEquals(List.of("Skipped patch block with empty search text"), result.corrections());
    }

    @Test
    void shouldNotTreatShortRunsAsMarkers() {
        PatchBlockParser.Result result = parser.parse("""
                <<<<<<< SEARCH
                if (a << 2 == b) {
                ======= REPLACE
                if (a << 3 == b) {
                >>>>>>> REPLACE""");

        assertEquals("if (a << 2 == b) {", result.blocks().get(0).search());
    }

    @Test
    void shouldHandleCarriageReturns() {
        PatchBlockParser.Result result = parser.parse("<<<<<<< SEARCH\r\nold\r\n======= REPLACE\r\nnew\r\n>>>>>>> REPLACE");

        assertEquals(List.of(new PatchBlock("old", "new")), result.blocks());
        assertTrue(result.corrections().isEmpty());
    }

    @Test
    void shouldDetectMarkersCaseInsensitively() {
        assertTrue(parser.containsMarkers("<<< search\nx\n=== replace\ny\n>>>"));
        assertFalse(parser.containsMarkers("plain text"));
        assertFalse(parser.containsMarkers(null));
    }
}
