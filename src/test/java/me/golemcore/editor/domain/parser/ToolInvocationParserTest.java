package me.golemcore.editor.domain.parser;

import me.golemcore.editor.domain.model.ParseResult;
import me.golemcore.editor.domain.model.ToolInvocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolInvocationParserTest {

    private ToolInvocationParser parser;

    @BeforeEach
    void setUp() {
        parser = new ToolInvocationParser();
    }

    // --- well-formed calls ---

    @Test
    void shouldParseOverwriteWithFullConfidence() {
        ParseResult result = parser.parse("""
                <write_to_file>
                <path>notes.md</path>
                <content>
                # Notes
                - first
                </content>
                </write_to_file>""");

        assertTrue(result.isSuccess());
        assertEquals(1.0, result.confidence());
        assertFalse(result.hasCorrections());
        ToolInvocation.Overwrite overwrite = assertInstanceOf(ToolInvocation.Overwrite.class, result.invocation());
        assertEquals("notes.md", overwrite.path());
        assertEquals("# Notes\n- first", overwrite.content());
    }

    @Test
    void shouldParsePatchBlocksInsideContent() {
        ParseResult result = parser.parse("""
                <replace_in_file>
                <content>
                <<<<<<< SEARCH
                const a = 1;
                ======= REPLACE
                const a = 2;
                >>>>>>> REPLACE
                </content>
                </replace_in_file>""");

        ToolInvocation.Patch patch = assertInstanceOf(ToolInvocation.Patch.class, result.invocation());
        assertNull(patch.path());
        assertEquals(1, patch.blocks().size());
        assertEquals("const a = 1;", patch.blocks().get(0).search());
        assertEquals("const a = 2;", patch.blocks().get(0).replace());
        assertEquals(1.0, result.confidence());
    }

    @Test
    void shouldParseSearchPattern() {
        ParseResult result = parser.parse("<search_files><pattern> TODO\\b </pattern></search_files>");

        ToolInvocation.Search search = assertInstanceOf(ToolInvocation.Search.class, result.invocation());
        assertEquals("TODO\\b", search.pattern());
    }

    @Test
    void shouldParseReadWithoutParameters() {
        ParseResult result = parser.parse("<read_file></read_file>");

        assertInstanceOf(ToolInvocation.Read.class, result.invocation());
        assertTrue(result.invocation().parameters().isEmpty());
    }

    @Test
    void shouldKeepParameterLikeTagsInsideContent() {
        ParseResult result = parser.parse("""
                <write_to_file>
                <content>
                Use <path>docs</path> for docs.
                </content>
                </write_to_file>""");

        ToolInvocation.Overwrite overwrite = assertInstanceOf(ToolInvocation.Overwrite.class, result.invocation());
        assertNull(overwrite.path());
        assertEquals("Use <path>docs</path> for docs.", overwrite.content());
    }

    @Test
    void shouldIgnoreToolNamesMentionedInsideThoughts() {
        ParseResult result = parser.parse("""
                <thought>I could use <write_to_file> but a patch is smaller.</thought>
                <search_files><pattern>greet</pattern></search_files>""");

        assertEquals(ToolInvocation.SEARCH, result.invocation().toolName());
    }

    // --- recovery ---

    @Test
    void shouldCorrectMisspelledToolName() {
        ParseResult result = parser.parse("<write_file><content>hello</content></write_file>");

        assertEquals(ToolInvocation.OVERWRITE, result.invocation().toolName());
        assertEquals(0.9, result.confidence(), 1e-9);
        assertTrue(result.corrections().get(0).contains("write_file"));
    }

    @Test
    void shouldNormalizeWhitespaceInsideTagBrackets() {
        ParseResult result = parser.parse("< write_to_file ><content>hello</content></ write_to_file >");

        assertEquals(ToolInvocation.OVERWRITE, result.invocation().toolName());
        assertEquals(0.9, result.confidence(), 1e-9);
    }

    @Test
    void shouldCloseUnterminatedToolTag() {
        ParseResult result = parser.parse("<write_to_file>\n<content>\nhello\n</content>\n");

        assertTrue(result.isSuccess());
        assertEquals(0.8, result.confidence(), 1e-9);
        assertTrue(result.corrections().contains("Added missing closing tag </write_to_file>"));
    }

    @Test
    void shouldRecoverBarePatchBlocks() {
        ParseResult result = parser.parse("""
                Here is the fix:
                <<<<<<< SEARCH
                old line
                ======= REPLACE
                new line
                >>>>>>> REPLACE""");

        ToolInvocation.Patch patch = assertInstanceOf(ToolInvocation.Patch.class, result.invocation());
        assertEquals(1, patch.blocks().size());
        assertEquals(0.42, result.confidence(), 1e-9);
        assertTrue(result.corrections().get(0).startsWith("Wrapped bare SEARCH/REPLACE blocks"));
    }

    @Test
    void shouldLowerConfidenceForNonCanonicalMarkers() {
        ParseResult result = parser.parse("""
                <replace_in_file>
                <content>
                <<< SEARCH
                old
                ===
                new
                >>> REPLACE
                </content>
                </replace_in_file>""");

        assertTrue(result.isSuccess());
        assertTrue(result.confidence() < 1.0);
        assertEquals(3, result.corrections().size());
    }

    // --- failures ---

    @Test
    void shouldFailOnEmptyResponse() {
        ParseResult result = parser.parse("   ");

        assertFalse(result.isSuccess());
        assertEquals("Empty response", result.failureReason());
        assertEquals(0.0, result.confidence());
    }

    @Test
    void shouldSuggestTagsForProse() {
        ParseResult result = parser.parse("I would use write_to_file to change the greeting.");

        assertFalse(result.isSuccess());
        assertEquals("No tool call found in response", result.failureReason());
        assertTrue(result.suggestions().stream().anyMatch(s -> s.startsWith("No XML tool tags found")));
        assertTrue(result.suggestions().stream().anyMatch(s -> s.contains("'write_to_file' was mentioned")));
    }

    @Test
    void shouldReportUnknownTool() {
        ParseResult result = parser.parse("<delete_file><path>a.txt</path></delete_file>");

        assertEquals("Unknown tool: delete_file", result.failureReason());
    }

    @Test
    void shouldFailOverwriteWithoutContent() {
        ParseResult result = parser.parse("<write_to_file><path>a.txt</path></write_to_file>");

        assertFalse(result.isSuccess());
        assertEquals("write_to_file requires a <content> parameter", result.failureReason());
    }

    @Test
    void shouldFailPatchWithoutMarkers() {
        ParseResult result = parser.parse("<replace_in_file><content>just text</content></replace_in_file>");

        assertFalse(result.isSuccess());
        assertTrue(result.failureReason().contains("SEARCH/REPLACE"));
    }

    @Test
    void shouldFailSearchWithoutPattern() {
        ParseResult result = parser.parse("<search_files></search_files>");

        assertEquals("search_files requires a <pattern> parameter", result.failureReason());
    }

    // --- prose ---

    @Test
    void shouldDropToolCallFromProse() {
        String prose = parser.prose("""
                <thought>Add the flag.</thought>
                <write_to_file>
                <content>
                let done = false;
                </content>
                </write_to_file>
                GOAL ACHIEVED""");

        assertTrue(prose.contains("Add the flag."));
        assertTrue(prose.contains("GOAL ACHIEVED"));
        assertFalse(prose.contains("done"));
    }

    @Test
    void shouldDropBarePatchBlocksFromProse() {
        String prose = parser.prose("""
                Fixing it:
                <<<<<<< SEARCH
                old()
                ======= REPLACE
                done()
                >>>>>>> REPLACE
                All set.""");

        assertEquals("Fixing it:\nAll set.", prose);
    }

    @Test
    void shouldKeepResponseWithoutToolCallAsProse() {
        assertEquals("Done.", parser.prose("Done."));
        assertEquals("", parser.prose(null));
    }

    @Test
    void shouldResolveAliasesCaseInsensitively() {
        assertEquals(ToolInvocation.PATCH, ToolInvocationParser.resolveToolName("Replace_File"));
        assertEquals(ToolInvocation.READ, ToolInvocationParser.resolveToolName("READ_FILE"));
        assertNull(ToolInvocationParser.resolveToolName("content"));
        assertNull(ToolInvocationParser.resolveToolName(null));
    }

    @Test
    void shouldStripOnlyOneOuterNewline() {
        assertEquals("\nbody\n", ToolInvocationParser.stripOuterNewlines("\n\nbody\n\n"));
        assertEquals("body", ToolInvocationParser.stripOuterNewlines("\r\nbody\r\n"));
    }
}
