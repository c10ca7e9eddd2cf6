package me.golemcore.editor.domain.parser;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.editor.domain.model.ParseResult;
import me.golemcore.editor.domain.model.PatchBlock;
import me.golemcore.editor.domain.model.ToolInvocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw oracle output into a typed {@link ToolInvocation}.
 *
 * <p>
 * Parsing is tolerant of the drift commonly produced by generative models:
 * whitespace inside tag brackets, misspelled tool names, a missing closing
 * tag, and patch blocks written without a tool wrapper. Every recovery is
 * listed in the result's corrections and lowers its confidence. Nothing in
 * here throws on malformed input; failures come back as
 * {@link ParseResult#failure(String, List)}.
 */
@Slf4j
public class ToolInvocationParser {

    private static final double WHITESPACE_FACTOR = 0.9;
    private static final double ALIAS_FACTOR = 0.9;
    private static final double MISSING_CLOSE_FACTOR = 0.8;
    private static final double MARKER_FACTOR = 0.95;
    private static final double BARE_PATCH_BASE = 0.6;
    private static final double BARE_PATCH_FACTOR = 0.7;

    private static final Map<String, String> TOOL_ALIASES = Map.ofEntries(
            Map.entry("replace_file", ToolInvocation.PATCH),
            Map.entry("replaceinfile", ToolInvocation.PATCH),
            Map.entry("file_replace", ToolInvocation.PATCH),
            Map.entry("readfile", ToolInvocation.READ),
            Map.entry("writefile", ToolInvocation.OVERWRITE),
            Map.entry("write_file", ToolInvocation.OVERWRITE),
            Map.entry("searchfiles", ToolInvocation.SEARCH),
            Map.entry("search_file", ToolInvocation.SEARCH),
            Map.entry("find_files", ToolInvocation.SEARCH));

    private static final Set<String> RATIONALE_TAGS = Set.of("thought", "thinking", "structured_thinking");
    private static final Set<String> PARAMETER_TAGS = Set.of("path", "content", "pattern");
    private static final List<String> SCALAR_PARAMETERS = List.of("path", "pattern");

    private final PatchBlockParser patchBlockParser;

    public ToolInvocationParser() {
        this(new PatchBlockParser());
    }

    public ToolInvocationParser(PatchBlockParser patchBlockParser) {
        this.patchBlockParser = patchBlockParser;
    }

    public ParseResult parse(String response) {
        if (response == null || response.isBlank()) {
            return ParseResult.failure("Empty response", List.of(
                    "Respond with exactly one tool call, e.g. <write_to_file><content>...</content></write_to_file>"));
        }
        try {
            return doParse(response);
        } catch (RuntimeException e) { // NOSONAR - parser must report, not throw
            log.warn("[Parser] Unexpected parser error: {}", e.getMessage(), e);
            return ParseResult.failure("Parser error: " + e.getMessage(), List.of());
        }
    }

    /**
     * Resolves a tag name to a canonical tool name, following known typos.
     * Returns {@code null} for anything outside the tool vocabulary.
     */
    public static String resolveToolName(String name) {
        if (name == null) {
            return null;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (ToolInvocation.TOOL_NAMES.contains(lower)) {
            return lower;
        }
        return TOOL_ALIASES.get(lower);
    }

    /**
     * Returns the response without its tool call, or unchanged when it has
     * none. Completion claims are scored on this text.
     */
    public String prose(String response) {
        if (response == null || response.isBlank()) {
            return "";
        }
        List<TagScanner.Tag> tags = TagScanner.scan(response);
        TagScanner.Tag toolOpen = firstToolOpen(tags, rationaleRanges(tags));
        if (toolOpen != null) {
            TagScanner.Tag close = findClose(tags, toolOpen, resolveToolName(toolOpen.name()));
            int end = close != null ? close.end() : nextToolOpen(tags, toolOpen, response.length());
            return response.substring(0, toolOpen.start()) + response.substring(end);
        }
        if (patchBlockParser.containsMarkers(response)) {
            String[] lines = response.split("\n", -1);
            int first = -1;
            int last = -1;
            for (int i = 0; i < lines.length; i++) {
                String trimmed = lines[i].strip();
                if (first < 0 && trimmed.startsWith("<<<")) {
                    first = i;
                }
                if (first >= 0 && trimmed.startsWith(">>>")) {
                    last = i;
                }
            }
            if (first >= 0) {
                int end = last >= 0 ? last + 1 : lines.length;
                return String.join("\n", Arrays.asList(lines).subList(0, first)) + "\n"
                        + String.join("\n", Arrays.asList(lines).subList(end, lines.length));
            }
        }
        return response;
    }

    // ==================== Passes ====================

    private ParseResult doParse(String response) {
        List<TagScanner.Tag> tags = TagScanner.scan(response);
        List<int[]> rationaleRanges = rationaleRanges(tags);

        TagScanner.Tag toolOpen = firstToolOpen(tags, rationaleRanges);
        if (toolOpen != null) {
            return parseTaggedInvocation(response, tags, toolOpen);
        }

        if (patchBlockParser.containsMarkers(response)) {
            PatchBlockParser.Result bare = patchBlockParser.parse(response);
            if (!bare.isEmpty()) {
                return bareInvocation(response, bare);
            }
        }

        return unparseable(response, tags, rationaleRanges);
    }

    private ParseResult parseTaggedInvocation(String response, List<TagScanner.Tag> tags, TagScanner.Tag open) {
        List<String> corrections = new ArrayList<>();
        double confidence = 1.0;

        String toolName = resolveToolName(open.name());
        if (!toolName.equals(open.name())) {
            corrections.add("Corrected tool name '" + open.name() + "' to '" + toolName + "'");
            confidence *= ALIAS_FACTOR;
        }

        TagScanner.Tag close = findClose(tags, open, toolName);
        boolean whitespace = open.normalized() || (close != null && close.normalized());
        if (whitespace) {
            corrections.add("Normalized whitespace in <" + toolName + "> tag");
            confidence *= WHITESPACE_FACTOR;
        }

        String body;
        if (close != null) {
            body = response.substring(open.end(), close.start());
        } else {
            int bodyEnd = nextToolOpen(tags, open, response.length());
            body = response.substring(open.end(), bodyEnd);
            corrections.add("Added missing closing tag </" + toolName + ">");
            confidence *= MISSING_CLOSE_FACTOR;
        }

        Map<String, String> params = extractParameters(body, corrections);
        return buildInvocation(toolName, params, confidence, corrections);
    }

    private ParseResult bareInvocation(String response, PatchBlockParser.Result bare) {
        List<String> corrections = new ArrayList<>();
        corrections.add("Wrapped bare SEARCH/REPLACE blocks in <" + ToolInvocation.PATCH + ">");
        double confidence = BARE_PATCH_BASE * BARE_PATCH_FACTOR;
        for (String correction : bare.corrections()) {
            corrections.add(correction);
            confidence *= MARKER_FACTOR;
        }
        ToolInvocation invocation = new ToolInvocation.Patch(null, response.strip(), bare.blocks());
        log.debug("[Parser] Recovered bare patch with {} block(s)", bare.blocks().size());
        return ParseResult.success(invocation, confidence, corrections);
    }

    private ParseResult unparseable(String response, List<TagScanner.Tag> tags, List<int[]> rationaleRanges) {
        for (TagScanner.Tag tag : tags) {
            if (tag.closing() || insideAny(tag.start(), rationaleRanges)) {
                continue;
            }
            String lower = tag.name().toLowerCase(Locale.ROOT);
            if (RATIONALE_TAGS.contains(lower) || PARAMETER_TAGS.contains(lower)) {
                continue;
            }
            if (findClose(tags, tag, tag.name()) != null) {
                return ParseResult.failure("Unknown tool: " + tag.name(),
                        List.of("Did you mean one of: " + String.join(", ", ToolInvocation.TOOL_NAMES) + "?"));
            }
        }

        List<String> suggestions = new ArrayList<>();
        if (!response.contains("<")) {
            suggestions.add("No XML tool tags found - wrap the call in tags such as <write_to_file>...</write_to_file>");
        }
        if (response.contains("```")) {
            suggestions.add("Use XML tool tags instead of markdown code fences");
        }
        String lower = response.toLowerCase(Locale.ROOT);
        for (String name : ToolInvocation.TOOL_NAMES) {
            if (lower.contains(name)) {
                suggestions.add("'" + name + "' was mentioned in prose - emit it as <" + name + ">...</" + name + ">");
                break;
            }
        }
        return ParseResult.failure("No tool call found in response", suggestions);
    }

    // ==================== Parameters ====================

    private Map<String, String> extractParameters(String body, List<String> corrections) {
        Map<String, String> params = new LinkedHashMap<>();
        List<TagScanner.Tag> tags = TagScanner.scan(body);

        // content first: path and pattern tags that appear inside it belong to the document text
        int[] contentRange = null;
        TagScanner.Tag contentOpen = firstOpen(tags, "content", null);
        if (contentOpen != null) {
            TagScanner.Tag contentClose = lastClose(tags, "content", contentOpen);
            int end = contentClose != null ? contentClose.start() : body.length();
            if (contentClose == null) {
                corrections.add("Added missing closing tag </content>");
            }
            params.put("content", stripOuterNewlines(body.substring(contentOpen.end(), end)));
            contentRange = new int[] { contentOpen.start(), contentClose != null ? contentClose.end() : body.length() };
        }

        for (String name : SCALAR_PARAMETERS) {
            TagScanner.Tag open = firstOpen(tags, name, contentRange);
            if (open == null) {
                continue;
            }
            TagScanner.Tag close = firstClose(tags, name, open);
            String raw = close != null ? body.substring(open.end(), close.start()) : body.substring(open.end());
            params.put(name, raw.strip());
        }

        if (params.isEmpty() && !body.isBlank()) {
            params.put("content", stripOuterNewlines(body));
        }
        return params;
    }

    private ParseResult buildInvocation(String toolName, Map<String, String> params, double confidence,
            List<String> corrections) {
        String path = params.get("path");
        String content = params.get("content");

        switch (toolName) {
        case ToolInvocation.READ -> {
            return ParseResult.success(new ToolInvocation.Read(path), confidence, corrections);
        }
        case ToolInvocation.OVERWRITE -> {
            if (content == null) {
                return ParseResult.failure(toolName + " requires a <content> parameter",
                        List.of("Include the complete new document inside <content>...</content>"));
            }
            return ParseResult.success(new ToolInvocation.Overwrite(path, content), confidence, corrections);
        }
        case ToolInvocation.PATCH -> {
            if (content == null || !patchBlockParser.containsMarkers(content)) {
                return ParseResult.failure(toolName + " content must contain SEARCH/REPLACE blocks",
                        List.of("Use " + PatchBlockParser.SEARCH_MARKER + " / " + PatchBlockParser.SEPARATOR_MARKER
                                + " / " + PatchBlockParser.END_MARKER + " inside <content>"));
            }
            PatchBlockParser.Result patch = patchBlockParser.parse(content);
            List<String> all = new ArrayList<>(corrections);
            double adjusted = confidence;
            for (String correction : patch.corrections()) {
                all.add(correction);
                adjusted *= MARKER_FACTOR;
            }
            List<PatchBlock> blocks = patch.blocks();
            return ParseResult.success(new ToolInvocation.Patch(path, content, blocks), adjusted, all);
        }
        case ToolInvocation.SEARCH -> {
            String pattern = params.get("pattern");
            if (pattern == null || pattern.isBlank()) {
                return ParseResult.failure(toolName + " requires a <pattern> parameter",
                        List.of("Provide a regular expression inside <pattern>...</pattern>"));
            }
            return ParseResult.success(new ToolInvocation.Search(path, pattern), confidence, corrections);
        }
        default -> {
            return ParseResult.failure("Unknown tool: " + toolName, List.of());
        }
        }
    }

    // ==================== Tag helpers ====================

    private static List<int[]> rationaleRanges(List<TagScanner.Tag> tags) {
        List<int[]> ranges = new ArrayList<>();
        for (TagScanner.Tag tag : tags) {
            if (tag.closing() || !RATIONALE_TAGS.contains(tag.name().toLowerCase(Locale.ROOT))) {
                continue;
            }
            if (insideAny(tag.start(), ranges)) {
                continue;
            }
            TagScanner.Tag close = firstClose(tags, tag.name(), tag);
            if (close != null) {
                ranges.add(new int[] { tag.start(), close.end() });
            }
        }
        return ranges;
    }

    private static boolean insideAny(int position, List<int[]> ranges) {
        for (int[] range : ranges) {
            if (position >= range[0] && position < range[1]) {
                return true;
            }
        }
        return false;
    }

    private static TagScanner.Tag firstToolOpen(List<TagScanner.Tag> tags, List<int[]> rationaleRanges) {
        for (TagScanner.Tag tag : tags) {
            if (!tag.closing() && !insideAny(tag.start(), rationaleRanges) && resolveToolName(tag.name()) != null) {
                return tag;
            }
        }
        return null;
    }

    private static TagScanner.Tag findClose(List<TagScanner.Tag> tags, TagScanner.Tag open, String canonical) {
        for (TagScanner.Tag tag : tags) {
            if (!tag.closing() || tag.start() < open.end()) {
                continue;
            }
            if (tag.name().equalsIgnoreCase(open.name()) || canonical.equals(resolveToolName(tag.name()))) {
                return tag;
            }
        }
        return null;
    }

    private static int nextToolOpen(List<TagScanner.Tag> tags, TagScanner.Tag open, int fallback) {
        for (TagScanner.Tag tag : tags) {
            if (!tag.closing() && tag.start() >= open.end() && resolveToolName(tag.name()) != null) {
                return tag.start();
            }
        }
        return fallback;
    }

    private static TagScanner.Tag firstOpen(List<TagScanner.Tag> tags, String name, int[] excluded) {
        for (TagScanner.Tag tag : tags) {
            if (excluded != null && tag.start() >= excluded[0] && tag.start() < excluded[1]) {
                continue;
            }
            if (!tag.closing() && tag.name().equalsIgnoreCase(name)) {
                return tag;
            }
        }
        return null;
    }

    private static TagScanner.Tag firstClose(List<TagScanner.Tag> tags, String name, TagScanner.Tag open) {
        for (TagScanner.Tag tag : tags) {
            if (tag.closing() && tag.start() >= open.end() && tag.name().equalsIgnoreCase(name)) {
                return tag;
            }
        }
        return null;
    }

    private static TagScanner.Tag lastClose(List<TagScanner.Tag> tags, String name, TagScanner.Tag open) {
        TagScanner.Tag found = null;
        for (TagScanner.Tag tag : tags) {
            if (tag.closing() && tag.start() >= open.end() && tag.name().equalsIgnoreCase(name)) {
                found = tag;
            }
        }
        return found;
    }

    static String stripOuterNewlines(String value) {
        String result = value;
        if (result.startsWith("\r\n")) {
            result = result.substring(2);
        } else if (result.startsWith("\n")) {
            result = result.substring(1);
        }
        if (result.endsWith("\r\n")) {
            result = result.substring(0, result.length() - 2);
        } else if (result.endsWith("\n")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
