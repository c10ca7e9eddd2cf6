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

import me.golemcore.editor.domain.model.PatchBlock;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Line-oriented state machine for the patch block format:
 *
 * <pre>
 * &lt;&lt;&lt;&lt;&lt;&lt;&lt; SEARCH
 * text to find
 * ======= REPLACE
 * replacement text
 * &gt;&gt;&gt;&gt;&gt;&gt;&gt; REPLACE
 * </pre>
 *
 * <p>
 * Each marker may use any run of three or more marker characters and any
 * surrounding whitespace. The keyword after the separator and the closing
 * marker is optional. Every deviation from the canonical marker is reported
 * as a correction so callers can lower their confidence.
 */
public class PatchBlockParser {

    public static final String SEARCH_MARKER = "<<<<<<< SEARCH";
    public static final String SEPARATOR_MARKER = "======= REPLACE";
    public static final String END_MARKER = ">>>>>>> REPLACE";

    private static final int MIN_MARKER_RUN = 3;

    private enum State {
        OUTSIDE, IN_SEARCH, IN_REPLACE
    }

    private enum MarkerKind {
        SEARCH_START, SEPARATOR, REPLACE_END
    }

    public record Result(List<PatchBlock> blocks, List<String> corrections) {

        public boolean isEmpty() {
            return blocks.isEmpty();
        }
    }

    public Result parse(String content) {
        List<PatchBlock> blocks = new ArrayList<>();
        List<String> corrections = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return new Result(blocks, corrections);
        }

        State state = State.OUTSIDE;
        StringBuilder search = new StringBuilder();
        StringBuilder replace = new StringBuilder();

        for (String rawLine : content.split("\n", -1)) {
            String line = rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
            MarkerKind marker = classify(line, state);

            switch (state) {
            case OUTSIDE -> {
                if (marker == MarkerKind.SEARCH_START) {
                    noteDeviation(line, SEARCH_MARKER, "search", corrections);
                    search.setLength(0);
                    replace.setLength(0);
                    state = State.IN_SEARCH;
                }
            }
            case IN_SEARCH -> {
                if (marker == MarkerKind.SEPARATOR) {
                    noteDeviation(line, SEPARATOR_MARKER, "separator", corrections);
                    state = State.IN_REPLACE;
                } else {
                    appendLine(search, line);
                }
            }
            case IN_REPLACE -> {
                if (marker == MarkerKind.REPLACE_END) {
                    noteDeviation(line, END_MARKER, "end", corrections);
                    addBlock(blocks, search, replace, corrections);
                    state = State.OUTSIDE;
                } else {
                    appendLine(replace, line);
                }
            }
            default -> throw new IllegalStateException("Unexpected state: " + state);
            }
        }

        if (state == State.IN_REPLACE) {
            addCorrection(corrections, "Closed unterminated patch block at end of input");
            addBlock(blocks, search, replace, corrections);
        } else if (state == State.IN_SEARCH) {
            addCorrection(corrections, "Dropped patch block without a separator marker");
        }
        return new Result(blocks, corrections);
    }

    /**
     * Quick check used by the invocation parser before running the full
     * state machine.
     */
    public boolean containsMarkers(String content) {
        return content != null
                && content.toUpperCase(Locale.ROOT).contains("SEARCH")
                && content.toUpperCase(Locale.ROOT).contains("REPLACE");
    }

    private MarkerKind classify(String line, State state) {
        String trimmed = line.strip();
        return switch (state) {
        case OUTSIDE -> isMarker(trimmed, '<', "SEARCH", true) ? MarkerKind.SEARCH_START : null;
        case IN_SEARCH -> isMarker(trimmed, '=', "REPLACE", false) ? MarkerKind.SEPARATOR : null;
        case IN_REPLACE -> isMarker(trimmed, '>', "REPLACE", false) ? MarkerKind.REPLACE_END : null;
        };
    }

    private boolean isMarker(String trimmed, char markerChar, String keyword, boolean keywordRequired) {
        int run = 0;
        while (run < trimmed.length() && trimmed.charAt(run) == markerChar) {
            run++;
        }
        if (run < MIN_MARKER_RUN) {
            return false;
        }
        String rest = trimmed.substring(run).strip();
        if (rest.isEmpty()) {
            return !keywordRequired;
        }
        return rest.equalsIgnoreCase(keyword);
    }

    private void noteDeviation(String line, String canonical, String label, List<String> corrections) {
        if (line.equals(canonical)) {
            return;
        }
        String trimmed = line.strip();
        if (trimmed.equals(canonical)) {
            addCorrection(corrections, "Trimmed whitespace around " + label + " marker");
        } else {
            addCorrection(corrections, "Normalized " + label + " marker '" + trimmed + "'");
        }
    }

    private void addBlock(List<PatchBlock> blocks, StringBuilder search, StringBuilder replace,
            List<String> corrections) {
        String searchText = search.toString().strip();
        if (searchText.isEmpty()) {
            addCorrection(corrections, "Skipped patch block with empty search text");
            return;
        }
        blocks.add(new PatchBlock(searchText, replace.toString().strip()));
    }

    private static void appendLine(StringBuilder target, String line) {
        if (!target.isEmpty()) {
            target.append('\n');
        }
        target.append(line);
    }

    private static void addCorrection(List<String> corrections, String correction) {
        if (!corrections.contains(correction)) {
            corrections.add(correction);
        }
    }
}
