package me.golemcore.editor.domain.service;

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

import me.golemcore.editor.domain.model.DocumentWindow;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Chooses how much of the document the oracle sees. Small documents are
 * shown whole; larger ones get a line-numbered window around the focus.
 */
public class DocumentWindowing {

    private static final int MIN_WINDOW_LINES = 50;
    private static final int PREVIEW_CHARS = 60;
    private static final int MAX_ADDED_PREVIEW = 3;
    private static final int MAX_PREVIEW = 5;

    private final int maxContextLines;
    private final int maxContextChars;
    private final int padding;

    public DocumentWindowing(int maxContextLines, int maxContextChars, int padding) {
        this.maxContextLines = maxContextLines;
        this.maxContextChars = maxContextChars;
        this.padding = padding;
    }

    /**
     * @param focus
     *            text to center the window on (case-insensitive, first match),
     *            or {@code null} to start at the top
     */
    public DocumentWindow window(String content, String focus) {
        String text = content != null ? content : "";
        String[] lines = text.split("\n", -1);
        int total = lines.length;

        if (total <= maxContextLines && text.length() <= maxContextChars) {
            return new DocumentWindow(text, 1, total, total, false, false);
        }

        int start = 0;
        int end = total - 1;
        if (focus != null && !focus.isBlank()) {
            String needle = focus.strip().toLowerCase(Locale.ROOT);
            for (int i = 0; i < total; i++) {
                if (lines[i].toLowerCase(Locale.ROOT).contains(needle)) {
                    start = Math.max(0, i - padding);
                    end = Math.min(total - 1, i + padding);
                    break;
                }
            }
        }

        int size = end - start + 1;
        if (size < MIN_WINDOW_LINES) {
            int expand = (MIN_WINDOW_LINES - size) / 2;
            start = Math.max(0, start - expand);
            end = Math.min(total - 1, end + expand);
        }
        if (end - start + 1 > maxContextLines) {
            end = start + maxContextLines - 1;
        }

        StringBuilder sb = new StringBuilder();
        for (int i = start; i <= end; i++) {
            if (i > start) {
                sb.append('\n');
            }
            sb.append(i + 1).append("| ").append(lines[i]);
        }
        return new DocumentWindow(sb.toString(), start + 1, end + 1, total, start > 0, end < total - 1);
    }

    /**
     * Compact line-set diff: counts plus a few sample lines.
     */
    public static String diffSummary(String before, String after) {
        List<String> beforeLines = List.of(before.split("\n", -1));
        List<String> afterLines = List.of(after.split("\n", -1));
        Set<String> beforeSet = new HashSet<>(beforeLines);
        Set<String> afterSet = new HashSet<>(afterLines);

        StringBuilder samples = new StringBuilder();
        int sampleCount = 0;
        int added = 0;
        for (String line : afterLines) {
            if (!line.isBlank() && !beforeSet.contains(line)) {
                added++;
                if (sampleCount < MAX_ADDED_PREVIEW) {
                    samples.append("\n+ ").append(preview(line));
                    sampleCount++;
                }
            }
        }
        int removed = 0;
        for (String line : beforeLines) {
            if (!line.isBlank() && !afterSet.contains(line)) {
                removed++;
                if (sampleCount < MAX_PREVIEW) {
                    samples.append("\n- ").append(preview(line));
                    sampleCount++;
                }
            }
        }
        return "+" + added + "/-" + removed + " lines" + samples;
    }

    private static String preview(String line) {
        return line.length() > PREVIEW_CHARS ? line.substring(0, PREVIEW_CHARS) + "..." : line;
    }
}
