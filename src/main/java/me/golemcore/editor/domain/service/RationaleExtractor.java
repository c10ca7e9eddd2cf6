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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the short rationale out of an oracle response: the {@code <thought>}
 * block when present, otherwise the first few lines of prose.
 */
public final class RationaleExtractor {

    private static final int MAX_LENGTH = 200;
    private static final int MAX_LINES = 3;
    private static final Pattern THOUGHT = Pattern.compile("<thought>([\\s\\S]*?)</thought>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_TAG = Pattern.compile("</?\\w+>");

    private RationaleExtractor() {
    }

    public static String extract(String response) {
        if (response == null || response.isBlank()) {
            return "";
        }
        Matcher matcher = THOUGHT.matcher(response);
        if (matcher.find()) {
            String inner = ANY_TAG.matcher(matcher.group(1)).replaceAll(" ");
            return truncate(inner.replaceAll("\\s+", " ").strip());
        }

        List<String> lines = new ArrayList<>();
        for (String line : response.split("\n")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("<")) {
                if (trimmed.startsWith("<") && !lines.isEmpty()) {
                    break;
                }
                continue;
            }
            lines.add(trimmed);
            if (lines.size() >= MAX_LINES) {
                break;
            }
        }
        return truncate(String.join(" ", lines));
    }

    private static String truncate(String text) {
        return text.length() > MAX_LENGTH ? text.substring(0, MAX_LENGTH) : text;
    }
}
