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

import me.golemcore.editor.domain.model.EditComplexity;
import me.golemcore.editor.domain.model.VerificationResult;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Compares two document states and produces an advisory, confidence-scored
 * verdict. Verification never blocks progress; its warnings are surfaced to
 * the oracle in the next prompt.
 */
public class EditVerifier {

    private static final double UNEXPECTED_FACTOR = 0.7;
    private static final double SYNTAX_FACTOR = 0.6;
    private static final double WARNING_FACTOR = 0.9;

    private static final Set<String> BRACKET_LANGUAGES = Set.of(
            "java", "kotlin", "scala", "groovy", "js", "javascript", "jsx", "ts", "typescript", "tsx", "json",
            "python", "py", "c", "cpp", "h", "hpp", "cs", "csharp", "go", "rust", "rs", "swift", "php", "css",
            "scss");

    private static final Map<Character, Character> PAIRS = Map.of(')', '(', ']', '[', '}', '{');

    public VerificationResult verify(String before, String after, String changeDescription, String language) {
        return verify(before, after, changeDescription, language, EditComplexity.MODERATE);
    }

    public VerificationResult verify(String before, String after, String changeDescription, String language,
            EditComplexity complexity) {
        String previous = before != null ? before : "";
        String current = after != null ? after : "";
        List<String> warnings = new ArrayList<>();

        if (previous.equals(current)) {
            warnings.add("Edit produced no changes - SEARCH text may not have matched");
            return VerificationResult.builder()
                    .diffSummary("+0 lines, -0 lines")
                    .confidence(0.0)
                    .syntaxValid(true)
                    .unexpectedChanges(false)
                    .warnings(warnings)
                    .build();
        }

        String[] beforeLines = previous.split("\n", -1);
        String[] afterLines = current.split("\n", -1);
        Set<String> beforeSet = new HashSet<>(List.of(beforeLines));
        Set<String> afterSet = new HashSet<>(List.of(afterLines));

        int added = 0;
        for (String line : afterLines) {
            if (!line.isBlank() && !beforeSet.contains(line)) {
                added++;
            }
        }
        int removed = 0;
        for (String line : beforeLines) {
            if (!line.isBlank() && !afterSet.contains(line)) {
                removed++;
            }
        }

        EditComplexity resolved = complexity != null ? complexity : EditComplexity.MODERATE;
        double changeRatio = (double) (added + removed) / Math.max(1, beforeLines.length);
        boolean rewriteRequested = changeDescription != null
                && changeDescription.toLowerCase(Locale.ROOT).contains("rewrite");
        boolean unexpected = changeRatio > resolved.getChangeRatioAllowance() && !rewriteRequested
                && beforeLines.length > 1;
        if (unexpected) {
            warnings.add("Large change ratio: " + Math.round(changeRatio * 100) + "% of document modified");
        }

        boolean syntaxValid = true;
        if (language != null && BRACKET_LANGUAGES.contains(language.toLowerCase(Locale.ROOT))) {
            String problem = checkBrackets(current);
            if (problem != null) {
                syntaxValid = false;
                warnings.add("Possible syntax issue: " + problem);
            }
        }

        double confidence = 1.0;
        if (unexpected) {
            confidence *= UNEXPECTED_FACTOR;
        }
        if (!syntaxValid) {
            confidence *= SYNTAX_FACTOR;
        }
        if (!warnings.isEmpty()) {
            confidence *= WARNING_FACTOR;
        }

        return VerificationResult.builder()
                .diffSummary("+" + added + " lines, -" + removed + " lines")
                .linesAdded(added)
                .linesRemoved(removed)
                .confidence(confidence)
                .syntaxValid(syntaxValid)
                .unexpectedChanges(unexpected)
                .warnings(warnings)
                .build();
    }

    /**
     * Returns a description of the first bracket imbalance, or {@code null}
     * when brackets balance. String and character literals are skipped.
     */
    static String checkBrackets(String content) {
        Deque<Character> stack = new ArrayDeque<>();
        char quote = 0;
        boolean escaped = false;

        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (quote != 0) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == quote || (c == '\n' && quote != '`')) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'' || c == '`') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                stack.push(c);
            } else if (PAIRS.containsKey(c)) {
                if (stack.isEmpty() || !PAIRS.get(c).equals(stack.peek())) {
                    return "unexpected '" + c + "'";
                }
                stack.pop();
            }
        }
        if (!stack.isEmpty()) {
            return "unclosed '" + stack.peek() + "'";
        }
        return null;
    }
}
