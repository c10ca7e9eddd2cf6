package me.golemcore.editor.domain.model;

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

import java.util.List;

/**
 * Outcome of parsing one oracle response. Either an invocation with its
 * confidence and the corrections that were needed, or a failure reason with
 * suggestions for the corrective prompt.
 */
public record ParseResult(
        ToolInvocation invocation,
        double confidence,
        List<String> corrections,
        String failureReason,
        List<String> suggestions) {

    public ParseResult {
        corrections = corrections != null ? List.copyOf(corrections) : List.of();
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }

    public static ParseResult success(ToolInvocation invocation, double confidence, List<String> corrections) {
        return new ParseResult(invocation, confidence, corrections, null, List.of());
    }

    public static ParseResult failure(String reason, List<String> suggestions) {
        return new ParseResult(null, 0.0, List.of(), reason, suggestions);
    }

    public boolean isSuccess() {
        return invocation != null;
    }

    public boolean hasCorrections() {
        return !corrections.isEmpty();
    }
}
