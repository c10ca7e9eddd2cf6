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

import me.golemcore.editor.domain.model.CompletionSignals;
import me.golemcore.editor.domain.model.CompletionVerdict;

import java.util.regex.Pattern;

/**
 * Weighted multi-signal completion decision.
 *
 * <p>
 * Four weak signals are combined: an explicit claim phrase (tiered), the
 * absence of a further tool call, verified changes so far, and content that
 * did not change since the previous iteration. The rules are evaluated in a
 * fixed order; the first match wins. The detector is stateless, so identical
 * inputs always give identical verdicts.
 */
public class CompletionDetector {

    public static final double CLAIM_WEIGHT = 0.35;
    public static final double NO_TOOL_WEIGHT = 0.20;
    public static final double CHANGES_WEIGHT = 0.30;
    public static final double STABLE_WEIGHT = 0.15;

    public static final double REJECTED_CONFIDENCE_CAP = 0.3;

    private static final Pattern HIGH_PHRASES = phrases(
            "goal achieved", "goal_achieved", "task complete", "all changes complete", "edit complete",
            "successfully completed");
    private static final Pattern MEDIUM_PHRASES = phrases(
            "done with edits", "finished editing", "no more changes needed", "changes applied",
            "successfully modified", "done");
    private static final Pattern LOW_PHRASES = phrases(
            "looks good", "should work", "that should do it", "there you go");

    private final boolean earlyTermination;

    public CompletionDetector() {
        this(true);
    }

    public CompletionDetector(boolean earlyTermination) {
        this.earlyTermination = earlyTermination;
    }

    public CompletionVerdict evaluate(String oracleText, boolean hadToolCall, int changesSoFar, int iteration,
            String previousContent, String currentContent) {
        double claimScore = claimScore(oracleText);
        boolean noFurtherToolCall = !hadToolCall && iteration > 0;
        boolean verifiedChanges = changesSoFar > 0;
        boolean stabilized = iteration > 0 && previousContent != null && previousContent.equals(currentContent);
        CompletionSignals signals = new CompletionSignals(claimScore, noFurtherToolCall, verifiedChanges, stabilized);

        double confidence = claimScore * CLAIM_WEIGHT
                + (noFurtherToolCall ? NO_TOOL_WEIGHT : 0)
                + (verifiedChanges ? CHANGES_WEIGHT : 0)
                + (stabilized ? STABLE_WEIGHT : 0);

        if (signals.explicitClaim() && verifiedChanges) {
            return new CompletionVerdict(true, false, confidence,
                    "Goal explicitly claimed complete with verified changes", signals);
        }
        if (earlyTermination && verifiedChanges && noFurtherToolCall) {
            return new CompletionVerdict(true, false, confidence, "Changes made and oracle stopped invoking tools",
                    signals);
        }
        if (stabilized && verifiedChanges) {
            return new CompletionVerdict(true, false, confidence, "Content stabilized after changes", signals);
        }
        if (claimScore >= 0.7 && iteration > 0) {
            return new CompletionVerdict(true, false, confidence, "Goal explicitly claimed complete (iteration > 0)",
                    signals);
        }
        if (signals.explicitClaim() && !verifiedChanges && iteration == 0) {
            return new CompletionVerdict(false, true, Math.min(confidence, REJECTED_CONFIDENCE_CAP),
                    "Claim rejected: no changes made on first iteration", signals);
        }
        return new CompletionVerdict(false, false, confidence, "Not complete", signals);
    }

    /**
     * Highest tier score among the phrases found in the text, 0 if none.
     */
    public static double claimScore(String text) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        if (HIGH_PHRASES.matcher(text).find()) {
            return 0.9;
        }
        if (MEDIUM_PHRASES.matcher(text).find()) {
            return 0.7;
        }
        if (LOW_PHRASES.matcher(text).find()) {
            return 0.5;
        }
        return 0.0;
    }

    private static Pattern phrases(String... phrases) {
        StringBuilder regex = new StringBuilder("\\b(?:");
        for (int i = 0; i < phrases.length; i++) {
            if (i > 0) {
                regex.append('|');
            }
            regex.append(Pattern.quote(phrases[i]));
        }
        regex.append(")\\b");
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE);
    }
}
