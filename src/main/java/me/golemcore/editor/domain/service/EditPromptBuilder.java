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

import lombok.Builder;
import lombok.Value;
import me.golemcore.editor.domain.model.DocumentState;
import me.golemcore.editor.domain.model.DocumentWindow;
import me.golemcore.editor.domain.model.EditComplexity;
import me.golemcore.editor.domain.model.EditGoal;
import me.golemcore.editor.domain.model.SubGoal;
import me.golemcore.editor.domain.model.ToolInvocation;
import me.golemcore.editor.domain.model.ToolResult;
import me.golemcore.editor.domain.model.VerificationResult;
import me.golemcore.editor.domain.parser.PatchBlockParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the oracle prompts: a system prompt tiered by goal complexity and a
 * per-iteration prompt with progress, the last tool outcome, verifier
 * warnings and the current document window.
 */
public class EditPromptBuilder {

    private static final int PROGRESS_SLOTS = 5;
    private static final int MAX_OUTLINE_ENTRIES = 8;

    private static final Pattern JS_FUNCTION = Pattern.compile("^(?:export\\s+)?(?:async\\s+)?function\\s+(\\w+)");
    private static final Pattern JS_CLASS = Pattern.compile("^(?:export\\s+)?class\\s+(\\w+)");
    private static final Pattern JS_ARROW = Pattern.compile("^(?:export\\s+)?(?:const|let)\\s+(\\w+)\\s*=.*(?:=>|function)");
    private static final Pattern PY_DEF = Pattern.compile("^def\\s+(\\w+)");
    private static final Pattern PY_CLASS = Pattern.compile("^class\\s+(\\w+)");
    private static final Pattern JAVA_TYPE = Pattern.compile(
            "^(?:public\\s+|protected\\s+|private\\s+)?(?:abstract\\s+|final\\s+)?(?:class|interface|enum|record)\\s+(\\w+)");

    private final DocumentWindowing windowing;

    public EditPromptBuilder(DocumentWindowing windowing) {
        this.windowing = windowing;
    }

    /**
     * Inputs of the per-iteration prompt.
     */
    @Value
    @Builder
    public static class IterationContext {
        int iteration;
        int maxIterations;
        int changesApplied;
        EditGoal goal;
        List<SubGoal> subGoals;
        DocumentState original;
        DocumentState current;
        String lastToolName;
        ToolResult lastResult;
        VerificationResult lastVerification;
        String focus;
    }

    // ==================== System prompt ====================

    public String systemPrompt(EditGoal goal, DocumentState document) {
        EditComplexity complexity = goal.getComplexity() != null ? goal.getComplexity() : EditComplexity.SIMPLE;
        StringBuilder sb = new StringBuilder();
        sb.append("You are a document editor. Your task is to MODIFY the document using tools.\n")
                .append("You MUST use a tool to make changes. Saying \"GOAL ACHIEVED\" only counts after a tool ")
                .append("call has been executed.\n\n")
                .append("GOAL: ").append(goal.getDescription()).append('\n')
                .append("APPROACH: ").append(goal.getApproach()).append('\n')
                .append("FILE: ").append(document.displayName()).append(" (")
                .append(document.language() != null ? document.language() : "text").append(", ")
                .append(document.lineCount()).append(" lines)\n");

        if (complexity == EditComplexity.MODERATE || complexity == EditComplexity.COMPLEX) {
            String outline = outline(document);
            if (!outline.isEmpty()) {
                sb.append("OUTLINE: ").append(outline).append('\n');
            }
        }

        sb.append("\nRespond with a short <thought>...</thought> and exactly ONE tool call.\n\n");
        sb.append(writeToolHelp(document));
        if (complexity != EditComplexity.TRIVIAL) {
            sb.append('\n').append(patchToolHelp(document));
            sb.append('\n').append(inspectionToolHelp());
        }
        if (complexity == EditComplexity.MODERATE || complexity == EditComplexity.COMPLEX) {
            sb.append('\n').append(planningHelp());
        }
        sb.append("\nWhen the document satisfies the goal and your last change succeeded, reply with ")
                .append("\"GOAL ACHIEVED\" and no tool call.");
        return sb.toString();
    }

    private static String writeToolHelp(DocumentState document) {
        return "Full rewrite (most reliable):\n"
                + "<" + ToolInvocation.OVERWRITE + ">\n"
                + "<path>" + document.displayName() + "</path>\n"
                + "<content>\n[COMPLETE NEW DOCUMENT CONTENT]\n</content>\n"
                + "</" + ToolInvocation.OVERWRITE + ">\n";
    }

    private static String patchToolHelp(DocumentState document) {
        return "Surgical change (SEARCH text must match the document exactly, first occurrence is replaced):\n"
                + "<" + ToolInvocation.PATCH + ">\n"
                + "<path>" + document.displayName() + "</path>\n"
                + "<content>\n"
                + PatchBlockParser.SEARCH_MARKER + "\n[exact text from the document]\n"
                + PatchBlockParser.SEPARATOR_MARKER + "\n[replacement text]\n"
                + PatchBlockParser.END_MARKER + "\n"
                + "</content>\n"
                + "</" + ToolInvocation.PATCH + ">\n"
                + "If a patch fails, switch to " + ToolInvocation.OVERWRITE + ".\n";
    }

    private static String inspectionToolHelp() {
        return "Inspection: <" + ToolInvocation.READ + "></" + ToolInvocation.READ + "> returns the document, "
                + "<" + ToolInvocation.SEARCH + "><pattern>regex</pattern></" + ToolInvocation.SEARCH
                + "> lists matching lines.\n";
    }

    private static String planningHelp() {
        return "Work through the sub-goals in order. Before each change consider which parts of the document "
                + "change, what could break (brackets, imports, indentation) and which tool is safest.\n";
    }

    // ==================== Iteration prompt ====================

    public String iterationPrompt(IterationContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("ITERATION ").append(context.getIteration() + 1).append('/').append(context.getMaxIterations())
                .append('\n')
                .append("Progress: [").append(progressBar(context.getChangesApplied())).append("] ")
                .append(context.getChangesApplied()).append(" changes\n")
                .append("GOAL: ").append(context.getGoal().getDescription()).append('\n');

        List<SubGoal> subGoals = context.getSubGoals();
        if (subGoals != null && subGoals.size() > 1) {
            sb.append("SUB-GOALS:\n");
            for (SubGoal subGoal : subGoals) {
                sb.append("  ").append(statusMark(subGoal.getStatus())).append(' ')
                        .append(subGoal.getIndex() + 1).append(". ").append(subGoal.getDescription()).append('\n');
            }
        }

        ToolResult last = context.getLastResult();
        if (last != null) {
            sb.append("\nLast: ").append(context.getLastToolName()).append(" -> ")
                    .append(last.isSuccess() ? "OK " : "FAILED ").append(last.getMessage()).append('\n');
        }

        VerificationResult verification = context.getLastVerification();
        if (verification != null && verification.hasWarnings()) {
            sb.append("VERIFIER WARNINGS:\n");
            for (String warning : verification.getWarnings()) {
                sb.append("  - ").append(warning).append('\n');
            }
        }

        DocumentState original = context.getOriginal();
        DocumentState current = context.getCurrent();
        if (context.getIteration() > 0 && !original.content().equals(current.content())) {
            sb.append("\nCHANGES SO FAR: ")
                    .append(DocumentWindowing.diffSummary(original.content(), current.content())).append('\n');
        }

        DocumentWindow window = windowing.window(current.content(), context.getFocus());
        sb.append("\nCURRENT DOCUMENT");
        if (window.isPartial()) {
            sb.append(" (lines ").append(window.startLine()).append('-').append(window.endLine())
                    .append(" of ").append(window.totalLines()).append(')');
        }
        sb.append(":\n```").append(current.language() != null ? current.language() : "").append('\n')
                .append(window.content()).append("\n```\n\n");

        if (context.getChangesApplied() == 0) {
            sb.append("Make the change now with one tool call.");
        } else {
            sb.append("Continue with the next change, or reply \"GOAL ACHIEVED\" if the goal is met.");
        }
        return sb.toString();
    }

    /**
     * Rough token estimate, four characters per token.
     */
    public static int estimateTokens(String text) {
        return text == null ? 0 : (text.length() + 3) / 4;
    }

    private static String progressBar(int changes) {
        int filled = Math.min(changes, PROGRESS_SLOTS);
        return "#".repeat(filled) + ".".repeat(PROGRESS_SLOTS - filled);
    }

    private static String statusMark(SubGoal.Status status) {
        return switch (status) {
        case DONE -> "[x]";
        case IN_PROGRESS -> "[>]";
        case PENDING -> "[ ]";
        };
    }

    static String outline(DocumentState document) {
        String language = document.language() != null ? document.language().toLowerCase(Locale.ROOT) : "";
        List<Pattern> patterns = switch (language) {
        case "typescript", "javascript", "ts", "js", "tsx", "jsx" -> List.of(JS_FUNCTION, JS_CLASS, JS_ARROW);
        case "python", "py" -> List.of(PY_DEF, PY_CLASS);
        case "java", "kotlin" -> List.of(JAVA_TYPE);
        default -> List.of();
        };
        if (patterns.isEmpty()) {
            return "";
        }

        List<String> entries = new ArrayList<>();
        String[] lines = document.content().split("\n", -1);
        for (int i = 0; i < lines.length && entries.size() < MAX_OUTLINE_ENTRIES; i++) {
            String line = lines[i].strip();
            for (Pattern pattern : patterns) {
                Matcher matcher = pattern.matcher(line);
                if (matcher.find()) {
                    entries.add("L" + (i + 1) + ": " + matcher.group(1));
                    break;
                }
            }
        }
        return String.join(" | ", entries);
    }
}
