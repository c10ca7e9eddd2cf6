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

import me.golemcore.editor.domain.model.EditGoal;
import me.golemcore.editor.domain.model.SubGoal;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a goal into ordered sub-goals. Sub-goals shape prompts and progress
 * reporting only; they never gate execution.
 */
public class GoalPlanner {

    private static final int MAX_SUB_GOALS = 8;
    private static final int MIN_WORDS = 2;

    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*(?:\\d+[.)]|[-*])\\s+(.+)$");
    private static final Pattern SEPARATORS = Pattern.compile("\\s*(?:;|,?\\s+then\\s+|,\\s+and\\s+|\\s+and\\s+)\\s*",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_THEN = Pattern.compile("^then\\s+", Pattern.CASE_INSENSITIVE);

    public List<SubGoal> plan(EditGoal goal) {
        String description = goal != null && goal.getDescription() != null ? goal.getDescription().strip() : "";
        List<String> parts = listItems(description);
        if (parts.isEmpty()) {
            parts = splitSentence(description);
        }

        List<SubGoal> subGoals = new ArrayList<>();
        for (String part : parts) {
            if (subGoals.size() >= MAX_SUB_GOALS) {
                break;
            }
            subGoals.add(SubGoal.builder().index(subGoals.size()).description(part).build());
        }
        if (subGoals.isEmpty()) {
            subGoals.add(SubGoal.builder().index(0).description(description).build());
        }
        return subGoals;
    }

    /**
     * Marks the first {@code changes} sub-goals done and the next one in
     * progress. The last sub-goal stays in progress until the run completes.
     */
    public static void updateProgress(List<SubGoal> subGoals, int changes, boolean runComplete) {
        for (int i = 0; i < subGoals.size(); i++) {
            SubGoal subGoal = subGoals.get(i);
            boolean last = i == subGoals.size() - 1;
            if (runComplete || (i < changes && !last)) {
                subGoal.setStatus(SubGoal.Status.DONE);
            } else if (i == Math.min(changes, subGoals.size() - 1)) {
                subGoal.setStatus(SubGoal.Status.IN_PROGRESS);
            } else {
                subGoal.setStatus(SubGoal.Status.PENDING);
            }
        }
    }

    private static List<String> listItems(String description) {
        List<String> items = new ArrayList<>();
        for (String line : description.split("\n")) {
            Matcher matcher = LIST_ITEM.matcher(line);
            if (matcher.matches()) {
                items.add(matcher.group(1).strip());
            }
        }
        return items.size() > 1 ? items : List.of();
    }

    private static List<String> splitSentence(String description) {
        String[] pieces = SEPARATORS.split(description);
        List<String> parts = new ArrayList<>();
        for (String piece : pieces) {
            String trimmed = LEADING_THEN.matcher(piece.strip()).replaceFirst("");
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.split("\\s+").length < MIN_WORDS && !parts.isEmpty()) {
                // "add x and y": a one-word tail belongs to the previous clause
                int lastIndex = parts.size() - 1;
                parts.set(lastIndex, parts.get(lastIndex) + " and " + trimmed);
                continue;
            }
            parts.add(trimmed);
        }
        return parts;
    }
}
