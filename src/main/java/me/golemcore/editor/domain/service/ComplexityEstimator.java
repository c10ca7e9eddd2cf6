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

import java.util.regex.Pattern;

/**
 * Heuristic complexity class for goals the intent collaborator left
 * unclassified.
 */
public final class ComplexityEstimator {

    private static final Pattern TRIVIAL = Pattern.compile("^(fix typo|rename|change.*to|update.*value)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SIMPLE = Pattern.compile("^(add.*function|fix.*bug|update.*import|add.*import)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern COMPLEX = Pattern.compile("\\b(refactor|restructure|rewrite|multiple|all|every)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final int LARGE_DOCUMENT_LINES = 200;

    private ComplexityEstimator() {
    }

    public static EditComplexity estimate(String goal, String content) {
        String text = goal != null ? goal.strip() : "";
        if (TRIVIAL.matcher(text).find()) {
            return EditComplexity.TRIVIAL;
        }
        if (SIMPLE.matcher(text).find()) {
            return EditComplexity.SIMPLE;
        }
        if (COMPLEX.matcher(text).find()) {
            return EditComplexity.COMPLEX;
        }
        if (content != null && content.split("\n", -1).length > LARGE_DOCUMENT_LINES) {
            return EditComplexity.MODERATE;
        }
        return EditComplexity.SIMPLE;
    }
}
