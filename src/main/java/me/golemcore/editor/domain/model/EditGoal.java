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

import lombok.Builder;
import lombok.Value;

/**
 * Target of one orchestration run. Created once from the intent decision and
 * never changed while the run is active.
 */
@Value
@Builder
public class EditGoal {

    String description;

    @Builder.Default
    String approach = "targeted changes";

    @Builder.Default
    EditComplexity complexity = EditComplexity.SIMPLE;

    int estimatedChanges;

    public static EditGoal of(String description, EditComplexity complexity) {
        EditComplexity resolved = complexity != null ? complexity : EditComplexity.SIMPLE;
        return EditGoal.builder()
                .description(description)
                .complexity(resolved)
                .estimatedChanges(resolved.getEstimatedChanges())
                .build();
    }
}
