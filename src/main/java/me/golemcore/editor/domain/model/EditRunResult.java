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

import java.util.List;

/**
 * Final result of one orchestration run. {@code finalDocument} is always the
 * last state produced by a verified tool call, or the original document when
 * nothing was applied.
 */
@Value
@Builder
public class EditRunResult {

    String runId;
    RunOutcome outcome;
    EditPhase finalPhase;
    EditGoal goal;

    @Builder.Default
    List<SubGoal> subGoals = List.of();

    DocumentState originalDocument;
    DocumentState finalDocument;

    @Builder.Default
    List<IterationRecord> iterations = List.of();

    @Builder.Default
    List<Checkpoint> checkpoints = List.of();

    int changesCount;
    String summary;
    String errorMessage;
    long durationMs;

    public boolean hasChanges() {
        return changesCount > 0;
    }
}
