package me.golemcore.editor.adapter.inbound.web.dto;

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
import lombok.Data;
import me.golemcore.editor.domain.model.Checkpoint;
import me.golemcore.editor.domain.model.DocumentState;
import me.golemcore.editor.domain.model.EditRunResult;
import me.golemcore.editor.domain.model.IterationRecord;

import java.time.Instant;
import java.util.List;

/**
 * Run result as exposed by the edits API. Checkpoints are listed without
 * their document snapshots.
 */
@Data
@Builder
public class EditRunResponse {

    private String runId;
    private String outcome;
    private String finalPhase;
    private String goal;
    private String complexity;
    private List<SubGoalDto> subGoals;
    private int changesCount;
    private String summary;
    private String errorMessage;
    private long durationMs;
    private DocumentState document;
    private List<IterationDto> iterations;
    private List<CheckpointDto> checkpoints;

    public static EditRunResponse from(EditRunResult result) {
        return EditRunResponse.builder()
                .runId(result.getRunId())
                .outcome(result.getOutcome().name())
                .finalPhase(result.getFinalPhase().name())
                .goal(result.getGoal() != null ? result.getGoal().getDescription() : null)
                .complexity(result.getGoal() != null ? result.getGoal().getComplexity().wireName() : null)
                .subGoals(result.getSubGoals().stream()
                        .map(s -> new SubGoalDto(s.getDescription(), s.getStatus().name()))
                        .toList())
                .changesCount(result.getChangesCount())
                .summary(result.getSummary())
                .errorMessage(result.getErrorMessage())
                .durationMs(result.getDurationMs())
                .document(result.getFinalDocument())
                .iterations(result.getIterations().stream().map(EditRunResponse::toDto).toList())
                .checkpoints(result.getCheckpoints().stream().map(EditRunResponse::toDto).toList())
                .build();
    }

    private static IterationDto toDto(IterationRecord record) {
        return new IterationDto(
                record.getStep(),
                record.getRationale(),
                record.getInvocation() != null ? record.getInvocation().toolName() : null,
                record.getToolResult() != null ? record.getToolResult().isSuccess() : null,
                record.getToolResult() != null ? record.getToolResult().getMessage() : null,
                record.getStatus() != null ? record.getStatus().name() : null,
                record.getVerdict() != null ? record.getVerdict().reason() : null,
                record.getVerdict() != null ? record.getVerdict().confidence() : null,
                record.getVerification() != null ? record.getVerification().getWarnings() : List.of(),
                record.getNote(),
                record.getDurationMs());
    }

    private static CheckpointDto toDto(Checkpoint checkpoint) {
        return new CheckpointDto(checkpoint.id(), checkpoint.iteration(), checkpoint.description(),
                checkpoint.createdAt());
    }

    public record SubGoalDto(String description, String status) {
    }

    public record IterationDto(int step, String rationale, String tool, Boolean success, String message,
            String status, String verdict, Double confidence, List<String> warnings, String note,
            long durationMs) {
    }

    public record CheckpointDto(String id, int iteration, String description, Instant createdAt) {
    }
}
