package me.golemcore.editor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Decomposition unit of the goal, for prompts and progress only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubGoal {

    public enum Status {
        PENDING, IN_PROGRESS, DONE
    }

    private int index;
    private String description;

    @Builder.Default
    private Status status = Status.PENDING;
}
