package me.golemcore.editor.domain.model;

public enum GoalStatus {
    IN_PROGRESS, ACHIEVED, BLOCKED
}
