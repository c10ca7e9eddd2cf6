package me.golemcore.editor.domain.model;

/**
 * Orchestration state machine phases.
 */
public enum EditPhase {

    IDLE, DETECTING, PLANNING, EXECUTING, COMPLETE, BLOCKED, ERROR;

    public boolean isTerminal() {
        return this == COMPLETE || this == BLOCKED || this == ERROR;
    }
}
