package me.golemcore.editor.domain.model;

public enum EditEventType {
    START, PHASE_CHANGE, PLAN, ITERATION_START, THINKING, TOOL_CALL, TOOL_RESULT, CONTENT_CHANGE, VERIFICATION, CHECKPOINT, COMPLETE, ERROR
}
