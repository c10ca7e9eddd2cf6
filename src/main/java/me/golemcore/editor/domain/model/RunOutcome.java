package me.golemcore.editor.domain.model;

public enum RunOutcome {
    SUCCESS_WITH_CHANGES, NO_EDIT_INTENDED, BLOCKED, ERROR
}
