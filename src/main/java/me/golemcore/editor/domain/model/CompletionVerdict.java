package me.golemcore.editor.domain.model;

/**
 * Decision of the completion detector for one oracle response. A rejected
 * verdict marks a premature claim of completion.
 */
public record CompletionVerdict(
        boolean complete,
        boolean rejected,
        double confidence,
        String reason,
        CompletionSignals signals) {
}
