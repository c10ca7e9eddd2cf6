package me.golemcore.editor.domain.model;

/**
 * Individual completion signals. {@code claimScore} is 0 when no claim phrase
 * matched, otherwise the tier score (0.5, 0.7 or 0.9).
 */
public record CompletionSignals(
        double claimScore,
        boolean noFurtherToolCall,
        boolean verifiedChanges,
        boolean contentStabilized) {

    public boolean explicitClaim() {
        return claimScore > 0;
    }
}
