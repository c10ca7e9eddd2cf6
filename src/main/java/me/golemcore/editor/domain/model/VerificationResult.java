package me.golemcore.editor.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Advisory verdict on one document change.
 */
@Value
@Builder
public class VerificationResult {

    String diffSummary;
    int linesAdded;
    int linesRemoved;
    double confidence;
    boolean syntaxValid;
    boolean unexpectedChanges;

    @Builder.Default
    List<String> warnings = List.of();

    public boolean hasWarnings() {
        return warnings != null && !warnings.isEmpty();
    }
}
