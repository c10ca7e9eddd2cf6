package me.golemcore.editor.domain.model;

/**
 * Answer of the intent collaborator for one instruction.
 */
public record IntentDecision(boolean shouldEdit, double confidence, String goal, EditComplexity complexity) {

    public static IntentDecision noEdit(double confidence) {
        return new IntentDecision(false, confidence, null, null);
    }
}
