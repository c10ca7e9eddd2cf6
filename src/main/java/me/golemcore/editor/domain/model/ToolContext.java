package me.golemcore.editor.domain.model;

/**
 * Read-only view lent to a tool for one call: the current document and the
 * owning run.
 */
public record ToolContext(String runId, DocumentState document) {

    public ToolContext withDocument(DocumentState updated) {
        return new ToolContext(runId, updated);
    }
}
