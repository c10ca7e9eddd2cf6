package me.golemcore.editor.domain.model;

/**
 * Failure classification for tool execution results.
 */
public enum ToolFailureKind {

    /**
     * Exception-class failure (I/O, interrupted work). Retried with backoff.
     */
    TRANSIENT,

    /**
     * Attempt exceeded the tool timeout. Retried like {@link #TRANSIENT}.
     */
    TIMEOUT,

    /**
     * Tool ran but could not apply the request (search text not found,
     * malformed patch, empty content). Never retried; surfaced to the oracle
     * as corrective guidance.
     */
    STRUCTURAL,

    /**
     * Parameters failed the tool schema. Never retried.
     */
    VALIDATION,

    /**
     * Short-circuited by an open circuit, the tool was not invoked.
     */
    CIRCUIT_OPEN,

    /**
     * No tool registered under the requested name.
     */
    UNKNOWN_TOOL;

    public boolean isRetryable() {
        return this == TRANSIENT || this == TIMEOUT;
    }
}
