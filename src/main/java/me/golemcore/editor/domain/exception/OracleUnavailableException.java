package me.golemcore.editor.domain.exception;

/**
 * The oracle call could not be completed after its retry budget.
 */
public class OracleUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public OracleUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
