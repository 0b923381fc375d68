package io.github.yok.flexload.exception;

import lombok.Getter;

/**
 * Thrown when the Stage or Promote transaction fails. The transaction has already been rolled
 * back when this exception is raised.
 */
@Getter
public class TransactionException extends TableLoadException {

    private static final long serialVersionUID = 1L;

    // Name of the phase that failed (STAGE or PROMOTE)
    private final String phase;

    /**
     * Creates an exception for a failed phase.
     *
     * @param phase name of the failed phase
     * @param message detail message
     * @param cause root cause
     */
    public TransactionException(String phase, String message, Throwable cause) {
        super(message, cause);
        this.phase = phase;
    }
}
