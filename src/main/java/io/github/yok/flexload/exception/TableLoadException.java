package io.github.yok.flexload.exception;

/**
 * Base class of the fatal errors that terminate a load run.
 *
 * <p>
 * Cell-level and row-level problems (unparseable values, blank rows, missing headers) never reach
 * this hierarchy; they are logged and counted instead. Everything modeled here aborts the run.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class TableLoadException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public TableLoadException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and a cause.
     *
     * @param message detail message
     * @param cause root cause
     */
    public TableLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
