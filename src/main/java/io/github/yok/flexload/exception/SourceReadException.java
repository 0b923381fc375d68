package io.github.yok.flexload.exception;

/**
 * Thrown when the input file cannot be opened or read, when a requested sheet does not exist, or
 * when the file holds no loadable data. Always raised before any database interaction.
 */
public class SourceReadException extends TableLoadException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public SourceReadException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and a cause.
     *
     * @param message detail message
     * @param cause root cause
     */
    public SourceReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
