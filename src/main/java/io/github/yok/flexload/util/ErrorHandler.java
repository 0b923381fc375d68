package io.github.yok.flexload.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that logs a fatal load error and echoes a concise message to
 * {@code System.err}.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the error and its stack trace using SLF4J.</li>
 * <li>Writes a one-line message with the root cause to {@code System.err}.</li>
 * <li>Does not terminate the JVM by itself; {@link io.github.yok.flexload.Main} turns the failure
 * into a non-zero exit code.</li>
 * <li>In tests, callers can switch behavior to throwing an exception via a thread-local flag.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Switch to "throw exception instead of reporting" for the current thread (useful for tests).
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Returns a single-line description of the failure: the top-level message followed by the
     * root cause when they differ.
     *
     * @param cause failure
     * @return description suitable for notifications
     */
    public static String describe(Throwable cause) {
        String top = cause.getMessage() != null ? cause.getMessage()
                : cause.getClass().getSimpleName();
        Throwable root = ExceptionUtils.getRootCause(cause);
        if (root == null || root == cause) {
            return top;
        }
        return top + " (caused by " + ExceptionUtils.getRootCauseMessage(cause) + ")";
    }

    /**
     * Logs the given message and cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * <p>
     * If "exit is disabled" for the current thread, this method throws an exception instead.
     * </p>
     *
     * @param message message to log
     * @param cause root cause
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + describe(cause));
    }

    /**
     * Logs the given message at error level and prints it to {@code System.err}.
     *
     * <p>
     * If "exit is disabled" for the current thread, this method throws an exception instead.
     * </p>
     *
     * @param message message to log
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}
