package io.github.yok.csvseeder.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that logs a fatal seeding error and echoes a concise message to
 * {@code System.err}.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the error, with the stack trace of the cause when there is one.</li>
 * <li>Writes a one-line message to {@code System.err}.</li>
 * <li>Does not terminate the JVM by itself; the caller sets the process exit status.</li>
 * <li>When exit is disabled for the current thread, throws {@link IllegalStateException} instead,
 * so tests can assert on the failure.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private ErrorHandler() {}

    /**
     * Throw an exception instead of ending the process, for the current thread.
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
     * Logs the message with the stack trace of its cause and prints a concise message to
     * {@code System.err}.
     *
     * @param message message to log
     * @param cause cause of the failure; may be {@code null}
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        if (cause == null) {
            errorAndExit(message);
            return;
        }
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + cause.getMessage());
    }

    /**
     * Logs the message and prints it to {@code System.err}.
     *
     * @param message message to log
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}
