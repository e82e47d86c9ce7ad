package io.github.yok.csvseeder.util;

/**
 * Sink for the user-facing messages of a seed run: header warnings, the final summary and the
 * terminal error of a rejected or aborted run.
 *
 * @author Yasuharu.Okawauchi
 */
public interface SeedReporter {

    /**
     * Message levels.
     */
    enum Level {
        INFO, WARN, ERROR
    }

    /**
     * Emits a message.
     *
     * @param message message text
     * @param level message level
     */
    void emit(String message, Level level);

    /**
     * Emits an informational message.
     *
     * @param message message text
     */
    default void emit(String message) {
        emit(message, Level.INFO);
    }
}
