package io.github.yok.csvseeder.core;

/**
 * Thrown when truncating the destination table or inserting a chunk fails. The run is aborted;
 * the original failure is kept as the cause.
 *
 * @author Yasuharu.Okawauchi
 */
public class BatchInsertException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message description of the failed operation
     * @param cause original write failure
     */
    public BatchInsertException(String message, Throwable cause) {
        super(message, cause);
    }
}
