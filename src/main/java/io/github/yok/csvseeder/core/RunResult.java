package io.github.yok.csvseeder.core;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of one seed run.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RunResult {

    /**
     * Terminal state of a run.
     */
    public enum Status {
        // Every data row was read; rows of the wrong shape were skipped
        COMPLETED,
        // Configuration error; the run stopped before reading data rows
        REJECTED,
        // Write or read failure; the run stopped part way
        ABORTED
    }

    Status status;
    // Table name as resolved for the run; may be null for rejected runs
    String tableName;
    // Non-empty data rows read, offset rows included
    int totalRows;
    // Records written to the table
    int insertedRows;
    // Rows dropped for shape mismatch or for transforming to nothing
    int skippedRows;
    // Message emitted through the reporter
    String message;
    // Original failure of an aborted run
    Throwable failure;

    static RunResult completed(String tableName, int totalRows, int insertedRows,
            int skippedRows, String message) {
        return new RunResult(Status.COMPLETED, tableName, totalRows, insertedRows, skippedRows,
                message, null);
    }

    static RunResult rejected(String tableName, String message) {
        return new RunResult(Status.REJECTED, tableName, 0, 0, 0, message, null);
    }

    static RunResult aborted(String tableName, int totalRows, int insertedRows, int skippedRows,
            String message, Throwable failure) {
        return new RunResult(Status.ABORTED, tableName, totalRows, insertedRows, skippedRows,
                message, failure);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
