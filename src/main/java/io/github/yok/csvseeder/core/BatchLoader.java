package io.github.yok.csvseeder.core;

import com.google.common.base.Preconditions;
import io.github.yok.csvseeder.db.TableWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Buffers records and writes them to the destination table in chunks of a fixed size.
 *
 * <p>
 * Lifecycle of one run: {@link #beginRun(boolean)} once, {@link #append(Map)} per record,
 * {@link #endRun()} once. A full buffer is flushed automatically.
 * </p>
 *
 * <p>
 * Failure policy is fail-fast: the first failed write discards the current buffer and raises
 * {@link BatchInsertException}. Nothing is retried, so no record is ever inserted twice. Chunks
 * flushed before the failure stay in the table.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BatchLoader {

    private final TableWriter writer;
    private final String tableName;
    private final int chunkSize;

    private final List<Map<String, Object>> buffer;
    private boolean begun;
    private int flushedRecords;
    private int insertCalls;

    /**
     * Creates a loader for one run.
     *
     * @param writer destination table writer
     * @param tableName table name as stored in the database
     * @param chunkSize records per insert call
     * @throws IllegalArgumentException if {@code chunkSize} is less than 1
     */
    public BatchLoader(TableWriter writer, String tableName, int chunkSize) {
        Preconditions.checkArgument(chunkSize >= 1, "chunkSize must be 1 or greater: %s",
                chunkSize);
        this.writer = writer;
        this.tableName = tableName;
        this.chunkSize = chunkSize;
        this.buffer = new ArrayList<>(chunkSize);
    }

    /**
     * Starts the run, truncating the table first when requested.
     *
     * <p>
     * The truncation is committed on its own; a failure between it and the first insert leaves
     * the table empty.
     * </p>
     *
     * @param truncate {@code true} to delete every existing row
     * @throws BatchInsertException if the truncation fails
     * @throws IllegalStateException if the run has already begun
     */
    public void beginRun(boolean truncate) throws BatchInsertException {
        Preconditions.checkState(!begun, "Run has already begun for table %s", tableName);
        begun = true;
        if (!truncate) {
            return;
        }
        try {
            writer.truncate(tableName);
            log.info("[{}] Table truncated", tableName);
        } catch (Exception e) {
            throw new BatchInsertException("Failed to truncate table \"" + tableName + "\"", e);
        }
    }

    /**
     * Buffers a record, flushing when the buffer reaches the chunk size.
     *
     * @param record record to insert
     * @throws BatchInsertException if the triggered flush fails
     */
    public void append(Map<String, Object> record) throws BatchInsertException {
        Preconditions.checkState(begun, "Run has not begun for table %s", tableName);
        buffer.add(record);
        if (buffer.size() >= chunkSize) {
            flush();
        }
    }

    /**
     * Inserts the buffered records with a single insert call. Does nothing when the buffer is
     * empty.
     *
     * @throws BatchInsertException if the insert fails; the buffered records are discarded
     */
    public void flush() throws BatchInsertException {
        if (buffer.isEmpty()) {
            return;
        }
        List<Map<String, Object>> chunk = new ArrayList<>(buffer);
        buffer.clear();
        insertCalls++;
        try {
            writer.insertMany(tableName, chunk);
        } catch (Exception e) {
            throw new BatchInsertException("Failed to insert chunk #" + insertCalls + " ("
                    + chunk.size() + " rows) into table \"" + tableName + "\"", e);
        }
        flushedRecords += chunk.size();
        log.debug("[{}] Chunk #{} inserted: {} rows (total {})", tableName, insertCalls,
                chunk.size(), flushedRecords);
    }

    /**
     * Ends the run by flushing the last, possibly short, chunk.
     *
     * @throws BatchInsertException if the insert fails
     */
    public void endRun() throws BatchInsertException {
        flush();
    }

    /**
     * Returns the number of records written to the table so far.
     *
     * @return flushed record count
     */
    public int getFlushedRecords() {
        return flushedRecords;
    }

    /**
     * Returns the number of insert calls issued so far, the failed one included.
     *
     * @return insert call count
     */
    public int getInsertCalls() {
        return insertCalls;
    }

    /**
     * Returns the number of records waiting in the buffer.
     *
     * @return buffered record count
     */
    public int getBufferedRecords() {
        return buffer.size();
    }
}
