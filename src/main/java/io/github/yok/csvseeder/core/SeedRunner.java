package io.github.yok.csvseeder.core;

import io.github.yok.csvseeder.config.SeedConfig;
import io.github.yok.csvseeder.db.TableCatalog;
import io.github.yok.csvseeder.db.TableWriter;
import io.github.yok.csvseeder.parser.RowSource;
import io.github.yok.csvseeder.parser.RowSourceProvider;
import io.github.yok.csvseeder.util.SeedReporter;
import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Seeds one table from one CSV file.
 *
 * <p>
 * A run goes through these steps, in order, without going back:
 * </p>
 * <ol>
 * <li><strong>validate</strong>: the source is given and readable, the table exists;</li>
 * <li><strong>truncate</strong>: the table is emptied when {@link SeedConfig#isTruncate()};</li>
 * <li><strong>resolve header</strong>: the header row (or the column mapping) becomes column
 * specs;</li>
 * <li><strong>iterate</strong>: each non-empty data row after the row offset is transformed and
 * buffered, chunks are inserted as they fill up;</li>
 * <li><strong>drain</strong>: the last partial chunk is inserted;</li>
 * <li><strong>close</strong> the source and <strong>report</strong> the counts.</li>
 * </ol>
 *
 * <p>
 * <strong>Failure handling:</strong>
 * </p>
 * <ul>
 * <li>Configuration errors (steps 1 and 3) end the run as {@link RunResult.Status#REJECTED}.</li>
 * <li>A row whose field count differs from the header is skipped; the run goes on.</li>
 * <li>A failed truncate or insert, or a failed read, ends the run as
 * {@link RunResult.Status#ABORTED}. Chunks already inserted stay in the table.</li>
 * </ul>
 *
 * <p>
 * Every rejected or aborted run emits exactly one error message through the
 * {@link SeedReporter}; every completed run emits exactly one summary.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SeedRunner {

    private final RowSourceProvider sourceProvider;
    private final TableCatalog catalog;
    private final TableWriter writer;
    private final SeedReporter reporter;
    private final Clock clock;

    /**
     * Creates a runner using the system clock.
     *
     * @param sourceProvider opens the CSV source
     * @param catalog looks up the destination table
     * @param writer writes to the destination table
     * @param reporter receives user-facing messages
     */
    public SeedRunner(RowSourceProvider sourceProvider, TableCatalog catalog, TableWriter writer,
            SeedReporter reporter) {
        this(sourceProvider, catalog, writer, reporter, Clock.systemDefaultZone());
    }

    /**
     * Creates a runner with a custom clock for timestamp stamping.
     *
     * @param sourceProvider opens the CSV source
     * @param catalog looks up the destination table
     * @param writer writes to the destination table
     * @param reporter receives user-facing messages
     * @param clock source of the current instant
     */
    public SeedRunner(RowSourceProvider sourceProvider, TableCatalog catalog, TableWriter writer,
            SeedReporter reporter, Clock clock) {
        this.sourceProvider = sourceProvider;
        this.catalog = catalog;
        this.writer = writer;
        this.reporter = reporter;
        this.clock = clock;
    }

    /**
     * Runs the seed.
     *
     * @param config run options
     * @return outcome of the run
     */
    public RunResult run(SeedConfig config) {
        String source = config.getSource();
        log.info("=== SeedRunner started (source={}, table={}) ===", source,
                config.getTableName());

        // validate
        if (StringUtils.isBlank(source)) {
            return reject(null, "No CSV file given");
        }
        if (!sourceProvider.isReadable(source)) {
            return reject(null, "File \"" + source + "\" could not be found or is not readable");
        }
        String invalidOption = validateOptions(config);
        if (invalidOption != null) {
            return reject(null, invalidOption);
        }

        String requestedTable = StringUtils.defaultIfBlank(config.getTableName(),
                FilenameUtils.getBaseName(source));
        Optional<String> found;
        try {
            found = catalog.findTable(requestedTable);
        } catch (SQLException e) {
            log.error("[{}] Table lookup failed", requestedTable, e);
            return reject(requestedTable, "Table \"" + requestedTable
                    + "\" could not be looked up: " + ExceptionUtils.getRootCauseMessage(e));
        }
        if (found.isEmpty()) {
            return reject(requestedTable,
                    "Table \"" + requestedTable + "\" could not be found in database");
        }
        String tableName = found.get();

        // truncate
        BatchLoader loader = new BatchLoader(writer, tableName, config.getChunkSize());
        try {
            loader.beginRun(config.isTruncate());
        } catch (BatchInsertException e) {
            return abort(tableName, 0, loader, 0, writeFailureMessage(source, tableName, e), e);
        }

        int totalRows = 0;
        int insertedRows = 0;
        int skippedRows = 0;
        try (RowSource rows = sourceProvider.open(source, config.getDelimiter(),
                config.getEncoding())) {

            // resolve header
            ResolvedHeader header;
            try {
                header = HeaderResolver.resolve(readHeader(rows, config), config.getAliases(),
                        config.getSkipPrefix());
            } catch (IllegalArgumentException e) {
                return reject(tableName, e.getMessage());
            }
            for (String warning : header.getWarnings()) {
                reporter.emit(warning + " (delimiter: '" + config.getDelimiter() + "')",
                        SeedReporter.Level.WARN);
            }
            log.info("[{}] Header resolved: {}", tableName, header.getColumns());

            // iterate
            RowTransformer transformer = new RowTransformer(header.getColumns(), config, clock);
            int remainingOffset = config.getRowOffset();
            List<String> row;
            while ((row = rows.readRow()) != null) {
                if (isEmptyRow(row)) {
                    continue;
                }
                totalRows++;
                if (remainingOffset > 0) {
                    remainingOffset--;
                    continue;
                }

                Map<String, Object> record;
                try {
                    record = transformer.transform(row);
                } catch (RowShapeException e) {
                    log.warn("[{}] Data row {} skipped: {}", tableName, totalRows, e.getMessage());
                    skippedRows++;
                    continue;
                }
                if (record == null) {
                    skippedRows++;
                    continue;
                }
                loader.append(record);
                insertedRows++;
            }

            // drain
            loader.endRun();
        } catch (BatchInsertException e) {
            return abort(tableName, totalRows, loader, skippedRows,
                    writeFailureMessage(source, tableName, e), e);
        } catch (IOException e) {
            return abort(tableName, totalRows, loader, skippedRows, "File \"" + source
                    + "\" could not be read: " + ExceptionUtils.getRootCauseMessage(e), e);
        }

        // report
        String summary = insertedRows + " of " + totalRows + " rows have been seeded in table \""
                + tableName + "\"";
        reporter.emit(summary, SeedReporter.Level.INFO);
        log.info("=== SeedRunner finished (table={}, inserted={}, total={}, skipped={}) ===",
                tableName, insertedRows, totalRows, skippedRows);
        return RunResult.completed(tableName, totalRows, insertedRows, skippedRows, summary);
    }

    /**
     * Reads the header row when the file has one and applies the column mapping.
     *
     * @param rows opened source positioned at the first row
     * @param config run options
     * @return header names; empty if there is none
     * @throws IOException if the source cannot be read
     */
    private List<String> readHeader(RowSource rows, SeedConfig config) throws IOException {
        List<String> header = null;
        if (config.isHasHeader()) {
            header = rows.readRow();
        }
        if (config.getColumnMapping() != null && !config.getColumnMapping().isEmpty()) {
            header = config.getColumnMapping();
        }
        return header == null ? List.of() : header;
    }

    /**
     * Checks the options a run cannot start without.
     *
     * @param config run options
     * @return error message, or {@code null} if the options are usable
     */
    private static String validateOptions(SeedConfig config) {
        if (config.getChunkSize() < 1) {
            return "Chunk size must be 1 or greater: " + config.getChunkSize();
        }
        if (config.getRowOffset() < 0) {
            return "Row offset must not be negative: " + config.getRowOffset();
        }
        if (config.getHashFields() != null && !config.getHashFields().isEmpty()
                && !DigestUtils.isAvailable(config.getHashAlgorithm())) {
            return "Hash algorithm \"" + config.getHashAlgorithm() + "\" is not available";
        }
        return null;
    }

    /**
     * Returns whether the row comes from a blank line: no field at all, or one blank field. A row
     * of several empty fields ({@code ;}) is a data row.
     *
     * @param row row fields
     * @return {@code true} for rows to ignore
     */
    static boolean isEmptyRow(List<String> row) {
        return row.isEmpty() || (row.size() == 1 && StringUtils.isBlank(row.get(0)));
    }

    private static String writeFailureMessage(String source, String tableName,
            BatchInsertException e) {
        return "Rows of the file \"" + source + "\" could not be inserted into table \""
                + tableName + "\": " + e.getMessage() + ": "
                + ExceptionUtils.getRootCauseMessage(e.getCause());
    }

    private RunResult reject(String tableName, String message) {
        reporter.emit(message, SeedReporter.Level.ERROR);
        log.info("=== SeedRunner rejected (table={}) ===", tableName);
        return RunResult.rejected(tableName, message);
    }

    private RunResult abort(String tableName, int totalRows, BatchLoader loader, int skippedRows,
            String message, Exception failure) {
        reporter.emit(message, SeedReporter.Level.ERROR);
        log.error("[{}] Seeding aborted after {} inserted rows", tableName,
                loader.getFlushedRecords(), failure);
        return RunResult.aborted(tableName, totalRows, loader.getFlushedRecords(), skippedRows,
                message, failure);
    }
}
