package io.github.yok.csvseeder.core;

import io.github.yok.csvseeder.config.SeedConfig;
import io.github.yok.csvseeder.config.TimestampPolicy;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * Converts one CSV row into a record (table column name to value) ready for insertion.
 *
 * <p>
 * Steps applied to every row, in this order:
 * </p>
 * <ol>
 * <li>fields of skipped columns are dropped; empty fields and {@code NULL} become {@code null}
 * when {@link SeedConfig#isEmptyAsNull()} is set. A row with no field left yields {@code null}
 * and the remaining steps are not applied;</li>
 * <li>defaults fill columns the row leaves absent or {@code null};</li>
 * <li>the timestamp policy fills the creation/update columns the row leaves absent or
 * {@code null};</li>
 * <li>hash fields with a non-null value are replaced by their hex digest.</li>
 * </ol>
 *
 * <p>
 * One instance serves one run; it holds no per-row state.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class RowTransformer {

    private static final String NULL_LITERAL = "NULL";

    private final List<ColumnSpec> columns;
    private final Map<String, Object> defaults;
    private final TimestampPolicy timestamps;
    private final String createdAtColumn;
    private final String updatedAtColumn;
    private final Set<String> hashFields;
    private final DigestUtils digest;
    private final boolean emptyAsNull;
    private final Clock clock;

    /**
     * Creates a transformer for one run.
     *
     * @param columns resolved column specs
     * @param config run options
     * @param clock source of the current instant for {@link TimestampPolicy.Mode#CURRENT}
     * @throws IllegalArgumentException if the hash algorithm is not available
     */
    public RowTransformer(List<ColumnSpec> columns, SeedConfig config, Clock clock) {
        this.columns = columns;
        this.defaults = config.getDefaults();
        this.timestamps = config.getTimestamps();
        this.createdAtColumn = config.getCreatedAtColumn();
        this.updatedAtColumn = config.getUpdatedAtColumn();
        this.hashFields = config.getHashFields();
        this.digest = hashFields.isEmpty() ? null : new DigestUtils(config.getHashAlgorithm());
        this.emptyAsNull = config.isEmptyAsNull();
        this.clock = clock;
    }

    /**
     * Transforms one row.
     *
     * @param rawRow fields in file order
     * @return record to insert, or {@code null} when nothing is left to insert
     * @throws RowShapeException if the row does not have one field per column
     */
    public Map<String, Object> transform(List<String> rawRow) throws RowShapeException {
        if (rawRow.size() != columns.size()) {
            throw new RowShapeException(columns.size(), rawRow.size());
        }

        Map<String, Object> record = new LinkedHashMap<>();
        for (ColumnSpec column : columns) {
            if (column.isSkip()) {
                continue;
            }
            record.put(column.getTargetName(), normalize(rawRow.get(column.getSourceIndex())));
        }
        if (record.isEmpty()) {
            // every column is skipped
            return null;
        }

        if (defaults != null) {
            defaults.forEach((name, value) -> fillIfMissing(record, name, value));
        }

        applyTimestamps(record);

        for (String field : hashFields) {
            Object value = record.get(field);
            if (value != null) {
                record.put(field, digest.digestAsHex(String.valueOf(value)));
            }
        }

        return record;
    }

    private Object normalize(String value) {
        if (emptyAsNull && (value == null || value.isEmpty()
                || NULL_LITERAL.equalsIgnoreCase(value))) {
            return null;
        }
        return value;
    }

    private void applyTimestamps(Map<String, Object> record) {
        switch (timestamps.getMode()) {
            case CURRENT:
                Timestamp now = Timestamp.from(clock.instant());
                fillIfMissing(record, createdAtColumn, now);
                fillIfMissing(record, updatedAtColumn, now);
                break;
            case FIXED:
                fillIfMissing(record, createdAtColumn, timestamps.getFixedValue());
                fillIfMissing(record, updatedAtColumn, timestamps.getFixedValue());
                break;
            case NULL:
                // explicit null so the column is written, not left to its default
                record.putIfAbsent(createdAtColumn, null);
                record.putIfAbsent(updatedAtColumn, null);
                break;
            default:
                break;
        }
    }

    private static void fillIfMissing(Map<String, Object> record, String name, Object value) {
        if (record.get(name) == null) {
            record.put(name, value);
        }
    }
}
