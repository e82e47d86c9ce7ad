package io.github.yok.csvseeder.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.DefaultTableMetaData;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.datatype.DataType;
import org.dbunit.operation.DatabaseOperation;

/**
 * {@link TableWriter} that writes through DBUnit.
 *
 * <ul>
 * <li>{@link #truncate(String)} runs {@link DatabaseOperation#TRUNCATE_TABLE}.</li>
 * <li>{@link #insertMany(String, List)} builds one in-memory {@link DefaultTable} from the
 * records and runs {@link DatabaseOperation#INSERT} on it. Column types are taken from the
 * database, so the CSV strings are cast by the configured data type factory.</li>
 * </ul>
 *
 * <p>
 * When the JDBC connection is not in auto-commit mode, each call is committed on success and
 * rolled back on failure, making every call its own transaction.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DbUnitTableWriter implements TableWriter {

    /**
     * Abstraction for the DBUnit write operations used by this writer.
     */
    interface OperationExecutor {

        /**
         * Executes DBUnit TRUNCATE_TABLE.
         *
         * @param connection DBUnit connection
         * @param dataSet dataset naming the table
         * @throws Exception execution failure
         */
        void truncate(IDatabaseConnection connection, IDataSet dataSet) throws Exception;

        /**
         * Executes DBUnit INSERT.
         *
         * @param connection DBUnit connection
         * @param dataSet dataset to write
         * @throws Exception execution failure
         */
        void insert(IDatabaseConnection connection, IDataSet dataSet) throws Exception;
    }

    private final IDatabaseConnection connection;
    private final OperationExecutor operationExecutor;

    /**
     * Creates a writer with the default DBUnit operations.
     *
     * @param connection configured DBUnit connection
     */
    public DbUnitTableWriter(IDatabaseConnection connection) {
        this(connection, new OperationExecutor() {
            @Override
            public void truncate(IDatabaseConnection connection, IDataSet dataSet)
                    throws Exception {
                DatabaseOperation.TRUNCATE_TABLE.execute(connection, dataSet);
            }

            @Override
            public void insert(IDatabaseConnection connection, IDataSet dataSet)
                    throws Exception {
                DatabaseOperation.INSERT.execute(connection, dataSet);
            }
        });
    }

    /**
     * Creates a writer with a custom operation executor.
     *
     * @param connection configured DBUnit connection
     * @param operationExecutor executor for DBUnit write operations
     */
    DbUnitTableWriter(IDatabaseConnection connection, OperationExecutor operationExecutor) {
        this.connection = connection;
        this.operationExecutor = operationExecutor;
    }

    @Override
    public void truncate(String tableName) throws Exception {
        IDataSet dataSet = new DefaultDataSet(new DefaultTable(tableName));
        inTransaction(() -> operationExecutor.truncate(connection, dataSet));
        log.debug("[{}] TRUNCATE_TABLE committed", tableName);
    }

    @Override
    public void insertMany(String tableName, List<Map<String, Object>> records) throws Exception {
        if (records == null || records.isEmpty()) {
            return;
        }
        ITable table = toTable(tableName, records);
        inTransaction(() -> operationExecutor.insert(connection, new DefaultDataSet(table)));
        log.debug("[{}] INSERT committed: {} rows", tableName, records.size());
    }

    /**
     * Builds a DBUnit table from the records. The columns are the union of the record keys in
     * first-seen order; a column a record does not have is {@link ITable#NO_VALUE}, which DBUnit
     * leaves out of that row's INSERT so the column default applies.
     *
     * @param tableName table name as stored in the database
     * @param records records keyed by column name
     * @return in-memory table
     * @throws Exception if a row cannot be added
     */
    static ITable toTable(String tableName, List<Map<String, Object>> records) throws Exception {
        Set<String> names = new LinkedHashSet<>();
        for (Map<String, Object> record : records) {
            names.addAll(record.keySet());
        }
        Column[] columns =
                names.stream().map(n -> new Column(n, DataType.UNKNOWN)).toArray(Column[]::new);

        DefaultTable table = new DefaultTable(new DefaultTableMetaData(tableName, columns));
        for (Map<String, Object> record : records) {
            Object[] values = new Object[columns.length];
            for (int i = 0; i < columns.length; i++) {
                String name = columns[i].getColumnName();
                values[i] = record.containsKey(name) ? record.get(name) : ITable.NO_VALUE;
            }
            table.addRow(values);
        }
        return table;
    }

    private interface Work {
        void run() throws Exception;
    }

    private void inTransaction(Work work) throws Exception {
        Connection jdbc = connection.getConnection();
        boolean manual = !jdbc.getAutoCommit();
        try {
            work.run();
            if (manual) {
                jdbc.commit();
            }
        } catch (Exception e) {
            if (manual) {
                try {
                    jdbc.rollback();
                } catch (SQLException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
            }
            throw e;
        }
    }
}
