package io.github.yok.csvseeder.db;

import java.util.List;
import java.util.Map;

/**
 * Write operations the seeder performs on the destination table.
 *
 * <p>
 * Each call is its own atomic unit: it is either fully applied and committed or not applied at
 * all.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface TableWriter {

    /**
     * Deletes every row of the table.
     *
     * @param tableName table name as stored in the database
     * @throws Exception write failure
     */
    void truncate(String tableName) throws Exception;

    /**
     * Inserts the records in a single operation.
     *
     * @param tableName table name as stored in the database
     * @param records records keyed by column name
     * @throws Exception write failure
     */
    void insertMany(String tableName, List<Map<String, Object>> records) throws Exception;
}
