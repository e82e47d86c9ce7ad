package io.github.yok.csvseeder.db;

import java.sql.SQLException;
import java.util.Optional;

/**
 * Lookup of tables in the target schema.
 *
 * @author Yasuharu.Okawauchi
 */
public interface TableCatalog {

    /**
     * Finds a table by name. An exact match wins over a case-insensitive one.
     *
     * @param tableName requested table name
     * @return the table name as stored in the database, or empty if there is no such table
     * @throws SQLException if the catalog cannot be read
     */
    Optional<String> findTable(String tableName) throws SQLException;
}
