package io.github.yok.csvseeder.db;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link TableCatalog} backed by JDBC {@link DatabaseMetaData}.
 *
 * <p>
 * Databases store unquoted identifiers in different cases (upper case for Oracle and H2, lower
 * case for PostgreSQL), so the lookup falls back to a case-insensitive match and returns the name
 * as stored.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JdbcTableCatalog implements TableCatalog {

    private final Connection connection;
    private final String schema;

    /**
     * Creates a catalog over one schema.
     *
     * @param connection JDBC connection
     * @param schema schema name; {@code null} searches every schema
     */
    public JdbcTableCatalog(Connection connection, String schema) {
        this.connection = connection;
        this.schema = schema;
    }

    @Override
    public Optional<String> findTable(String tableName) throws SQLException {
        if (tableName == null || tableName.isEmpty()) {
            return Optional.empty();
        }
        DatabaseMetaData meta = connection.getMetaData();
        String caseInsensitiveMatch = null;
        try (ResultSet rs = meta.getTables(connection.getCatalog(), schema, "%", null)) {
            while (rs.next()) {
                String name = rs.getString("TABLE_NAME");
                if (tableName.equals(name)) {
                    return Optional.of(name);
                }
                if (caseInsensitiveMatch == null && tableName.equalsIgnoreCase(name)) {
                    caseInsensitiveMatch = name;
                }
            }
        }
        if (caseInsensitiveMatch != null) {
            log.debug("Table [{}] resolved to [{}] (schema={})", tableName, caseInsensitiveMatch,
                    schema);
        }
        return Optional.ofNullable(caseInsensitiveMatch);
    }
}
