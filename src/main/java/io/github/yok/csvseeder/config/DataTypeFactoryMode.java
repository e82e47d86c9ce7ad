package io.github.yok.csvseeder.config;

import org.dbunit.dataset.datatype.DefaultDataTypeFactory;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.h2.H2DataTypeFactory;
import org.dbunit.ext.mssql.MsSqlDataTypeFactory;
import org.dbunit.ext.mysql.MySqlDataTypeFactory;
import org.dbunit.ext.oracle.Oracle10DataTypeFactory;
import org.dbunit.ext.postgresql.PostgresqlDataTypeFactory;

/**
 * Enumerates the database products whose DBUnit data type factory can be selected through
 * {@code dbunit.data-type-factory-mode}.
 *
 * <p>
 * The data type factory decides how the string values read from CSV are cast to the column types
 * reported by the database when rows are inserted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum DataTypeFactoryMode {
    // H2 Database (default for local development databases)
    H2,
    // PostgreSQL
    POSTGRESQL,
    // MySQL / MariaDB
    MYSQL,
    // Oracle Database 10g and later
    ORACLE,
    // Microsoft SQL Server
    SQLSERVER,
    // Generic JDBC types only
    DEFAULT;

    /**
     * Creates the DBUnit data type factory for this mode.
     *
     * @return new data type factory instance
     */
    public IDataTypeFactory createDataTypeFactory() {
        switch (this) {
            case H2:
                return new H2DataTypeFactory();
            case POSTGRESQL:
                return new PostgresqlDataTypeFactory();
            case MYSQL:
                return new MySqlDataTypeFactory();
            case ORACLE:
                return new Oracle10DataTypeFactory();
            case SQLSERVER:
                return new MsSqlDataTypeFactory();
            default:
                return new DefaultDataTypeFactory();
        }
    }
}
