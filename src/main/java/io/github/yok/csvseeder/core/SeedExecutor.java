package io.github.yok.csvseeder.core;

import io.github.yok.csvseeder.config.ConnectionConfig;
import io.github.yok.csvseeder.config.DbUnitConfigProperties;
import io.github.yok.csvseeder.config.PathsConfig;
import io.github.yok.csvseeder.config.SeedConfig;
import io.github.yok.csvseeder.config.SeedProperties;
import io.github.yok.csvseeder.db.DbUnitConfigFactory;
import io.github.yok.csvseeder.db.DbUnitTableWriter;
import io.github.yok.csvseeder.db.JdbcTableCatalog;
import io.github.yok.csvseeder.parser.CsvRowSourceProvider;
import io.github.yok.csvseeder.util.SeedReporter;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;

/**
 * Runs the configured seeds one after another against the configured database.
 *
 * <p>
 * Each seed gets its own JDBC connection in manual-commit mode. The connection is wrapped in a
 * DBUnit {@link DatabaseConnection} configured by {@link DbUnitConfigFactory}, and a
 * {@link SeedRunner} is run over it. The connection is closed when the seed ends, whatever its
 * outcome.
 * </p>
 *
 * <p>
 * A seed that fails does not stop the following ones; the caller inspects the returned
 * {@link RunResult}s. A connection that cannot be opened or prepared rejects the seed; an
 * unexpected failure while it runs aborts it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SeedExecutor {

    private final ConnectionConfig connectionConfig;
    private final PathsConfig pathsConfig;
    private final DbUnitConfigProperties dbUnitProps;
    private final SeedProperties seedProperties;
    private final SeedReporter reporter;

    /**
     * Creates an executor.
     *
     * @param connectionConfig JDBC connection settings
     * @param pathsConfig path settings used to locate CSV files
     * @param dbUnitProps DBUnit settings
     * @param seedProperties seed definitions
     * @param reporter receives user-facing messages
     */
    public SeedExecutor(ConnectionConfig connectionConfig, PathsConfig pathsConfig,
            DbUnitConfigProperties dbUnitProps, SeedProperties seedProperties,
            SeedReporter reporter) {
        this.connectionConfig = connectionConfig;
        this.pathsConfig = pathsConfig;
        this.dbUnitProps = dbUnitProps;
        this.seedProperties = seedProperties;
        this.reporter = reporter;
    }

    /**
     * Runs the selected seeds in configuration order.
     *
     * @param seedIds ids of the seeds to run; {@code null} or empty runs every seed
     * @return one result per selected seed
     */
    public List<RunResult> execute(List<String> seedIds) {
        List<SeedProperties.Seed> seeds = seedProperties.select(seedIds);
        log.info("=== SeedExecutor started (seeds={}) ===",
                seeds.stream().map(SeedProperties.Seed::label).toArray());

        List<RunResult> results = new ArrayList<>();
        for (SeedProperties.Seed seed : seeds) {
            results.add(executeSeed(seed));
        }

        long completed = results.stream().filter(RunResult::isCompleted).count();
        log.info("=== SeedExecutor finished ({} of {} seeds completed) ===", completed,
                results.size());
        return results;
    }

    /**
     * Runs one seed on its own connection.
     *
     * @param seed seed definition
     * @return outcome of the seed
     */
    private RunResult executeSeed(SeedProperties.Seed seed) {
        String label = seed.label();
        SeedConfig config;
        try {
            config = seed.toSeedConfig();
        } catch (IllegalArgumentException e) {
            return reject(seed.getTableName(), "Seed \"" + label + "\" is misconfigured: "
                    + e.getMessage());
        }

        log.info("[{}] Seeding {} into {}", label, config.getSource(),
                StringUtils.defaultIfBlank(config.getTableName(), "(file base name)"));
        RunResult result = null;
        try (Connection jdbc = openConnection()) {
            SeedRunner runner = createRunner(jdbc);
            result = run(label, runner, config);
        } catch (Exception e) {
            if (result != null) {
                log.warn("[{}] Connection could not be closed", label, e);
                return result;
            }
            log.error("[{}] Database connection failed", label, e);
            return reject(config.getTableName(), "Database connection for seed \"" + label
                    + "\" failed: " + ExceptionUtils.getRootCauseMessage(e));
        }
        return result;
    }

    /**
     * Prepares the connection and builds the runner over it.
     *
     * @param jdbc open JDBC connection
     * @return runner writing through DBUnit
     * @throws SQLException if the connection cannot be prepared
     * @throws DatabaseUnitException if the DBUnit connection cannot be created
     */
    private SeedRunner createRunner(Connection jdbc) throws SQLException, DatabaseUnitException {
        jdbc.setAutoCommit(false);
        String schema = StringUtils.defaultIfBlank(connectionConfig.getSchema(), jdbc.getSchema());

        DatabaseConnection dbConn = new DatabaseConnection(jdbc, schema);
        new DbUnitConfigFactory(dbUnitProps).configure(dbConn.getConfig());

        return new SeedRunner(new CsvRowSourceProvider(pathsConfig),
                new JdbcTableCatalog(jdbc, schema), new DbUnitTableWriter(dbConn), reporter);
    }

    /**
     * Runs the seed. An unexpected runtime failure ends it as aborted, since rows may already have
     * been written.
     *
     * @param label seed label for log messages
     * @param runner prepared runner
     * @param config run options
     * @return outcome of the seed
     */
    private RunResult run(String label, SeedRunner runner, SeedConfig config) {
        RunResult result;
        try {
            result = runner.run(config);
        } catch (RuntimeException e) {
            log.error("[{}] Seed failed", label, e);
            String message = "Seed \"" + label + "\" failed: "
                    + ExceptionUtils.getRootCauseMessage(e);
            reporter.emit(message, SeedReporter.Level.ERROR);
            return RunResult.aborted(config.getTableName(), 0, 0, 0, message, e);
        }
        log.info("[{}] Seed ended: {}", label, result.getStatus());
        return result;
    }

    private Connection openConnection() throws Exception {
        if (StringUtils.isNotBlank(connectionConfig.getDriverClass())) {
            Class.forName(connectionConfig.getDriverClass());
        }
        return DriverManager.getConnection(connectionConfig.getUrl(), connectionConfig.getUser(),
                connectionConfig.getPassword());
    }

    private RunResult reject(String tableName, String message) {
        reporter.emit(message, SeedReporter.Level.ERROR);
        return RunResult.rejected(tableName, message);
    }
}
