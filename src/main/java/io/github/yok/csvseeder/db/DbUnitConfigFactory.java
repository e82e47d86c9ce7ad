package io.github.yok.csvseeder.db;

import io.github.yok.csvseeder.config.DataTypeFactoryMode;
import io.github.yok.csvseeder.config.DbUnitConfigProperties;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.dataset.datatype.IDataTypeFactory;

/**
 * Factory class that centrally applies application-wide settings to DBUnit's
 * {@link DatabaseConfig}.
 *
 * <p>
 * Bundles the data type factory, identifier escaping, table types, empty field handling, batched
 * statement execution and batch size, so callers only have to invoke
 * {@link #configure(DatabaseConfig)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DbUnitConfigFactory {

    // H2 2.x reports plain tables as "BASE TABLE"; the others as "TABLE"
    static final String[] TABLE_TYPES = {"TABLE", "BASE TABLE"};

    // Properties class that externalizes DBUnit settings
    private final DbUnitConfigProperties props;

    /**
     * Creates a factory with default settings.
     */
    public DbUnitConfigFactory() {
        this(new DbUnitConfigProperties());
    }

    /**
     * Creates a factory with the given settings.
     *
     * @param props DBUnit settings
     */
    public DbUnitConfigFactory(DbUnitConfigProperties props) {
        this.props = props;
    }

    /**
     * Applies application-wide settings to the specified {@link DatabaseConfig}.
     *
     * @param cfg DBUnit {@link DatabaseConfig} object
     */
    public void configure(DatabaseConfig cfg) {
        DataTypeFactoryMode mode = props.getDataTypeFactoryMode() == null ? DataTypeFactoryMode.H2
                : props.getDataTypeFactoryMode();

        // 1) Set the data type factory
        IDataTypeFactory dataTypeFactory = mode.createDataTypeFactory();
        cfg.setProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY, dataTypeFactory);
        log.debug("DBUnit: DataTypeFactory set to {}", dataTypeFactory.getClass().getSimpleName());

        // 2) Escape identifiers (MySQL uses back quotes)
        if (props.isEscapeIdentifiers()) {
            String pattern = mode == DataTypeFactoryMode.MYSQL ? "`?`" : "\"?\"";
            cfg.setProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN, pattern);
            log.debug("DBUnit: escape pattern = {}", pattern);
        }

        // 3) Table types listed in the metadata lookup
        cfg.setProperty(DatabaseConfig.PROPERTY_TABLE_TYPE, TABLE_TYPES);

        // 4) Configure whether to allow empty fields ("")
        cfg.setProperty(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS, props.isAllowEmptyFields());
        log.debug("DBUnit: allow empty fields = {}", props.isAllowEmptyFields());

        // 5) Configure whether to enable batched statements execution
        cfg.setProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS, props.isBatchedStatements());
        log.debug("DBUnit: batched statements enabled = {}", props.isBatchedStatements());

        // 6) Configure batch size
        cfg.setProperty(DatabaseConfig.PROPERTY_BATCH_SIZE, props.getBatchSize());
        log.debug("DBUnit: batch size = {}", props.getBatchSize());
    }
}
