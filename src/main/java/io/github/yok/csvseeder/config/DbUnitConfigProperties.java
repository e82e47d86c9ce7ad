package io.github.yok.csvseeder.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Holds properties applied to DBUnit's {@code DatabaseConfig}.
 *
 * <p>
 * Specify the following properties in {@code application.yml}.
 * </p>
 * <ul>
 * <li>{@code dbunit.data-type-factory-mode}: database product used to cast CSV values</li>
 * <li>{@code dbunit.allow-empty-fields}: Whether empty fields are allowed</li>
 * <li>{@code dbunit.batched-statements}: Whether to use batched statement execution</li>
 * <li>{@code dbunit.batch-size}: JDBC batch size used inside one chunk insert</li>
 * <li>{@code dbunit.escape-identifiers}: Whether table and column names are quoted</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "dbunit")
@Getter
@Setter
@NoArgsConstructor
public class DbUnitConfigProperties {

    /**
     * Database product whose data type factory is used.
     */
    private DataTypeFactoryMode dataTypeFactoryMode = DataTypeFactoryMode.H2;

    /**
     * Specifies whether DBUnit permits empty fields (i.e., {@code ""}).
     */
    private boolean allowEmptyFields = true;

    /**
     * Specifies whether DBUnit's batched statement execution should be enabled.
     */
    private boolean batchedStatements = true;

    /**
     * Specifies the number of statements to execute per JDBC batch when batching is enabled.
     */
    private int batchSize = 100;

    /**
     * Specifies whether identifiers are quoted with double quotes in generated SQL.
     */
    private boolean escapeIdentifiers = true;
}
