package io.github.yok.csvseeder.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that holds the JDBC connection of the database being seeded.
 *
 * <pre>
 * connection:
 *   url: jdbc:h2:file:./data/devdb
 *   user: sa
 *   password: ""
 *   driver-class: org.h2.Driver
 *   schema: PUBLIC
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "connection")
@Data
public class ConnectionConfig {

    // JDBC connection URL (e.g., jdbc:postgresql://localhost:5432/devdb)
    private String url;
    // Database user name
    private String user;
    // Database password
    private String password;
    // Fully qualified JDBC driver class name; blank relies on JDBC 4 auto-loading
    private String driverClass;
    // Schema holding the seeded tables; blank uses the connection's current schema
    private String schema;
}
