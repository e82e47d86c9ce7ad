package io.github.yok.csvseeder.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that reads the {@code data-path} property from the application root
 * configuration and resolves seed source files against it.
 *
 * <p>
 * Relative source identifiers such as {@code users.csv} are resolved under {@code data-path}.
 * Absolute identifiers are used as they are. When {@code data-path} is not configured, relative
 * identifiers are resolved against the working directory.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties
@Data
public class PathsConfig {

    // Base directory that holds the CSV files to seed
    private String dataPath;

    /**
     * Resolves a source identifier to a file path.
     *
     * @param source source identifier from the seed definition
     * @return resolved path
     * @throws IllegalArgumentException if {@code source} is blank
     */
    public Path resolve(String source) {
        if (StringUtils.isBlank(source)) {
            throw new IllegalArgumentException("source must not be blank");
        }
        Path path = Paths.get(source);
        if (path.isAbsolute() || StringUtils.isBlank(dataPath)) {
            return path;
        }
        return Paths.get(dataPath).resolve(path);
    }
}
