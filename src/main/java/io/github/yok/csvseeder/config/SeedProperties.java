package io.github.yok.csvseeder.config;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.Data;
import org.apache.commons.codec.digest.MessageDigestAlgorithms;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code seeder} section in {@code application.yml}.
 *
 * <pre>
 * seeder:
 *   seeds:
 *     - id: users
 *       source: users.csv
 *       table-name: users
 *       delimiter: ";"
 *       aliases:
 *         "[mail]": email
 *       hash-fields: [password]
 *       defaults:
 *         created_by: seed
 *       timestamps: "true"
 *       chunk-size: 100
 * </pre>
 *
 * <p>
 * Header names that contain characters other than letters, digits and {@code -} must be written
 * in brackets as map keys (e.g. {@code "[#temp]"}), otherwise Spring Boot drops those characters.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "seeder")
@Data
public class SeedProperties {

    /**
     * Seed definitions, run in the listed order.
     */
    private List<Seed> seeds = new ArrayList<>();

    /**
     * One seed definition.
     */
    @Data
    public static class Seed {
        // Identifier used by --seed
        private String id;
        // CSV file, relative to data-path or absolute
        private String source;
        // Target table; defaults to the base name of the source file
        private String tableName;
        private boolean truncate = true;
        private boolean hasHeader = true;
        private String delimiter = ";";
        private List<String> columnMapping = new ArrayList<>();
        private Map<String, String> aliases = new LinkedHashMap<>();
        private List<String> hashFields = new ArrayList<>(List.of("password"));
        private String hashAlgorithm = MessageDigestAlgorithms.SHA_256;
        private Map<String, String> defaults = new LinkedHashMap<>();
        private String skipPrefix = "%";
        // true / false / none / fixed literal
        private String timestamps = "true";
        private String createdAtColumn = "created_at";
        private String updatedAtColumn = "updated_at";
        private int rowOffset = 0;
        private int chunkSize = 50;
        private boolean emptyAsNull = true;
        private String encoding = "UTF-8";

        /**
         * Returns the identifier shown in logs; falls back to the source.
         *
         * @return seed label
         */
        public String label() {
            return StringUtils.defaultIfBlank(id, source);
        }

        /**
         * Validates the bound values and converts them into an immutable {@link SeedConfig}.
         *
         * @return run options
         * @throws IllegalArgumentException if an option value is invalid
         */
        public SeedConfig toSeedConfig() {
            if (delimiter == null || delimiter.length() != 1) {
                throw new IllegalArgumentException(
                        "delimiter must be exactly one character: '" + delimiter + "'");
            }
            if (chunkSize < 1) {
                throw new IllegalArgumentException("chunk-size must be 1 or greater: " + chunkSize);
            }
            if (rowOffset < 0) {
                throw new IllegalArgumentException("row-offset must not be negative: " + rowOffset);
            }
            Charset charset;
            try {
                charset = Charset.forName(encoding);
            } catch (RuntimeException e) {
                throw new IllegalArgumentException("Unsupported encoding: " + encoding, e);
            }

            Map<String, Object> defaultValues = new LinkedHashMap<>();
            if (defaults != null) {
                defaultValues.putAll(defaults);
            }

            return SeedConfig.builder().source(source).tableName(tableName).truncate(truncate)
                    .hasHeader(hasHeader).delimiter(delimiter.charAt(0))
                    .columnMapping(columnMapping == null ? ImmutableList.of()
                            : ImmutableList.copyOf(columnMapping))
                    .aliases(aliases == null ? ImmutableMap.of() : ImmutableMap.copyOf(aliases))
                    .hashFields(hashFields == null ? ImmutableSet.of()
                            : hashFields.stream().filter(Objects::nonNull)
                                    .collect(ImmutableSet.toImmutableSet()))
                    .hashAlgorithm(hashAlgorithm)
                    .defaults(Collections.unmodifiableMap(defaultValues))
                    .skipPrefix(skipPrefix).timestamps(TimestampPolicy.parse(timestamps))
                    .createdAtColumn(createdAtColumn).updatedAtColumn(updatedAtColumn)
                    .rowOffset(rowOffset).chunkSize(chunkSize).emptyAsNull(emptyAsNull)
                    .encoding(charset).build();
        }
    }

    /**
     * Returns the seeds whose id is listed, in configuration order.
     *
     * @param ids seed ids; {@code null} or empty selects every seed
     * @return selected seeds
     */
    public List<Seed> select(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.copyOf(seeds);
        }
        return seeds.stream().filter(s -> ids.contains(s.getId())).collect(Collectors.toList());
    }
}
