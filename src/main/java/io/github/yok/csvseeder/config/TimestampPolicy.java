package io.github.yok.csvseeder.config;

import java.util.Locale;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Describes how the creation and update timestamp columns are filled for every seeded row.
 *
 * <p>
 * Parsed from the {@code timestamps} option of a seed:
 * </p>
 * <ul>
 * <li>{@code true} (or unset): {@link Mode#CURRENT}, the current instant</li>
 * <li>{@code false}: {@link Mode#NULL}, an explicit SQL {@code NULL}</li>
 * <li>{@code none}: {@link Mode#NONE}, the columns are not touched</li>
 * <li>any other text, e.g. {@code 1970-01-01 00:00:00}: {@link Mode#FIXED}, that literal</li>
 * </ul>
 *
 * <p>
 * Values read from the CSV file always win over this policy.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TimestampPolicy {

    /**
     * Timestamp filling modes.
     */
    public enum Mode {
        CURRENT, NULL, FIXED, NONE
    }

    Mode mode;

    // Literal used in FIXED mode; null otherwise
    String fixedValue;

    /**
     * Stamps the current instant.
     *
     * @return policy
     */
    public static TimestampPolicy current() {
        return new TimestampPolicy(Mode.CURRENT, null);
    }

    /**
     * Stamps an explicit {@code NULL}.
     *
     * @return policy
     */
    public static TimestampPolicy nullValue() {
        return new TimestampPolicy(Mode.NULL, null);
    }

    /**
     * Leaves the timestamp columns alone.
     *
     * @return policy
     */
    public static TimestampPolicy none() {
        return new TimestampPolicy(Mode.NONE, null);
    }

    /**
     * Stamps a fixed literal.
     *
     * @param value literal handed to the database as is
     * @return policy
     */
    public static TimestampPolicy fixed(String value) {
        if (StringUtils.isBlank(value)) {
            throw new IllegalArgumentException("Fixed timestamp value must not be blank");
        }
        return new TimestampPolicy(Mode.FIXED, value);
    }

    /**
     * Parses the {@code timestamps} option.
     *
     * @param option option text; {@code null} or blank means {@code true}
     * @return policy
     */
    public static TimestampPolicy parse(String option) {
        String trimmed = StringUtils.trimToEmpty(option);
        switch (trimmed.toLowerCase(Locale.ROOT)) {
            case "":
            case "true":
                return current();
            case "false":
                return nullValue();
            case "none":
                return none();
            default:
                return fixed(trimmed);
        }
    }
}
