package io.github.yok.csvseeder.core;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Converts a CSV header (or a column mapping standing in for it) into {@link ColumnSpec column
 * specs}.
 *
 * <p>
 * For each header name, in order:
 * </p>
 * <ol>
 * <li>a name starting with the skip prefix is skipped;</li>
 * <li>a name found in the alias map is renamed to the alias;</li>
 * <li>any other name is used verbatim.</li>
 * </ol>
 *
 * @author Yasuharu.Okawauchi
 */
public final class HeaderResolver {

    static final String SINGLE_COLUMN_WARNING =
            "Found only one column in header, maybe a wrong delimiter for the CSV file was set";

    private HeaderResolver() {
        // Utility class; do not instantiate.
    }

    /**
     * Resolves the header.
     *
     * @param rawHeader header names in file order
     * @param aliases header name to table column name; {@code null} means none
     * @param skipPrefix prefix of header names to skip; {@code null} or empty disables skipping
     * @return resolved header
     * @throws IllegalArgumentException if {@code rawHeader} is {@code null} or empty
     */
    public static ResolvedHeader resolve(List<String> rawHeader, Map<String, String> aliases,
            String skipPrefix) {
        if (rawHeader == null || rawHeader.isEmpty()) {
            throw new IllegalArgumentException("No CSV headers were parsed");
        }

        ImmutableList.Builder<ColumnSpec> columns = ImmutableList.builder();
        for (int i = 0; i < rawHeader.size(); i++) {
            String name = StringUtils.defaultString(rawHeader.get(i));
            if (StringUtils.isNotEmpty(skipPrefix) && name.startsWith(skipPrefix)) {
                columns.add(ColumnSpec.skipped(i));
            } else if (aliases != null && aliases.containsKey(name)) {
                columns.add(ColumnSpec.of(i, aliases.get(name)));
            } else {
                columns.add(ColumnSpec.of(i, name));
            }
        }

        List<String> warnings = rawHeader.size() == 1 ? ImmutableList.of(SINGLE_COLUMN_WARNING)
                : ImmutableList.of();
        return new ResolvedHeader(columns.build(), warnings);
    }
}
