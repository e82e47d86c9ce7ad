package io.github.yok.csvseeder.config;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.codec.digest.MessageDigestAlgorithms;

/**
 * Immutable options of one seed run: one source file into one table.
 *
 * <p>
 * Every option has a default, so a run only needs {@code source}:
 * </p>
 *
 * <pre>
 * SeedConfig config = SeedConfig.builder().source("users.csv").chunkSize(100).build();
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 * @see SeedProperties
 */
@Value
@Builder(toBuilder = true)
public class SeedConfig {

    // Source identifier, resolved by the row source provider
    String source;

    // Target table; blank means the base name of the source file
    String tableName;

    // Delete every row of the table before the first insert
    @Builder.Default
    boolean truncate = true;

    // Consume the first row of the file as the header
    @Builder.Default
    boolean hasHeader = true;

    @Builder.Default
    char delimiter = ';';

    // Column names that replace (or stand in for) the file header, by position
    @Builder.Default
    List<String> columnMapping = ImmutableList.of();

    // Header name -> table column name
    @Builder.Default
    Map<String, String> aliases = ImmutableMap.of();

    // Table columns whose value is replaced by its digest
    @Builder.Default
    Set<String> hashFields = ImmutableSet.of("password");

    // java.security.MessageDigest algorithm name used for hashing
    @Builder.Default
    String hashAlgorithm = MessageDigestAlgorithms.SHA_256;

    // Table column -> value used when the row supplies none
    @Builder.Default
    Map<String, Object> defaults = ImmutableMap.of();

    // Header names starting with this prefix are not inserted; blank disables skipping
    @Builder.Default
    String skipPrefix = "%";

    @Builder.Default
    TimestampPolicy timestamps = TimestampPolicy.current();

    @Builder.Default
    String createdAtColumn = "created_at";

    @Builder.Default
    String updatedAtColumn = "updated_at";

    // Leading non-empty data rows to discard
    @Builder.Default
    int rowOffset = 0;

    // Records per insert call
    @Builder.Default
    int chunkSize = 50;

    // Empty fields and the literal NULL become SQL NULL
    @Builder.Default
    boolean emptyAsNull = true;

    @Builder.Default
    Charset encoding = StandardCharsets.UTF_8;
}
