package io.github.yok.csvseeder.integration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.csvseeder.config.SeedProperties;
import io.github.yok.csvseeder.core.BatchInsertException;
import io.github.yok.csvseeder.core.RunResult;
import io.github.yok.csvseeder.util.SeedReporter;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Integration tests for CsvSeeder against an in-memory H2 database.
 *
 * <p>
 * Covers: SeedExecutor / SeedRunner / CsvRowSourceProvider / DbUnitTableWriter.
 * </p>
 */
public class H2IntegrationTest {

    @TempDir
    public Path tempDir;

    private final List<String> messages = new ArrayList<>();
    private final SeedReporter reporter = (message, level) -> messages.add(level + " " + message);

    @BeforeEach
    public void setup() throws Exception {
        H2IntegrationSupport.migrate();
        H2IntegrationSupport.copyFixtures(tempDir);
    }

    private static SeedProperties.Seed usersSeed() {
        SeedProperties.Seed seed = new SeedProperties.Seed();
        seed.setId("users");
        seed.setSource("users.csv");
        seed.setAliases(Map.of("mail", "email"));
        seed.setDefaults(Map.of("role", "member"));
        return seed;
    }

    private static SeedProperties.Seed productsSeed(String source) {
        SeedProperties.Seed seed = new SeedProperties.Seed();
        seed.setId("products");
        seed.setSource(source);
        seed.setTableName("products");
        seed.setDelimiter(",");
        seed.setTimestamps("none");
        seed.setChunkSize(2);
        return seed;
    }

    private static SeedProperties seeds(SeedProperties.Seed... seeds) {
        SeedProperties props = new SeedProperties();
        props.setSeeds(new ArrayList<>(List.of(seeds)));
        return props;
    }

    private static int count(String table) throws Exception {
        try (Connection conn = H2IntegrationSupport.openConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
            assertTrue(rs.next(), "COUNT(*) の結果が取得できません: " + table);
            return rs.getInt(1);
        }
    }

    @Test
    public void execute_正常ケース_BOM付きのユーザーCSVを投入する_変換済みの全行が登録されること()
            throws Exception {
        List<RunResult> results =
                H2IntegrationSupport.executor(tempDir, seeds(usersSeed()), reporter).execute(null);

        RunResult result = results.get(0);
        assertTrue(result.isCompleted());
        assertEquals(3, result.getTotalRows());
        assertEquals(3, result.getInsertedRows());
        assertEquals(List.of("INFO 3 of 3 rows have been seeded in table \"USERS\""), messages);

        try (Connection conn = H2IntegrationSupport.openConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT * FROM users ORDER BY id")) {
            assertTrue(rs.next());
            assertEquals("Alice", rs.getString("name"));
            assertEquals("alice@example.com", rs.getString("email"));
            assertEquals(DigestUtils.sha256Hex("secret"), rs.getString("password"));
            assertEquals("member", rs.getString("role"));
            assertNotNull(rs.getTimestamp("created_at"));
            assertNotNull(rs.getTimestamp("updated_at"));

            assertTrue(rs.next());
            assertEquals("Bob", rs.getString("name"));
            assertEquals(Timestamp.valueOf("2020-01-01 00:00:00"), rs.getTimestamp("created_at"));

            assertTrue(rs.next());
            assertEquals("Carol", rs.getString("name"));
            assertNull(rs.getString("email"));
        }
    }

    @Test
    public void execute_正常ケース_truncate有効で2回投入する_行数が変わらないこと() throws Exception {
        H2IntegrationSupport.executor(tempDir, seeds(usersSeed()), reporter).execute(null);
        int first = count("users");
        H2IntegrationSupport.executor(tempDir, seeds(usersSeed()), reporter).execute(null);

        assertEquals(3, first);
        assertEquals(first, count("users"));
    }

    @Test
    public void execute_正常ケース_チャンクサイズ2で5行を投入する_全行が登録されること() throws Exception {
        List<RunResult> results = H2IntegrationSupport
                .executor(tempDir, seeds(productsSeed("products.csv")), reporter).execute(null);

        assertTrue(results.get(0).isCompleted());
        assertEquals(5, count("products"));
        try (Connection conn = H2IntegrationSupport.openConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT price FROM products WHERE id = 4")) {
            assertTrue(rs.next());
            assertEquals(0, new BigDecimal("0.80").compareTo(rs.getBigDecimal(1)));
        }
    }

    @Test
    public void execute_異常ケース_2番目のチャンクで主キーが重複する_1番目のチャンクだけ残り中断されること()
            throws Exception {
        List<RunResult> results = H2IntegrationSupport
                .executor(tempDir, seeds(productsSeed("products_dup.csv")), reporter)
                .execute(null);

        RunResult result = results.get(0);
        assertEquals(RunResult.Status.ABORTED, result.getStatus());
        assertEquals(2, result.getInsertedRows());
        assertInstanceOf(BatchInsertException.class, result.getFailure());
        assertEquals(2, count("products"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("ERROR Rows of the file \"products_dup.csv\""));
    }

    @Test
    public void execute_異常ケース_存在しないテーブルを指定する_拒否され既存データが変更されないこと()
            throws Exception {
        H2IntegrationSupport.executor(tempDir, seeds(usersSeed()), reporter).execute(null);
        messages.clear();
        SeedProperties.Seed seed = usersSeed();
        seed.setTableName("members");

        List<RunResult> results =
                H2IntegrationSupport.executor(tempDir, seeds(seed), reporter).execute(null);

        assertEquals(RunResult.Status.REJECTED, results.get(0).getStatus());
        assertEquals(List.of("ERROR Table \"members\" could not be found in database"), messages);
        assertEquals(3, count("users"));
    }
}
