package io.github.yok.csvseeder.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SeedPropertiesTest {

    private static SeedProperties.Seed seed(String id, String source) {
        SeedProperties.Seed seed = new SeedProperties.Seed();
        seed.setId(id);
        seed.setSource(source);
        return seed;
    }

    @Test
    void toSeedConfig_正常ケース_デフォルト値のまま変換する_既定のオプションが返ること() {
        SeedConfig config = seed("users", "users.csv").toSeedConfig();

        assertEquals("users.csv", config.getSource());
        assertNull(config.getTableName());
        assertTrue(config.isTruncate());
        assertTrue(config.isHasHeader());
        assertEquals(';', config.getDelimiter());
        assertTrue(config.getColumnMapping().isEmpty());
        assertTrue(config.getAliases().isEmpty());
        assertEquals(Set.of("password"), config.getHashFields());
        assertEquals("SHA-256", config.getHashAlgorithm());
        assertTrue(config.getDefaults().isEmpty());
        assertEquals("%", config.getSkipPrefix());
        assertEquals(TimestampPolicy.current(), config.getTimestamps());
        assertEquals("created_at", config.getCreatedAtColumn());
        assertEquals("updated_at", config.getUpdatedAtColumn());
        assertEquals(0, config.getRowOffset());
        assertEquals(50, config.getChunkSize());
        assertTrue(config.isEmptyAsNull());
        assertEquals(StandardCharsets.UTF_8, config.getEncoding());
    }

    @Test
    void toSeedConfig_正常ケース_全オプションを設定する_設定値が反映されること() {
        SeedProperties.Seed seed = seed("users", "users.csv");
        seed.setTableName("members");
        seed.setTruncate(false);
        seed.setHasHeader(false);
        seed.setDelimiter(",");
        seed.setColumnMapping(new ArrayList<>(List.of("id", "name")));
        Map<String, String> aliases = new LinkedHashMap<>();
        aliases.put("mail", "email");
        seed.setAliases(aliases);
        seed.setHashFields(new ArrayList<>(Arrays.asList("secret", null)));
        seed.setHashAlgorithm("SHA-1");
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put("role", "member");
        seed.setDefaults(defaults);
        seed.setSkipPrefix("#");
        seed.setTimestamps("none");
        seed.setCreatedAtColumn("inserted");
        seed.setUpdatedAtColumn("modified");
        seed.setRowOffset(2);
        seed.setChunkSize(10);
        seed.setEmptyAsNull(false);
        seed.setEncoding("ISO-8859-1");

        SeedConfig config = seed.toSeedConfig();

        assertEquals("members", config.getTableName());
        assertFalse(config.isTruncate());
        assertFalse(config.isHasHeader());
        assertEquals(',', config.getDelimiter());
        assertEquals(List.of("id", "name"), config.getColumnMapping());
        assertEquals(Map.of("mail", "email"), config.getAliases());
        assertEquals(Set.of("secret"), config.getHashFields());
        assertEquals("SHA-1", config.getHashAlgorithm());
        assertEquals(Map.of("role", "member"), config.getDefaults());
        assertEquals("#", config.getSkipPrefix());
        assertEquals(TimestampPolicy.none(), config.getTimestamps());
        assertEquals("inserted", config.getCreatedAtColumn());
        assertEquals("modified", config.getUpdatedAtColumn());
        assertEquals(2, config.getRowOffset());
        assertEquals(10, config.getChunkSize());
        assertFalse(config.isEmptyAsNull());
        assertEquals(StandardCharsets.ISO_8859_1, config.getEncoding());
    }

    @Test
    void toSeedConfig_正常ケース_変換後に元の設定を変更する_変換結果は影響を受けないこと() {
        SeedProperties.Seed seed = seed("users", "users.csv");
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put("role", "member");
        seed.setDefaults(defaults);

        SeedConfig config = seed.toSeedConfig();
        defaults.put("role", "admin");
        seed.getHashFields().add("token");

        assertEquals("member", config.getDefaults().get("role"));
        assertEquals(Set.of("password"), config.getHashFields());
        assertThrows(UnsupportedOperationException.class,
                () -> config.getDefaults().put("x", "y"));
    }

    @Test
    void toSeedConfig_異常ケース_区切り文字が2文字を指定する_IllegalArgumentExceptionが送出されること() {
        SeedProperties.Seed seed = seed("users", "users.csv");
        seed.setDelimiter(";;");

        IllegalArgumentException ex =
                assertThrows(IllegalArgumentException.class, seed::toSeedConfig);
        assertTrue(ex.getMessage().contains("delimiter"));
    }

    @Test
    void toSeedConfig_異常ケース_chunkSizeが0を指定する_IllegalArgumentExceptionが送出されること() {
        SeedProperties.Seed seed = seed("users", "users.csv");
        seed.setChunkSize(0);

        assertThrows(IllegalArgumentException.class, seed::toSeedConfig);
    }

    @Test
    void toSeedConfig_異常ケース_rowOffsetが負数を指定する_IllegalArgumentExceptionが送出されること() {
        SeedProperties.Seed seed = seed("users", "users.csv");
        seed.setRowOffset(-1);

        assertThrows(IllegalArgumentException.class, seed::toSeedConfig);
    }

    @Test
    void toSeedConfig_異常ケース_未知のエンコーディングを指定する_IllegalArgumentExceptionが送出されること() {
        SeedProperties.Seed seed = seed("users", "users.csv");
        seed.setEncoding("no-such-charset");

        IllegalArgumentException ex =
                assertThrows(IllegalArgumentException.class, seed::toSeedConfig);
        assertEquals("Unsupported encoding: no-such-charset", ex.getMessage());
    }

    @Test
    void label_正常ケース_id未設定を指定する_sourceが返ること() {
        assertEquals("users", seed("users", "users.csv").label());
        assertEquals("users.csv", seed(null, "users.csv").label());
    }

    @Test
    void select_正常ケース_id指定ありとなしを指定する_対象のシードが設定順で返ること() {
        SeedProperties props = new SeedProperties();
        props.setSeeds(new ArrayList<>(List.of(seed("a", "a.csv"), seed("b", "b.csv"),
                seed("c", "c.csv"))));

        assertEquals(3, props.select(null).size());
        assertEquals(3, props.select(List.of()).size());

        List<SeedProperties.Seed> selected = props.select(List.of("c", "a", "x"));
        assertEquals(2, selected.size());
        assertEquals("a", selected.get(0).getId());
        assertEquals("c", selected.get(1).getId());
    }
}
