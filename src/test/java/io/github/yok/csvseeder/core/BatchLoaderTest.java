package io.github.yok.csvseeder.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import io.github.yok.csvseeder.db.TableWriter;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class BatchLoaderTest {

    /**
     * Writer that keeps every chunk it receives.
     */
    private static class RecordingWriter implements TableWriter {
        private int truncates;
        private final List<List<Map<String, Object>>> chunks = new ArrayList<>();

        @Override
        public void truncate(String tableName) {
            truncates++;
        }

        @Override
        public void insertMany(String tableName, List<Map<String, Object>> records) {
            chunks.add(records);
        }
    }

    private static Map<String, Object> record(int id) {
        return Map.of("id", String.valueOf(id));
    }

    @ParameterizedTest
    @CsvSource({"0,3,0", "1,3,1", "3,3,1", "4,3,2", "7,3,3", "5,1,5", "120,50,3"})
    void append_正常ケース_N件をチャンクサイズkで投入する_ceil件の挿入呼び出しになること(int n, int k,
            int expectedCalls) throws Exception {
        RecordingWriter writer = new RecordingWriter();
        BatchLoader loader = new BatchLoader(writer, "users", k);

        loader.beginRun(false);
        for (int i = 0; i < n; i++) {
            loader.append(record(i));
        }
        loader.endRun();

        assertEquals(expectedCalls, writer.chunks.size());
        assertEquals(expectedCalls, loader.getInsertCalls());
        assertEquals(n, loader.getFlushedRecords());
        assertEquals(0, loader.getBufferedRecords());
        assertEquals(n, writer.chunks.stream().mapToInt(List::size).sum());
        writer.chunks.forEach(c -> assertTrue(c.size() <= k));
    }

    @Test
    void append_正常ケース_チャンクサイズ未満で止める_endRunまで挿入されないこと() throws Exception {
        RecordingWriter writer = new RecordingWriter();
        BatchLoader loader = new BatchLoader(writer, "users", 3);
        loader.beginRun(false);

        loader.append(record(1));
        loader.append(record(2));

        assertEquals(0, writer.chunks.size());
        assertEquals(2, loader.getBufferedRecords());
        loader.endRun();
        assertEquals(List.of(List.of(record(1), record(2))), writer.chunks);
    }

    @Test
    void beginRun_正常ケース_truncate有効を指定する_1回だけtruncateされること() throws Exception {
        RecordingWriter writer = new RecordingWriter();
        BatchLoader loader = new BatchLoader(writer, "users", 2);

        loader.beginRun(true);
        for (int i = 0; i < 5; i++) {
            loader.append(record(i));
        }
        loader.endRun();

        assertEquals(1, writer.truncates);
    }

    @Test
    void beginRun_正常ケース_truncate無効を指定する_truncateされないこと() throws Exception {
        TableWriter writer = mock(TableWriter.class);
        BatchLoader loader = new BatchLoader(writer, "users", 2);

        loader.beginRun(false);
        loader.endRun();

        verify(writer, never()).truncate(anyString());
        verify(writer, never()).insertMany(anyString(), anyList());
    }

    @Test
    void beginRun_異常ケース_truncateが失敗する_BatchInsertExceptionが送出されること() throws Exception {
        TableWriter writer = mock(TableWriter.class);
        SQLException cause = new SQLException("locked");
        doThrow(cause).when(writer).truncate("users");
        BatchLoader loader = new BatchLoader(writer, "users", 2);

        BatchInsertException ex =
                assertThrows(BatchInsertException.class, () -> loader.beginRun(true));
        assertSame(cause, ex.getCause());
    }

    @Test
    void beginRun_異常ケース_2回呼び出す_IllegalStateExceptionが送出されること() throws Exception {
        BatchLoader loader = new BatchLoader(mock(TableWriter.class), "users", 2);
        loader.beginRun(false);

        assertThrows(IllegalStateException.class, () -> loader.beginRun(false));
    }

    @Test
    void append_異常ケース_beginRun前に呼び出す_IllegalStateExceptionが送出されること() {
        BatchLoader loader = new BatchLoader(mock(TableWriter.class), "users", 2);

        assertThrows(IllegalStateException.class, () -> loader.append(record(1)));
    }

    @Test
    void コンストラクタ_異常ケース_チャンクサイズ0を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> new BatchLoader(mock(TableWriter.class), "users", 0));
    }

    @Test
    void append_異常ケース_2番目のチャンクが失敗する_バッファが破棄され後続が挿入されないこと()
            throws Exception {
        TableWriter writer = mock(TableWriter.class);
        List<Map<String, Object>> second = List.of(record(3), record(4));
        SQLException cause = new SQLException("duplicate key");
        doThrow(cause).when(writer).insertMany(eq("users"), eq(second));
        BatchLoader loader = new BatchLoader(writer, "users", 2);
        loader.beginRun(false);

        loader.append(record(1));
        loader.append(record(2));
        loader.append(record(3));
        BatchInsertException ex =
                assertThrows(BatchInsertException.class, () -> loader.append(record(4)));

        assertSame(cause, ex.getCause());
        assertEquals("Failed to insert chunk #2 (2 rows) into table \"users\"", ex.getMessage());
        assertEquals(2, loader.getFlushedRecords());
        assertEquals(0, loader.getBufferedRecords());
        verify(writer, times(2)).insertMany(eq("users"), anyList());
    }

    @Test
    void flush_正常ケース_空のバッファで呼び出す_挿入されないこと() throws Exception {
        TableWriter writer = mock(TableWriter.class);
        BatchLoader loader = new BatchLoader(writer, "users", 2);
        loader.beginRun(false);

        loader.flush();

        verify(writer, never()).insertMany(anyString(), anyList());
        assertEquals(0, loader.getInsertCalls());
    }
}
