package com.tablesearch.rowstore;

import com.tablesearch.config.Constants;
import com.tablesearch.storage.CorruptStorageException;
import com.tablesearch.storage.IndexNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 行存储写入与四种读取策略。
 */
class RowStoreTest {

    private static final RowSchema SCHEMA = RowSchema.parse("id:i,score:f,ratio:d,title:str,body:str");

    @TempDir
    Path tempDir;

    private List<Row> rows;

    @BeforeEach
    void setUp() {
        Random random = new Random(3);
        rows = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            rows.add(Row.of(
                "id", i * 7 - 100,
                "score", specialFloat(i, random.nextFloat() * 100),
                "ratio", specialDouble(i, random.nextDouble()),
                "title", "title " + i + (i % 5 == 0 ? " 标题" : ""),
                "body", "body text ".repeat(i % 4) + i));
        }
    }

    private static float specialFloat(int i, float fallback) {
        switch (i) {
            case 0: return Float.NEGATIVE_INFINITY;
            case 5: return Float.NaN;
            case 17: return -0.0f;
            case 22: return Float.POSITIVE_INFINITY;
            default: return fallback;
        }
    }

    private static double specialDouble(int i, double fallback) {
        switch (i) {
            case 1: return Double.NaN;
            case 17: return -0.0d;
            case 38: return Double.MIN_VALUE;
            case 39: return Double.NEGATIVE_INFINITY;
            default: return fallback;
        }
    }

    @ParameterizedTest
    @EnumSource(ReadStrategy.class)
    @DisplayName("各读取策略按请求顺序返回相同的行，含 NaN、无穷与 -0.0")
    void testRoundTripAllStrategies(ReadStrategy strategy) throws IOException {
        Path binPath = tempDir.resolve("rows.bin");
        new RowStoreWriter(binPath, SCHEMA, true).serialize(rows);

        RowStore store = RowStore.open(binPath);
        int[] rowNumbers = {39, 0, 17, 17, 5, 22, 1, 38};
        List<Row> read = store.readRows(rowNumbers, strategy, 3);

        assertEquals(rowNumbers.length, read.size());
        for (int i = 0; i < rowNumbers.length; i++) {
            assertEquals(new Row(SCHEMA.conform(rows.get(rowNumbers[i]))), read.get(i), "strategy=" + strategy);
        }
        assertEquals(read, store.readRows(rowNumbers, ReadStrategy.SEQUENTIAL));
        assertEquals(Float.floatToRawIntBits(-0.0f), Float.floatToRawIntBits((Float) read.get(2).get("score")));
        assertTrue(Float.isNaN((Float) read.get(4).get("score")));
        assertEquals(Double.NEGATIVE_INFINITY, read.get(0).get("ratio"));
    }

    @Test
    @DisplayName("整数与 float32 精确还原，字符串经压缩后还原")
    void testValueFidelity() throws IOException {
        Path binPath = tempDir.resolve("rows.bin");
        RowSchema schema = RowSchema.parse("n:i,x:f,text:str");
        List<Row> input = List.of(
            Row.of("n", Integer.MIN_VALUE, "x", 0.1f, "text", "hello world hello world hello world"),
            Row.of("n", Integer.MAX_VALUE, "x", -3.4028235e38f, "text", ""),
            Row.of("n", 0, "x", Float.MIN_VALUE, "text", "naïve 中文"));
        new RowStoreWriter(binPath, schema, true).serialize(input);

        RowStore store = RowStore.open(binPath);
        List<Row> read = store.readRows(new int[]{0, 1, 2});
        assertEquals(Integer.MIN_VALUE, read.get(0).get("n"));
        assertEquals(0.1f, read.get(0).get("x"));
        assertEquals("hello world hello world hello world", read.get(0).get("text"));
        assertEquals("", read.get(1).get("text"));
        assertEquals(Float.MIN_VALUE, read.get(2).get("x"));
        assertEquals("naïve 中文", read.get(2).get("text"));
    }

    @Test
    @DisplayName("不压缩时字符串以原始 UTF-8 存储")
    void testUncompressedLayout() throws IOException {
        Path binPath = tempDir.resolve("rows.bin");
        RowSchema schema = RowSchema.parse("n:h,text:str");
        new RowStoreWriter(binPath, schema, false).serialize(List.of(Row.of("n", 258, "text", "ab")));

        byte[] bytes = Files.readAllBytes(binPath);
        // 定长区 int16 小端，随后 4 字节小端长度与原始字节
        assertEquals(List.of((byte) 2, (byte) 1, (byte) 2, (byte) 0, (byte) 0, (byte) 0, (byte) 'a', (byte) 'b'),
            toList(bytes));
        assertEquals("0", Files.readString(RowStore.indexPathFor(binPath), StandardCharsets.UTF_8).trim());
        assertFalse(RowStore.open(binPath).manifest().compress());
    }

    @Test
    @DisplayName("偏移索引每行一个十进制偏移，行数与输入一致")
    void testOffsetIndex() throws IOException {
        Path binPath = tempDir.resolve("rows.bin");
        new RowStoreWriter(binPath, SCHEMA, true).serialize(rows);

        List<String> lines = Files.readAllLines(RowStore.indexPathFor(binPath));
        assertEquals(rows.size(), lines.size());
        assertEquals("0", lines.get(0));
        for (int i = 1; i < lines.size(); i++) {
            assertTrue(Long.parseLong(lines.get(i)) > Long.parseLong(lines.get(i - 1)));
        }
        RowStore store = RowStore.open(binPath);
        assertEquals(rows.size(), store.rowCount());
        assertEquals(SCHEMA, store.schema());
    }

    @Test
    @DisplayName("缺列的行在写入任何字节前被拒绝")
    void testSchemaViolationBeforeWrite() {
        Path binPath = tempDir.resolve("out").resolve("rows.bin");
        List<Row> invalid = new ArrayList<>(rows);
        invalid.add(Row.of("id", 1, "score", 1.0f, "ratio", 0.5d, "title", "no body"));

        SchemaViolationException exception = assertThrows(SchemaViolationException.class,
            () -> new RowStoreWriter(binPath, SCHEMA, true).serialize(invalid));
        assertEquals("body", exception.getColumn());
        assertFalse(Files.exists(binPath));
        assertFalse(Files.exists(tempDir.resolve("out")));
    }

    @Test
    @DisplayName("行号越界抛出 IndexOutOfBoundsException")
    void testOutOfRange() throws IOException {
        Path binPath = tempDir.resolve("rows.bin");
        RowStore store = new RowStoreWriter(binPath, SCHEMA, true).serialize(rows);

        assertThrows(IndexOutOfBoundsException.class, () -> store.readRows(new int[]{0, 40}));
        assertThrows(IndexOutOfBoundsException.class, () -> store.readRows(new int[]{-1}, ReadStrategy.THREAD_POOL));
        assertTrue(store.readRows(new int[0], ReadStrategy.PROCESS_POOL).isEmpty());
    }

    @Test
    @DisplayName("数据文件或清单缺失时抛出 IndexNotFoundException")
    void testOpenMissing() throws IOException {
        Path binPath = tempDir.resolve("rows.bin");
        assertThrows(IndexNotFoundException.class, () -> RowStore.open(binPath));

        new RowStoreWriter(binPath, SCHEMA, true).serialize(rows);
        Files.delete(RowStore.manifestPathFor(binPath));
        assertThrows(IndexNotFoundException.class, () -> RowStore.open(binPath));
    }

    @Test
    @DisplayName("数据文件被截断或长度前缀越界时抛出 CorruptStorageException")
    void testCorruptData() throws IOException {
        Path binPath = tempDir.resolve("rows.bin");
        RowSchema schema = RowSchema.parse("n:i,text:str");
        new RowStoreWriter(binPath, schema, false).serialize(List.of(Row.of("n", 1, "text", "abc")));

        try (RandomAccessFile file = new RandomAccessFile(binPath.toFile(), "rw")) {
            file.seek(Integer.BYTES);
            file.write(new byte[]{99, 0, 0, 0});
        }
        RowStore store = RowStore.open(binPath);
        assertThrows(CorruptStorageException.class, () -> store.readRows(new int[]{0}));
        assertThrows(CorruptStorageException.class, () -> store.readRows(new int[]{0}, ReadStrategy.MEMORY_MAPPED));

        try (RandomAccessFile file = new RandomAccessFile(binPath.toFile(), "rw")) {
            file.setLength(2);
        }
        assertThrows(CorruptStorageException.class, () -> RowStore.open(binPath).readRows(new int[]{0}));
    }

    @Test
    @DisplayName("压缩数据损坏时抛出 CorruptStorageException")
    void testCorruptCompressedData() throws IOException {
        Path binPath = tempDir.resolve("rows.bin");
        RowSchema schema = RowSchema.parse("text:str");
        new RowStoreWriter(binPath, schema, true).serialize(List.of(Row.of("text", "some compressible text text text")));

        try (RandomAccessFile file = new RandomAccessFile(binPath.toFile(), "rw")) {
            file.seek(Constants.LENGTH_PREFIX_BYTES);
            file.write(new byte[]{0, 0});
        }
        assertThrows(CorruptStorageException.class, () -> RowStore.open(binPath).readRows(new int[]{0}));
    }

    @Test
    @DisplayName("偏移索引只加载一次并缓存")
    void testOffsetsCached() throws IOException {
        Path binPath = tempDir.resolve("rows.bin");
        new RowStoreWriter(binPath, SCHEMA, true).serialize(rows);

        RowStore store = RowStore.open(binPath);
        assertEquals(rows.size(), store.rowCount());
        Files.delete(RowStore.indexPathFor(binPath));
        assertEquals(new Row(SCHEMA.conform(rows.get(3))), store.readRow(3));
        assertThrows(IndexNotFoundException.class, () -> RowStore.open(binPath).rowCount());
    }

    private static List<Byte> toList(byte[] bytes) {
        List<Byte> list = new ArrayList<>(bytes.length);
        for (byte value : bytes) {
            list.add(value);
        }
        return list;
    }
}
