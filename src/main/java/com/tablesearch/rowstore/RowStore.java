package com.tablesearch.rowstore;

import com.tablesearch.config.Constants;
import com.tablesearch.storage.CorruptStorageException;
import com.tablesearch.storage.IndexNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

/**
 * 只读行存储：按行号随机读取，支持顺序、线程池、子进程池与内存映射四种读取策略。
 *
 * 偏移索引在首次读取时加载并缓存，同一实例内只加载一次。
 */
public final class RowStore {
    private static final Logger logger = LoggerFactory.getLogger(RowStore.class);

    private final Path binPath;
    private final RowStoreManifest manifest;
    private final RowRecordCodec codec;
    private volatile long[] offsets;

    RowStore(Path binPath, RowStoreManifest manifest, long[] offsets) {
        this.binPath = binPath;
        this.manifest = manifest;
        this.codec = new RowRecordCodec(manifest.schema(), manifest.compress());
        this.offsets = offsets;
    }

    /**
     * 打开已写出的行存储。只读取清单，偏移索引延迟加载。
     *
     * @param binPath 行数据文件路径
     * @return 行存储
     * @throws IndexNotFoundException 数据文件或清单不存在时抛出
     * @throws IOException 清单损坏时抛出
     */
    public static RowStore open(Path binPath) throws IOException {
        if (!Files.exists(binPath)) {
            throw new IndexNotFoundException("行数据文件不存在", binPath);
        }
        Path manifestPath = manifestPathFor(binPath);
        if (!Files.exists(manifestPath)) {
            throw new IndexNotFoundException("行存储清单不存在", manifestPath);
        }
        RowStoreManifest manifest = RowStoreManifest.readFrom(manifestPath);
        if (manifest.formatVersion() != Constants.FORMAT_VERSION) {
            throw new CorruptStorageException("行存储版本不支持: " + manifest.formatVersion());
        }
        logger.debug("打开行存储: file={}, rows={}, compress={}", binPath, manifest.rowCount(), manifest.compress());
        return new RowStore(binPath, manifest, null);
    }

    public static Path indexPathFor(Path binPath) {
        return binPath.resolveSibling(binPath.getFileName() + Constants.ROW_INDEX_SUFFIX);
    }

    public static Path manifestPathFor(Path binPath) {
        return binPath.resolveSibling(binPath.getFileName() + Constants.ROW_SCHEMA_SUFFIX);
    }

    /**
     * 行数，来自偏移索引。
     */
    public int rowCount() throws IOException {
        return offsets().length;
    }

    public List<Row> readRows(int[] rowNumbers) throws IOException {
        return readRows(rowNumbers, ReadStrategy.SEQUENTIAL);
    }

    public List<Row> readRows(int[] rowNumbers, ReadStrategy strategy) throws IOException {
        int parallelism = switch (strategy) {
            case PROCESS_POOL -> Constants.DEFAULT_READ_PROCESSES;
            case THREAD_POOL, MEMORY_MAPPED -> Constants.DEFAULT_READ_THREADS;
            case SEQUENTIAL -> 1;
        };
        return readRows(rowNumbers, strategy, parallelism);
    }

    /**
     * 按给定行号顺序读取行，结果与请求一一对应，允许重复行号。
     *
     * @param rowNumbers 行号
     * @param strategy 读取策略
     * @param parallelism 线程数或子进程数，顺序读取时忽略
     * @return 与请求顺序一致的行
     * @throws IndexOutOfBoundsException 任一行号越界时抛出，此时不读取任何数据
     * @throws IOException 读取失败或数据损坏时抛出
     */
    public List<Row> readRows(int[] rowNumbers, ReadStrategy strategy, int parallelism) throws IOException {
        if (rowNumbers == null || strategy == null) {
            throw new IllegalArgumentException("rowNumbers 与 strategy 不能为空");
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism 必须为正数: " + parallelism);
        }
        long[] loaded = offsets();
        for (int rowNumber : rowNumbers) {
            Objects.checkIndex(rowNumber, loaded.length);
        }
        if (rowNumbers.length == 0) {
            return List.of();
        }

        long startNanos = System.nanoTime();
        RowReader reader = switch (strategy) {
            case SEQUENTIAL -> new SequentialRowReader();
            case THREAD_POOL -> new ThreadPoolRowReader(parallelism);
            case PROCESS_POOL -> new ProcessPoolRowReader(parallelism);
            case MEMORY_MAPPED -> new MemoryMappedRowReader(parallelism);
        };
        List<Row> rows = reader.read(this, rowNumbers.clone());
        logger.debug("读取行完成: strategy={}, rows={}, elapsedMs={}",
            strategy, rows.size(), (System.nanoTime() - startNanos) / 1_000_000);
        return rows;
    }

    public Row readRow(int rowNumber) throws IOException {
        return readRows(new int[]{rowNumber}).get(0);
    }

    /**
     * 记录起点。
     */
    long spanStart(int rowNumber) throws IOException {
        return offsets()[rowNumber];
    }

    /**
     * 记录终点：下一行的偏移，最后一行为数据文件长度。
     */
    long spanEnd(int rowNumber) throws IOException {
        long[] loaded = offsets();
        return rowNumber + 1 < loaded.length ? loaded[rowNumber + 1] : manifest.dataBytes();
    }

    /**
     * 通过共享文件通道做定位读取并解码，可被多个线程并发调用。
     */
    Row readRecord(FileChannel channel, int rowNumber) throws IOException {
        long start = spanStart(rowNumber);
        long end = spanEnd(rowNumber);
        ByteBuffer record = ByteBuffer.allocate(Math.toIntExact(end - start));
        long position = start;
        while (record.hasRemaining()) {
            int read = channel.read(record, position);
            if (read < 0) {
                throw new CorruptStorageException("行记录超出数据文件末尾: row=" + rowNumber + ", end=" + end);
            }
            position += read;
        }
        record.flip();
        return codec.decode(record, rowNumber);
    }

    /**
     * 从整体映射的缓冲区切出记录区间并解码，不修改传入缓冲区的位置。
     */
    Row readRecord(ByteBuffer mapped, int rowNumber) throws IOException {
        long start = spanStart(rowNumber);
        long end = spanEnd(rowNumber);
        if (end > mapped.capacity()) {
            throw new CorruptStorageException("行记录超出数据文件末尾: row=" + rowNumber + ", end=" + end);
        }
        ByteBuffer record = mapped.duplicate();
        record.limit((int) end).position((int) start);
        return codec.decode(record, rowNumber);
    }

    /**
     * 打开数据文件通道，并校验文件长度与清单一致。
     */
    FileChannel openChannel() throws IOException {
        FileChannel channel;
        try {
            channel = FileChannel.open(binPath, StandardOpenOption.READ);
        } catch (NoSuchFileException exception) {
            throw new IndexNotFoundException("行数据文件不存在", binPath);
        }
        long size = channel.size();
        if (size != manifest.dataBytes()) {
            channel.close();
            throw new CorruptStorageException("行数据文件长度与清单不一致: expected="
                + manifest.dataBytes() + ", actual=" + size);
        }
        return channel;
    }

    private long[] offsets() throws IOException {
        long[] loaded = offsets;
        if (loaded == null) {
            synchronized (this) {
                loaded = offsets;
                if (loaded == null) {
                    loaded = loadOffsets();
                    offsets = loaded;
                }
            }
        }
        return loaded;
    }

    private long[] loadOffsets() throws IOException {
        Path indexPath = indexPathFor(binPath);
        long[] loaded = new long[manifest.rowCount()];
        int count = 0;
        long previous = -1L;
        try (BufferedReader reader = Files.newBufferedReader(indexPath, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                if (count >= loaded.length) {
                    throw new CorruptStorageException("偏移索引行数超过清单记录: expected=" + loaded.length);
                }
                long offset;
                try {
                    offset = Long.parseLong(line.trim());
                } catch (NumberFormatException exception) {
                    throw new CorruptStorageException("偏移索引格式错误: line=" + (count + 1), exception);
                }
                if (offset < previous || offset > manifest.dataBytes()) {
                    throw new CorruptStorageException("偏移索引不单调或越界: row=" + count + ", offset=" + offset);
                }
                loaded[count++] = offset;
                previous = offset;
            }
        } catch (NoSuchFileException exception) {
            throw new IndexNotFoundException("偏移索引不存在", indexPath);
        }
        if (count != loaded.length) {
            throw new CorruptStorageException("偏移索引行数与清单不一致: expected=" + loaded.length + ", actual=" + count);
        }
        logger.debug("偏移索引已加载: file={}, rows={}", indexPath, count);
        return loaded;
    }

    public Path binPath() {
        return binPath;
    }

    public RowStoreManifest manifest() {
        return manifest;
    }

    public RowSchema schema() {
        return codec.schema();
    }

    @Override
    public String toString() {
        return "RowStore(file=" + binPath + ", rows=" + manifest.rowCount() + ")";
    }
}
