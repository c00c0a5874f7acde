package com.tablesearch.rowstore;

import com.tablesearch.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 行存储序列化器：按输入顺序写出行记录，同时写出逐行偏移索引与清单。
 *
 * 数据文件只写一次，任何行的变更都需要重写整个存储。
 */
public final class RowStoreWriter {
    private static final Logger logger = LoggerFactory.getLogger(RowStoreWriter.class);

    private final Path binPath;
    private final RowSchema schema;
    private final boolean compress;

    /**
     * @param binPath 行数据文件路径，偏移索引与清单写在同目录
     * @param schema 行 schema
     * @param compress 变长列是否 zlib 压缩
     */
    public RowStoreWriter(Path binPath, RowSchema schema, boolean compress) {
        if (binPath == null || schema == null) {
            throw new IllegalArgumentException("binPath 与 schema 不能为空");
        }
        this.binPath = binPath;
        this.schema = schema;
        this.compress = compress;
    }

    /**
     * 校验全部行后写出数据文件、偏移索引与清单。
     *
     * @param rows 待写入的行
     * @return 可直接读取的行存储，偏移索引已缓存
     * @throws SchemaViolationException 任一行缺列或类型不符时抛出，此时不产生任何文件
     * @throws IOException 写入失败时抛出
     */
    public RowStore serialize(List<Row> rows) throws IOException {
        if (rows == null) {
            throw new IllegalArgumentException("rows 不能为空");
        }
        List<Map<String, Object>> conformedRows = new ArrayList<>(rows.size());
        for (Row row : rows) {
            conformedRows.add(schema.conform(row));
        }

        long startNanos = System.nanoTime();
        Path parent = binPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path manifestPath = RowStore.manifestPathFor(binPath);
        Files.deleteIfExists(manifestPath);

        RowRecordCodec codec = new RowRecordCodec(schema, compress);
        long[] offsets = new long[conformedRows.size()];
        long offset = 0L;
        try (OutputStream dataStream = new BufferedOutputStream(Files.newOutputStream(binPath));
             BufferedWriter indexWriter = Files.newBufferedWriter(RowStore.indexPathFor(binPath), StandardCharsets.UTF_8)) {
            for (int rowNumber = 0; rowNumber < conformedRows.size(); rowNumber++) {
                offsets[rowNumber] = offset;
                indexWriter.write(Long.toString(offset));
                indexWriter.write('\n');

                byte[] record = codec.encode(conformedRows.get(rowNumber));
                dataStream.write(record);
                offset += record.length;
            }
        } catch (IOException exception) {
            throw new IOException("写入行存储失败: file=" + binPath.toAbsolutePath() + ", rows=" + conformedRows.size(), exception);
        }

        RowStoreManifest manifest = new RowStoreManifest(Constants.FORMAT_VERSION, schema.columns(), compress,
            conformedRows.size(), offset, Instant.now());
        manifest.writeTo(manifestPath);

        logger.info("行存储已写入: file={}, rows={}, bytes={}, compress={}, elapsedMs={}",
            binPath, conformedRows.size(), offset, compress, (System.nanoTime() - startNanos) / 1_000_000);
        return new RowStore(binPath, manifest, offsets);
    }
}
