package com.tablesearch.rowstore;

import com.tablesearch.config.Constants;
import com.tablesearch.storage.CorruptStorageException;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * 行记录编解码：定长区（小端序，schema 顺序）+ 每个变长列的 4 字节无符号长度前缀与 UTF-8 字节（可选 zlib 压缩）。
 *
 * 解码是纯函数，所有读取策略共用。
 */
public final class RowRecordCodec {
    private final RowSchema schema;
    private final boolean compress;

    public RowRecordCodec(RowSchema schema, boolean compress) {
        if (schema == null) {
            throw new IllegalArgumentException("schema 不能为空");
        }
        this.schema = schema;
        this.compress = compress;
    }

    /**
     * 编码一行，值需已经过 {@link RowSchema#conform(Row)} 规整。
     *
     * @param values 规整后的列值
     * @return 记录字节
     */
    public byte[] encode(Map<String, Object> values) {
        ByteBuffer fixedBlock = ByteBuffer.allocate(schema.fixedWidth()).order(ByteOrder.LITTLE_ENDIAN);
        for (RowSchema.Column column : schema.fixedColumns()) {
            column.type().write(fixedBlock, values.get(column.name()));
        }

        ByteArrayOutputStream record = new ByteArrayOutputStream(schema.fixedWidth() + 64);
        record.write(fixedBlock.array(), 0, fixedBlock.capacity());
        ByteBuffer lengthPrefix = ByteBuffer.allocate(Constants.LENGTH_PREFIX_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (RowSchema.Column column : schema.variableColumns()) {
            byte[] raw = ((String) values.get(column.name())).getBytes(StandardCharsets.UTF_8);
            if (compress) {
                raw = deflate(raw);
            }
            lengthPrefix.clear();
            lengthPrefix.putInt(raw.length);
            record.write(lengthPrefix.array(), 0, Constants.LENGTH_PREFIX_BYTES);
            record.write(raw, 0, raw.length);
        }
        return record.toByteArray();
    }

    /**
     * 解码一条记录。缓冲区必须恰好覆盖该记录的字节区间。
     *
     * @param record 记录区间，position 位于记录起点
     * @param rowNumber 行号（用于错误消息）
     * @return 按 schema 顺序排列的行
     * @throws CorruptStorageException 定长区不完整、长度前缀越界、解压失败或存在多余字节时抛出
     */
    public Row decode(ByteBuffer record, int rowNumber) throws CorruptStorageException {
        ByteBuffer buffer = record.slice().order(ByteOrder.LITTLE_ENDIAN);
        if (buffer.remaining() < schema.fixedWidth()) {
            throw new CorruptStorageException("行记录定长区不完整: row=" + rowNumber
                + ", expected=" + schema.fixedWidth() + ", actual=" + buffer.remaining());
        }
        Map<String, Object> decoded = new LinkedHashMap<>();
        for (RowSchema.Column column : schema.fixedColumns()) {
            decoded.put(column.name(), column.type().read(buffer));
        }

        for (RowSchema.Column column : schema.variableColumns()) {
            if (buffer.remaining() < Constants.LENGTH_PREFIX_BYTES) {
                throw new CorruptStorageException("行记录缺少长度前缀: row=" + rowNumber + ", column=" + column.name());
            }
            long length = Integer.toUnsignedLong(buffer.getInt());
            if (length > buffer.remaining()) {
                throw new CorruptStorageException("长度前缀超出记录末尾: row=" + rowNumber + ", column=" + column.name()
                    + ", length=" + length + ", remaining=" + buffer.remaining());
            }
            byte[] raw = new byte[(int) length];
            buffer.get(raw);
            if (compress) {
                raw = inflate(raw, rowNumber, column.name());
            }
            decoded.put(column.name(), new String(raw, StandardCharsets.UTF_8));
        }

        if (buffer.hasRemaining()) {
            throw new CorruptStorageException("行记录存在未解析字节: row=" + rowNumber + ", remaining=" + buffer.remaining());
        }

        Map<String, Object> ordered = new LinkedHashMap<>();
        for (RowSchema.Column column : schema.columns()) {
            ordered.put(column.name(), decoded.get(column.name()));
        }
        return new Row(ordered);
    }

    public RowSchema schema() {
        return schema;
    }

    private static byte[] deflate(byte[] raw) {
        Deflater deflater = new Deflater();
        try {
            deflater.setInput(raw);
            deflater.finish();
            ByteArrayOutputStream compressed = new ByteArrayOutputStream(Math.max(16, raw.length / 2));
            byte[] chunk = new byte[4096];
            while (!deflater.finished()) {
                int produced = deflater.deflate(chunk);
                compressed.write(chunk, 0, produced);
            }
            return compressed.toByteArray();
        } finally {
            deflater.end();
        }
    }

    private static byte[] inflate(byte[] compressed, int rowNumber, String column) throws CorruptStorageException {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(compressed);
            ByteArrayOutputStream decompressed = new ByteArrayOutputStream(compressed.length * 2 + 16);
            byte[] chunk = new byte[4096];
            while (!inflater.finished()) {
                int produced = inflater.inflate(chunk);
                if (produced == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new CorruptStorageException("压缩数据不完整: row=" + rowNumber + ", column=" + column);
                }
                decompressed.write(chunk, 0, produced);
            }
            return decompressed.toByteArray();
        } catch (DataFormatException exception) {
            throw new CorruptStorageException("压缩数据格式错误: row=" + rowNumber + ", column=" + column, exception);
        } finally {
            inflater.end();
        }
    }
}
