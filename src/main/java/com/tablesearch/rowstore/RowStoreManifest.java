package com.tablesearch.rowstore;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tablesearch.storage.CorruptStorageException;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * 行存储清单：schema、压缩策略、行数与数据文件长度，随数据文件一起落盘。
 */
public record RowStoreManifest(
    int formatVersion,
    List<RowSchema.Column> columns,
    boolean compress,
    int rowCount,
    long dataBytes,
    Instant createTime
) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public RowStoreManifest {
        columns = List.copyOf(columns);
    }

    public RowSchema schema() {
        return new RowSchema(columns);
    }

    /**
     * 将清单写入指定 JSON 文件。
     *
     * @param file 清单文件
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(Path file) throws IOException {
        try {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), this);
        } catch (IOException exception) {
            throw new IOException("写入行存储清单失败: " + file.toAbsolutePath(), exception);
        }
    }

    /**
     * 从 JSON 文件读取清单。
     *
     * @param file 清单文件
     * @return 清单
     * @throws IOException 读取或解析失败时抛出
     */
    public static RowStoreManifest readFrom(Path file) throws IOException {
        try {
            return OBJECT_MAPPER.readValue(file.toFile(), RowStoreManifest.class);
        } catch (IOException exception) {
            throw new CorruptStorageException("读取行存储清单失败: " + file.toAbsolutePath(), exception);
        }
    }
}
