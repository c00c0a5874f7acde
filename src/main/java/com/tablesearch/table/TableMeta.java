package com.tablesearch.table;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tablesearch.storage.CorruptStorageException;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * 表索引元数据：被索引的列与行数，最后写出，作为构建完成的标志。
 */
public record TableMeta(
    int formatVersion,
    List<String> indexColumns,
    int rowCount,
    boolean compress,
    Instant createTime
) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public TableMeta {
        indexColumns = List.copyOf(indexColumns);
    }

    public void writeTo(Path file) throws IOException {
        try {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), this);
        } catch (IOException exception) {
            throw new IOException("写入表元数据失败: " + file.toAbsolutePath(), exception);
        }
    }

    public static TableMeta readFrom(Path file) throws IOException {
        try {
            return OBJECT_MAPPER.readValue(file.toFile(), TableMeta.class);
        } catch (IOException exception) {
            throw new CorruptStorageException("读取表元数据失败: " + file.toAbsolutePath(), exception);
        }
    }
}
