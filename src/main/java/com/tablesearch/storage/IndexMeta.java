package com.tablesearch.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;

/**
 * 倒排索引元数据，描述文档数、词表规模与倒排文件校验信息。
 */
public record IndexMeta(
    int formatVersion,
    int docCount,
    int termCount,
    int directorySize,
    long postingsBytes,
    long postingsCrc32,
    Instant createTime
) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * 将当前元数据写入指定 JSON 文件。
     *
     * @param file 元数据文件
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("元数据文件不能为空");
        }
        try {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), this);
        } catch (IOException exception) {
            throw new IOException("写入索引元数据失败: " + file.toAbsolutePath(), exception);
        }
    }

    /**
     * 从指定 JSON 文件读取元数据。
     *
     * @param file 元数据文件
     * @return 反序列化后的元数据
     * @throws IOException 读取或解析失败时抛出
     */
    public static IndexMeta readFrom(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("元数据文件不能为空");
        }
        try {
            return OBJECT_MAPPER.readValue(file.toFile(), IndexMeta.class);
        } catch (IOException exception) {
            throw new CorruptStorageException("读取索引元数据失败: " + file.toAbsolutePath(), exception);
        }
    }

    /**
     * 计算倒排文件 CRC32 并与元数据比对。
     *
     * @param postingsFile 倒排文件
     * @throws IOException 校验失败时抛出 {@link CorruptStorageException}
     */
    public void verifyPostings(Path postingsFile) throws IOException {
        long actualCrc32 = StorageFileUtil.computeCrc32(postingsFile);
        if (actualCrc32 != postingsCrc32) {
            throw new CorruptStorageException("倒排文件 CRC32 校验失败: " + postingsFile.getFileName()
                + ", expected=" + postingsCrc32 + ", actual=" + actualCrc32);
        }
    }

    /**
     * 计算倒排文件 CRC32，供构建阶段写入元数据。
     */
    public static long crc32Of(Path postingsFile) throws IOException {
        return StorageFileUtil.computeCrc32(postingsFile);
    }
}
