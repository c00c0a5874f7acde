package com.tablesearch.storage;

import com.tablesearch.config.Constants;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 倒排文件读取器，按字节区间读取单条倒排列表。
 *
 * 每次读取独立打开并关闭文件，不在调用之间持有句柄。
 */
public final class PostingsReader {
    private final Path file;
    private final long expectedLength;

    /**
     * @param file 倒排文件
     * @param expectedLength 元数据记录的文件长度
     */
    public PostingsReader(Path file, long expectedLength) {
        if (file == null) {
            throw new IllegalArgumentException("倒排文件不能为空");
        }
        if (expectedLength < 0) {
            throw new IllegalArgumentException("倒排文件长度不能为负数: " + expectedLength);
        }
        this.file = file;
        this.expectedLength = expectedLength;
    }

    /**
     * 读取 [startOffset, endOffset) 区间并解码为倒排列表。
     *
     * @param termId 期望的词项ID
     * @param startOffset 区间起点
     * @param endOffset 区间终点（不含）
     * @return 解码后的倒排列表
     * @throws CorruptStorageException 区间越界、未按记录长度对齐或内容不一致时抛出
     * @throws IOException 读取失败时抛出
     */
    public PostingList readPostingList(int termId, long startOffset, long endOffset) throws IOException {
        long spanLength = endOffset - startOffset;
        if (startOffset < 0 || spanLength < 0) {
            throw new CorruptStorageException("无效倒排区间: termId=" + termId + ", start=" + startOffset + ", end=" + endOffset);
        }
        if (spanLength % Constants.POSTING_RECORD_BYTES != 0) {
            throw new CorruptStorageException("倒排区间未按记录长度对齐: termId=" + termId + ", bytes=" + spanLength);
        }
        if (spanLength > Integer.MAX_VALUE) {
            throw new CorruptStorageException("倒排区间过大: termId=" + termId + ", bytes=" + spanLength);
        }

        ByteBuffer buffer = ByteBuffer.allocate((int) spanLength).order(ByteOrder.LITTLE_ENDIAN);
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long actualLength = channel.size();
            if (actualLength != expectedLength) {
                throw new CorruptStorageException("倒排文件长度与元数据不一致: expected=" + expectedLength + ", actual=" + actualLength);
            }
            if (endOffset > actualLength) {
                throw new CorruptStorageException("倒排区间超出文件末尾: termId=" + termId + ", end=" + endOffset + ", length=" + actualLength);
            }
            long readPosition = startOffset;
            while (buffer.hasRemaining()) {
                int readBytes = channel.read(buffer, readPosition);
                if (readBytes < 0) {
                    throw new CorruptStorageException("读取倒排区间时遇到 EOF: termId=" + termId);
                }
                readPosition += readBytes;
            }
        } catch (NoSuchFileException exception) {
            throw new IndexNotFoundException("倒排文件不存在", file);
        }
        buffer.flip();
        return decode(termId, buffer);
    }

    /**
     * 将定长三元组解码为倒排列表，并校验词项归属与 docId 单调性。
     */
    private PostingList decode(int termId, ByteBuffer buffer) throws CorruptStorageException {
        int recordCount = buffer.remaining() / Constants.POSTING_RECORD_BYTES;
        int[] docIds = new int[recordCount];
        int[] termFreqs = new int[recordCount];
        for (int index = 0; index < recordCount; index++) {
            int storedTermId = buffer.getInt();
            if (storedTermId != termId) {
                throw new CorruptStorageException("倒排记录词项不一致: expected=" + termId + ", actual=" + storedTermId + ", index=" + index);
            }
            docIds[index] = buffer.getInt();
            termFreqs[index] = buffer.getInt();
        }
        try {
            return new PostingList(termId, docIds, termFreqs);
        } catch (IllegalArgumentException exception) {
            throw new CorruptStorageException("倒排列表内容非法: termId=" + termId, exception);
        }
    }
}
