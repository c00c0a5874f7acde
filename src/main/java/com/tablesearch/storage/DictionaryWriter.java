package com.tablesearch.storage;

import com.tablesearch.config.Constants;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * 词典文件写入器，按词项ID严格递增写入词条并在关闭时追加 CRC32。
 */
public final class DictionaryWriter implements AutoCloseable {
    private static final long TERM_COUNT_OFFSET = Integer.BYTES + Short.BYTES;

    private final RandomAccessFile randomAccessFile;
    private final String dictionaryFileName;
    private int termCount;
    private int lastTermId = -1;
    private boolean closed;

    /**
     * 创建词典文件写入器并写入文件头。
     *
     * @param file 目标词典文件
     * @throws IOException 初始化失败时抛出
     */
    public DictionaryWriter(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("词典文件不能为空");
        }
        this.randomAccessFile = new RandomAccessFile(file.toFile(), "rw");
        this.dictionaryFileName = file.getFileName().toString();
        this.randomAccessFile.setLength(0L);
        this.randomAccessFile.writeInt(Constants.DICT_MAGIC);
        this.randomAccessFile.writeShort(Constants.FORMAT_VERSION);
        this.randomAccessFile.writeInt(0);
    }

    /**
     * 写入一个词条，要求 termId 严格递增。
     *
     * @param entry 词条
     * @throws IOException 写入失败时抛出
     */
    public void writeTermEntry(TermEntry entry) throws IOException {
        ensureOpen();
        if (entry == null || entry.term() == null || entry.term().isEmpty()) {
            throw new IllegalArgumentException("term 不能为空");
        }
        if (entry.docFreq() < 0 || entry.wordFreq() < entry.docFreq()) {
            throw new IllegalArgumentException("频次非法: term=" + entry.term() + ", docFreq=" + entry.docFreq() + ", wordFreq=" + entry.wordFreq());
        }
        if (entry.termId() <= lastTermId) {
            throw new IllegalArgumentException("termId 必须严格递增，last=" + lastTermId + ", current=" + entry.termId());
        }

        byte[] termBytes = entry.term().getBytes(StandardCharsets.UTF_8);
        StorageFileUtil.writeVarInt(randomAccessFile, termBytes.length);
        randomAccessFile.write(termBytes);
        StorageFileUtil.writeVarInt(randomAccessFile, entry.termId());
        StorageFileUtil.writeVarInt(randomAccessFile, entry.docFreq());
        StorageFileUtil.writeVarInt(randomAccessFile, entry.wordFreq());

        termCount++;
        lastTermId = entry.termId();
    }

    /**
     * 回填 termCount 并写入 CRC32 页脚。
     *
     * @throws IOException 关闭失败时抛出
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            randomAccessFile.seek(TERM_COUNT_OFFSET);
            randomAccessFile.writeInt(termCount);
            randomAccessFile.seek(randomAccessFile.length());
            StorageFileUtil.appendCrc32Footer(randomAccessFile);
        } catch (IOException exception) {
            throw new IOException("关闭词典写入器失败: file=" + dictionaryFileName + ", termCount=" + termCount, exception);
        } finally {
            randomAccessFile.close();
            closed = true;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("DictionaryWriter 已关闭");
        }
    }
}
