package com.tablesearch.storage;

import com.tablesearch.config.Constants;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 词典文件读取器，打开时全量加载词条并提供按词项与按ID的查找。
 */
public final class DictionaryReader {
    private final Map<String, TermEntry> entriesByTerm = new HashMap<>();
    private final Map<Integer, TermEntry> entriesById = new HashMap<>();
    private final List<TermEntry> entriesInIdOrder = new ArrayList<>();

    /**
     * 构造读取器并完成词典全量加载。
     *
     * @param file 词典文件
     * @throws IOException 文件损坏或解析失败时抛出
     */
    public DictionaryReader(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("词典文件不能为空");
        }
        String fileName = file.getFileName().toString();
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(file.toFile(), "r")) {
            long dataLength = StorageFileUtil.verifyCrc32Footer(randomAccessFile, fileName);
            randomAccessFile.seek(0L);
            StorageFileUtil.verifyHeader(randomAccessFile, Constants.DICT_MAGIC, Constants.FORMAT_VERSION, fileName);

            int termCount = randomAccessFile.readInt();
            if (termCount < 0) {
                throw new CorruptStorageException("词典termCount非法: " + termCount + ", file=" + file.toAbsolutePath());
            }
            int previousTermId = -1;
            for (int index = 0; index < termCount; index++) {
                int termLength = StorageFileUtil.readVarInt(randomAccessFile);
                if (termLength <= 0 || randomAccessFile.getFilePointer() + termLength > dataLength) {
                    throw new CorruptStorageException("词项长度非法: index=" + index + ", termLength=" + termLength);
                }
                byte[] termBytes = new byte[termLength];
                randomAccessFile.readFully(termBytes);
                String term = new String(termBytes, StandardCharsets.UTF_8);
                int termId = StorageFileUtil.readVarInt(randomAccessFile);
                if (termId <= previousTermId) {
                    throw new CorruptStorageException("词典词序损坏，termId 未严格递增: term=" + term + ", termId=" + termId);
                }
                int docFreq = StorageFileUtil.readVarInt(randomAccessFile);
                int wordFreq = StorageFileUtil.readVarInt(randomAccessFile);
                if (docFreq < 0 || wordFreq < docFreq) {
                    throw new CorruptStorageException("频次非法: term=" + term + ", docFreq=" + docFreq + ", wordFreq=" + wordFreq);
                }
                TermEntry entry = new TermEntry(term, termId, docFreq, wordFreq);
                if (entriesByTerm.put(term, entry) != null) {
                    throw new CorruptStorageException("词典包含重复词项: " + term);
                }
                entriesById.put(termId, entry);
                entriesInIdOrder.add(entry);
                previousTermId = termId;
            }

            if (randomAccessFile.getFilePointer() != dataLength) {
                throw new CorruptStorageException("词典文件包含未解析字节，可能已损坏: " + fileName);
            }
        }
    }

    /**
     * 精确查找词项对应词条。
     *
     * @param term 词项
     * @return 命中的词条或空
     */
    public Optional<TermEntry> lookup(String term) {
        return Optional.ofNullable(entriesByTerm.get(term));
    }

    /**
     * 按词项ID查找词条。
     */
    public Optional<TermEntry> lookup(int termId) {
        return Optional.ofNullable(entriesById.get(termId));
    }

    public int getTermCount() {
        return entriesInIdOrder.size();
    }

    /**
     * 返回全部词条（按词项ID升序）。
     *
     * @return 不可修改词条列表
     */
    public List<TermEntry> entries() {
        return Collections.unmodifiableList(entriesInIdOrder);
    }
}
