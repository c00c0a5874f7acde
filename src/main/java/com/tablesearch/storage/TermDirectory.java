package com.tablesearch.storage;

import com.tablesearch.config.Constants;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * 词项偏移目录：词项ID到倒排起始字节偏移的映射。
 *
 * 列表终点取目录中下一个实际存在的词项偏移，而不是 termId + 1，
 * 因此目录中的词项ID允许不连续。
 */
public final class TermDirectory {
    private final int[] termIds;
    private final long[] offsets;
    private final Map<Integer, Integer> slotByTermId;

    /**
     * @param termIds 严格递增的词项ID
     * @param offsets 与 termIds 对应、严格递增的起始偏移
     */
    public TermDirectory(int[] termIds, long[] offsets) {
        if (termIds == null || offsets == null) {
            throw new IllegalArgumentException("termIds 与 offsets 不能为null");
        }
        if (termIds.length != offsets.length) {
            throw new IllegalArgumentException("termIds 与 offsets 长度不一致: " + termIds.length + " vs " + offsets.length);
        }
        Map<Integer, Integer> slots = new HashMap<>(termIds.length * 2);
        for (int slot = 0; slot < termIds.length; slot++) {
            if (slot > 0 && termIds[slot] <= termIds[slot - 1]) {
                throw new IllegalArgumentException("termIds 必须严格递增，位置=" + slot + ", current=" + termIds[slot]);
            }
            if (offsets[slot] < 0 || (slot > 0 && offsets[slot] <= offsets[slot - 1])) {
                throw new IllegalArgumentException("offsets 必须非负且严格递增，位置=" + slot + ", current=" + offsets[slot]);
            }
            slots.put(termIds[slot], slot);
        }
        this.termIds = Arrays.copyOf(termIds, termIds.length);
        this.offsets = Arrays.copyOf(offsets, offsets.length);
        this.slotByTermId = slots;
    }

    public boolean contains(int termId) {
        return slotByTermId.containsKey(termId);
    }

    public int size() {
        return termIds.length;
    }

    /**
     * 词项倒排的起始偏移。
     */
    public OptionalLong startOffset(int termId) {
        Integer slot = slotByTermId.get(termId);
        return slot == null ? OptionalLong.empty() : OptionalLong.of(offsets[slot]);
    }

    /**
     * 词项倒排的终止偏移（不含）：下一个存在词项的起点，末位词项取文件长度。
     */
    public OptionalLong endOffset(int termId, long postingsLength) {
        Integer slot = slotByTermId.get(termId);
        if (slot == null) {
            return OptionalLong.empty();
        }
        int nextSlot = slot + 1;
        return OptionalLong.of(nextSlot < offsets.length ? offsets[nextSlot] : postingsLength);
    }

    /**
     * 返回升序排列的词项ID副本。
     */
    public int[] termIds() {
        return Arrays.copyOf(termIds, termIds.length);
    }

    /**
     * 写入目录文件：文件头、条目数、(termId, offset) 序列与 CRC32 页脚。
     *
     * @param file 目标文件
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(Path file) throws IOException {
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(file.toFile(), "rw")) {
            randomAccessFile.setLength(0L);
            randomAccessFile.writeInt(Constants.DIRECTORY_MAGIC);
            randomAccessFile.writeShort(Constants.FORMAT_VERSION);
            randomAccessFile.writeInt(termIds.length);
            for (int slot = 0; slot < termIds.length; slot++) {
                randomAccessFile.writeInt(termIds[slot]);
                randomAccessFile.writeLong(offsets[slot]);
            }
            StorageFileUtil.appendCrc32Footer(randomAccessFile);
        } catch (IOException exception) {
            throw new IOException("写入词项目录失败: file=" + file.toAbsolutePath() + ", entries=" + termIds.length, exception);
        }
    }

    /**
     * 读取目录文件并校验 CRC32、文件头与排序约束。
     *
     * @param file 目录文件
     * @return 目录
     * @throws IOException 文件损坏或读取失败时抛出
     */
    public static TermDirectory readFrom(Path file) throws IOException {
        String fileName = file.getFileName().toString();
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(file.toFile(), "r")) {
            long dataLength = StorageFileUtil.verifyCrc32Footer(randomAccessFile, fileName);
            randomAccessFile.seek(0L);
            StorageFileUtil.verifyHeader(randomAccessFile, Constants.DIRECTORY_MAGIC, Constants.FORMAT_VERSION, fileName);
            int entryCount = randomAccessFile.readInt();
            long expectedLength = Integer.BYTES + Short.BYTES + Integer.BYTES + (long) entryCount * (Integer.BYTES + Long.BYTES);
            if (entryCount < 0 || expectedLength != dataLength) {
                throw new CorruptStorageException("词项目录条目数与文件长度不符: entries=" + entryCount + ", file=" + fileName);
            }
            int[] termIds = new int[entryCount];
            long[] offsets = new long[entryCount];
            for (int slot = 0; slot < entryCount; slot++) {
                termIds[slot] = randomAccessFile.readInt();
                offsets[slot] = randomAccessFile.readLong();
            }
            try {
                return new TermDirectory(termIds, offsets);
            } catch (IllegalArgumentException exception) {
                throw new CorruptStorageException("词项目录内容非法: " + fileName, exception);
            }
        }
    }
}
