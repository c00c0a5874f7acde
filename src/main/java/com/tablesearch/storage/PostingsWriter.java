package com.tablesearch.storage;

import com.tablesearch.config.Constants;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 倒排文件写入器，按词项ID递增顺序连续写入定长三元组，不带分隔符。
 */
public final class PostingsWriter implements AutoCloseable {
    private final OutputStream outputStream;
    private final String postingsFileName;
    private final ByteBuffer recordBuffer = ByteBuffer.allocate(Constants.POSTING_RECORD_BYTES).order(ByteOrder.LITTLE_ENDIAN);
    private long position;
    private int lastTermId = -1;
    private boolean closed;

    /**
     * 创建倒排写入器，截断已有文件。
     *
     * @param file 倒排文件
     * @throws IOException 初始化失败时抛出
     */
    public PostingsWriter(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("倒排文件不能为空");
        }
        this.outputStream = new BufferedOutputStream(Files.newOutputStream(file));
        this.postingsFileName = file.getFileName().toString();
    }

    /**
     * 写入一个词项的全部倒排项并返回起始偏移。
     *
     * @param termId 词项ID，必须大于上一次写入的词项ID
     * @param postings 该词项的倒排项，docId 严格递增
     * @return 该倒排列表在文件中的偏移
     * @throws IOException 写入失败时抛出
     */
    public long writePostingList(int termId, List<Posting> postings) throws IOException {
        ensureOpen();
        validateInput(termId, postings);

        long postingOffset = position;
        for (Posting posting : postings) {
            recordBuffer.clear();
            recordBuffer.putInt(posting.termId()).putInt(posting.docId()).putInt(posting.frequency());
            outputStream.write(recordBuffer.array(), 0, Constants.POSTING_RECORD_BYTES);
            position += Constants.POSTING_RECORD_BYTES;
        }
        lastTermId = termId;
        return postingOffset;
    }

    /**
     * 已写入的字节数。
     */
    public long length() {
        return position;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            outputStream.flush();
        } catch (IOException exception) {
            throw new IOException("关闭倒排写入器失败: file=" + postingsFileName, exception);
        } finally {
            outputStream.close();
            closed = true;
        }
    }

    /**
     * 校验词项顺序、三元组归属与 docId 单调性。
     */
    private void validateInput(int termId, List<Posting> postings) {
        if (postings == null || postings.isEmpty()) {
            throw new IllegalArgumentException("postings 不能为空: termId=" + termId);
        }
        if (termId <= lastTermId) {
            throw new IllegalArgumentException("termId 必须严格递增，last=" + lastTermId + ", current=" + termId);
        }
        int previousDocId = -1;
        for (Posting posting : postings) {
            if (posting.termId() != termId) {
                throw new IllegalArgumentException("倒排项 termId 不一致: expected=" + termId + ", actual=" + posting.termId());
            }
            if (posting.docId() <= previousDocId) {
                throw new IllegalArgumentException("docId 必须严格递增: termId=" + termId + ", docId=" + posting.docId());
            }
            if (posting.frequency() <= 0) {
                throw new IllegalArgumentException("frequency 必须为正数: termId=" + termId + ", docId=" + posting.docId());
            }
            previousDocId = posting.docId();
        }
    }

    /**
     * 校验写入器处于可写状态。
     */
    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("PostingsWriter 已关闭");
        }
    }
}
