package com.tablesearch.storage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 单个词项的倒排列表，包含文档ID与对应词频。
 *
 * @param termId 词项ID
 * @param docIds 递增文档ID数组
 * @param termFreqs 与docIds同长度的词频数组
 */
public record PostingList(int termId, int[] docIds, int[] termFreqs) {
    private static final int[] EMPTY = new int[0];

    /**
     * 构造时执行防御性校验并复制输入数据，避免外部修改。
     */
    public PostingList {
        if (docIds == null || termFreqs == null) {
            throw new IllegalArgumentException("docIds与termFreqs不能为null");
        }
        if (docIds.length != termFreqs.length) {
            throw new IllegalArgumentException("docIds与termFreqs长度不一致: " + docIds.length + " vs " + termFreqs.length);
        }
        for (int index = 0; index < docIds.length; index++) {
            if (docIds[index] < 0) {
                throw new IllegalArgumentException("docId不能为负数，位置=" + index + ", value=" + docIds[index]);
            }
            if (termFreqs[index] < 0) {
                throw new IllegalArgumentException("termFreq不能为负数，位置=" + index + ", value=" + termFreqs[index]);
            }
            if (index > 0 && docIds[index] <= docIds[index - 1]) {
                throw new IllegalArgumentException("docIds必须严格递增，位置=" + index + ", current=" + docIds[index]);
            }
        }
        docIds = Arrays.copyOf(docIds, docIds.length);
        termFreqs = Arrays.copyOf(termFreqs, termFreqs.length);
    }

    /**
     * 词项不存在时返回的空列表。
     */
    public static PostingList empty(int termId) {
        return new PostingList(termId, EMPTY, EMPTY);
    }

    /**
     * 返回倒排项数量。
     *
     * @return 倒排项数量
     */
    public int size() {
        return docIds.length;
    }

    public boolean isEmpty() {
        return docIds.length == 0;
    }

    /**
     * 获取指定位置的文档ID。
     *
     * @param index 倒排项下标
     * @return 文档ID
     */
    public int docId(int index) {
        return docIds[index];
    }

    /**
     * 获取指定位置的词频。
     *
     * @param index 倒排项下标
     * @return 词频
     */
    public int termFreq(int index) {
        return termFreqs[index];
    }

    /**
     * 还原为三元组列表，顺序与docId一致。
     */
    public List<Posting> postings() {
        List<Posting> postings = new ArrayList<>(docIds.length);
        for (int index = 0; index < docIds.length; index++) {
            postings.add(new Posting(termId, docIds[index], termFreqs[index]));
        }
        return postings;
    }

    @Override
    public int[] docIds() {
        return Arrays.copyOf(docIds, docIds.length);
    }

    @Override
    public int[] termFreqs() {
        return Arrays.copyOf(termFreqs, termFreqs.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PostingList that)) {
            return false;
        }
        return termId == that.termId && Arrays.equals(docIds, that.docIds) && Arrays.equals(termFreqs, that.termFreqs);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * termId + Arrays.hashCode(docIds)) + Arrays.hashCode(termFreqs);
    }

    @Override
    public String toString() {
        return "PostingList[termId=" + termId + ", docIds=" + Arrays.toString(docIds)
            + ", termFreqs=" + Arrays.toString(termFreqs) + "]";
    }
}
