package com.tablesearch.index;

import com.tablesearch.storage.Posting;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 词表构建结果：词项到ID映射、按词项ID排序的三元组、文档频次与总词频。
 *
 * @param termIds 词项到ID映射，迭代顺序即首次出现顺序
 * @param postings 按词项ID稳定排序的三元组
 * @param docFreqs 词项ID到文档频次
 * @param wordFreqs 词项ID到全集合出现次数
 * @param docCount 输入文档数
 */
public record Vocabulary(
    Map<String, Integer> termIds,
    List<Posting> postings,
    Map<Integer, Integer> docFreqs,
    Map<Integer, Integer> wordFreqs,
    int docCount
) {
    public Vocabulary {
        termIds = Collections.unmodifiableMap(new LinkedHashMap<>(termIds));
        postings = List.copyOf(postings);
        docFreqs = Collections.unmodifiableMap(new LinkedHashMap<>(docFreqs));
        wordFreqs = Collections.unmodifiableMap(new LinkedHashMap<>(wordFreqs));
        if (docCount < 0) {
            throw new IllegalArgumentException("docCount 不能为负数: " + docCount);
        }
    }

    public int size() {
        return termIds.size();
    }
}
