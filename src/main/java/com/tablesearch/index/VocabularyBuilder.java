package com.tablesearch.index;

import com.tablesearch.storage.Posting;
import com.tablesearch.text.Tokenizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 词表与频次构建器。
 *
 * 按文档顺序遍历，为首次出现的词项分配递增ID，每篇文档的每个不同词项产出一个三元组。
 * 最后只按词项ID做稳定排序，同一词项内部保持 docId 升序。
 */
public class VocabularyBuilder {

    private final Tokenizer tokenizer;

    public VocabularyBuilder(Tokenizer tokenizer) {
        if (tokenizer == null) {
            throw new IllegalArgumentException("tokenizer 不能为空");
        }
        this.tokenizer = tokenizer;
    }

    /**
     * 构建词表、三元组与频次统计。空文档序列返回空词表。
     *
     * @param documents 按 docId 排列的文档文本，null 视为空文本
     * @return 构建结果
     */
    public Vocabulary build(List<String> documents) {
        if (documents == null) {
            throw new IllegalArgumentException("documents 不能为空");
        }

        Map<String, Integer> termIds = new LinkedHashMap<>();
        Map<Integer, Integer> docFreqs = new HashMap<>();
        Map<Integer, Integer> wordFreqs = new HashMap<>();
        List<Posting> postings = new ArrayList<>();

        for (int docId = 0; docId < documents.size(); docId++) {
            Map<String, Integer> documentCounts = countTerms(documents.get(docId));
            for (Map.Entry<String, Integer> termCount : documentCounts.entrySet()) {
                int termId = termIds.computeIfAbsent(termCount.getKey(), unused -> termIds.size());
                docFreqs.merge(termId, 1, Integer::sum);
                wordFreqs.merge(termId, termCount.getValue(), Integer::sum);
                postings.add(new Posting(termId, docId, termCount.getValue()));
            }
        }

        postings.sort(Comparator.comparingInt(Posting::termId));
        return new Vocabulary(termIds, postings, sortedByKey(docFreqs), sortedByKey(wordFreqs), documents.size());
    }

    /**
     * 统计单篇文档的词频，保持词项首次出现顺序。
     */
    private Map<String, Integer> countTerms(String document) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String term : tokenizer.terms(document)) {
            counts.merge(term, 1, Integer::sum);
        }
        return counts;
    }

    private Map<Integer, Integer> sortedByKey(Map<Integer, Integer> source) {
        Map<Integer, Integer> sorted = new LinkedHashMap<>();
        source.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(entry -> sorted.put(entry.getKey(), entry.getValue()));
        return sorted;
    }
}
