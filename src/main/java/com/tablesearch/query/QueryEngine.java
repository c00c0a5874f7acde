package com.tablesearch.query;

import com.tablesearch.index.InvertedIndex;
import com.tablesearch.storage.PostingList;
import com.tablesearch.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 布尔 AND 查询引擎：查询文本使用与建索引相同的分词器，逐词取倒排后求交。
 */
public class QueryEngine {
    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);
    private static final int[] NO_MATCH = new int[0];

    private final InvertedIndex index;
    private final Tokenizer tokenizer;

    public QueryEngine(InvertedIndex index, Tokenizer tokenizer) {
        if (index == null || tokenizer == null) {
            throw new IllegalArgumentException("index 与 tokenizer 不能为空");
        }
        this.index = index;
        this.tokenizer = tokenizer;
    }

    /**
     * 返回同时包含全部查询词项的文档ID，升序。空查询或任一词项不在词表中时为空。
     *
     * @param queryString 查询文本
     * @return 升序 docId
     * @throws IOException 读取倒排失败时抛出
     */
    public int[] search(String queryString) throws IOException {
        long startNanos = System.nanoTime();
        List<PostingList> postingLists = postingsFor(queryString);
        if (postingLists.isEmpty()) {
            return NO_MATCH;
        }

        List<int[]> docIdLists = new ArrayList<>(postingLists.size());
        for (PostingList postingList : postingLists) {
            if (postingList.isEmpty()) {
                logger.debug("查询词项无倒排，结果为空: query={}", queryString);
                return NO_MATCH;
            }
            docIdLists.add(postingList.docIds());
        }
        int[] matches = PostingIntersection.intersectAll(docIdLists);
        logger.debug("查询完成: query={}, terms={}, matches={}, elapsedUs={}",
            queryString, postingLists.size(), matches.length, (System.nanoTime() - startNanos) / 1_000);
        return matches;
    }

    /**
     * 返回每个不同查询词项的倒排列表，顺序与词项首次出现顺序一致。
     */
    public List<PostingList> postingsFor(String queryString) throws IOException {
        Set<String> distinctTerms = new LinkedHashSet<>(tokenizer.terms(queryString));
        List<PostingList> postingLists = new ArrayList<>(distinctTerms.size());
        for (String term : distinctTerms) {
            postingLists.add(index.lookupByText(term));
        }
        return postingLists;
    }

    public InvertedIndex index() {
        return index;
    }
}
