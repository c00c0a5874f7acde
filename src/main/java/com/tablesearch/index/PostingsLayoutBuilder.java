package com.tablesearch.index;

import com.tablesearch.storage.Posting;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 将按词项ID排序的三元组分组，分组内部保持输入顺序。
 */
public final class PostingsLayoutBuilder {

    private PostingsLayoutBuilder() {
    }

    /**
     * @param sortedPostings 按词项ID排序的三元组
     * @return 分组结果与升序词项ID
     */
    public static PostingsLayout build(List<Posting> sortedPostings) {
        if (sortedPostings == null) {
            throw new IllegalArgumentException("sortedPostings 不能为空");
        }
        Map<Integer, List<Posting>> groups = new LinkedHashMap<>();
        for (Posting posting : sortedPostings) {
            groups.computeIfAbsent(posting.termId(), unused -> new ArrayList<>()).add(posting);
        }
        int[] sortedTermIds = groups.keySet().stream().mapToInt(Integer::intValue).sorted().toArray();
        return new PostingsLayout(groups, sortedTermIds);
    }
}
