package com.tablesearch.index;

import com.tablesearch.storage.Posting;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;

/**
 * 按词项ID分组的倒排布局。
 *
 * @param groups 词项ID到其倒排项（docId 升序）
 * @param sortedTermIds 升序排列的词项ID
 */
public record PostingsLayout(Map<Integer, List<Posting>> groups, int[] sortedTermIds) {

    public PostingsLayout {
        if (groups == null || sortedTermIds == null) {
            throw new IllegalArgumentException("groups 与 sortedTermIds 不能为null");
        }
        if (groups.size() != sortedTermIds.length) {
            throw new IllegalArgumentException("分组数与词项数不一致: " + groups.size() + " vs " + sortedTermIds.length);
        }
        Map<Integer, List<Posting>> copy = new LinkedHashMap<>();
        for (int index = 0; index < sortedTermIds.length; index++) {
            if (index > 0 && sortedTermIds[index] <= sortedTermIds[index - 1]) {
                throw new IllegalArgumentException("sortedTermIds 必须严格递增");
            }
            List<Posting> group = groups.get(sortedTermIds[index]);
            if (group == null) {
                throw new IllegalArgumentException("缺少词项分组: termId=" + sortedTermIds[index]);
            }
            copy.put(sortedTermIds[index], List.copyOf(group));
        }
        groups = Collections.unmodifiableMap(copy);
        sortedTermIds = Arrays.copyOf(sortedTermIds, sortedTermIds.length);
    }

    /**
     * 返回指定词项的倒排项，缺失时为空列表。
     */
    public List<Posting> postingsFor(int termId) {
        return groups.getOrDefault(termId, List.of());
    }

    /**
     * 仅保留满足条件的词项，产生的目录允许词项ID不连续。
     */
    public PostingsLayout retainTerms(IntPredicate keep) {
        Map<Integer, List<Posting>> retained = new LinkedHashMap<>();
        for (int termId : sortedTermIds) {
            if (keep.test(termId)) {
                retained.put(termId, groups.get(termId));
            }
        }
        int[] retainedIds = retained.keySet().stream().mapToInt(Integer::intValue).toArray();
        return new PostingsLayout(retained, retainedIds);
    }

    @Override
    public int[] sortedTermIds() {
        return Arrays.copyOf(sortedTermIds, sortedTermIds.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PostingsLayout that)) {
            return false;
        }
        return groups.equals(that.groups) && Arrays.equals(sortedTermIds, that.sortedTermIds);
    }

    @Override
    public int hashCode() {
        return 31 * groups.hashCode() + Arrays.hashCode(sortedTermIds);
    }

    @Override
    public String toString() {
        return "PostingsLayout[terms=" + sortedTermIds.length + "]";
    }
}
