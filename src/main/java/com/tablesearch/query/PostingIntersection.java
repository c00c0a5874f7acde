package com.tablesearch.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * 有序 docId 列表求交。
 */
public final class PostingIntersection {
    private static final int[] EMPTY = new int[0];

    private PostingIntersection() {
    }

    /**
     * 两路归并求交：较小值一侧前进，相等时输出并双侧前进。
     *
     * @param left 升序 docId
     * @param right 升序 docId
     * @return 升序交集
     */
    public static int[] intersect(int[] left, int[] right) {
        int[] result = new int[Math.min(left.length, right.length)];
        int leftPointer = 0;
        int rightPointer = 0;
        int size = 0;
        while (leftPointer < left.length && rightPointer < right.length) {
            if (left[leftPointer] == right[rightPointer]) {
                result[size++] = left[leftPointer];
                leftPointer++;
                rightPointer++;
            } else if (left[leftPointer] < right[rightPointer]) {
                leftPointer++;
            } else {
                rightPointer++;
            }
        }
        return Arrays.copyOf(result, size);
    }

    /**
     * 多路求交：按长度升序排列后依次与累计结果两路求交，空列表立即使结果为空。
     *
     * @param docIdLists 每个词项的升序 docId
     * @return 升序交集，无输入时为空
     */
    public static int[] intersectAll(List<int[]> docIdLists) {
        if (docIdLists == null || docIdLists.isEmpty()) {
            return EMPTY;
        }
        List<int[]> bySize = new ArrayList<>(docIdLists);
        bySize.sort(Comparator.comparingInt(docIds -> docIds.length));

        int[] result = bySize.get(0);
        for (int index = 1; index < bySize.size() && result.length > 0; index++) {
            result = intersect(result, bySize.get(index));
        }
        return Arrays.copyOf(result, result.length);
    }
}
