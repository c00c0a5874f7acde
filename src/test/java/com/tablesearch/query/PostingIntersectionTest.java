package com.tablesearch.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class PostingIntersectionTest {

    private final Random random = new Random(17);

    @Test
    @DisplayName("两路求交")
    void testIntersect() {
        assertArrayEquals(new int[]{3, 7}, PostingIntersection.intersect(new int[]{1, 3, 5, 7}, new int[]{2, 3, 7, 9}));
        assertArrayEquals(new int[0], PostingIntersection.intersect(new int[]{1, 2}, new int[]{3, 4}));
        assertArrayEquals(new int[0], PostingIntersection.intersect(new int[0], new int[]{1}));
    }

    @Test
    @DisplayName("多路求交：空输入为空，单个列表原样返回")
    void testIntersectAllEdgeCases() {
        assertArrayEquals(new int[0], PostingIntersection.intersectAll(List.of()));
        assertArrayEquals(new int[0], PostingIntersection.intersectAll(null));
        assertArrayEquals(new int[]{4, 8}, PostingIntersection.intersectAll(List.<int[]>of(new int[]{4, 8})));
        assertArrayEquals(new int[0], PostingIntersection.intersectAll(List.of(new int[]{1, 2}, new int[0], new int[]{1})));
    }

    @RepeatedTest(20)
    @DisplayName("与集合语义一致，且满足交换律与结合律")
    void testSetSemantics() {
        int[] a = randomSorted();
        int[] b = randomSorted();
        int[] c = randomSorted();

        TreeSet<Integer> expected = toSet(a);
        expected.retainAll(toSet(b));
        expected.retainAll(toSet(c));
        int[] expectedArray = expected.stream().mapToInt(Integer::intValue).toArray();

        assertArrayEquals(expectedArray, PostingIntersection.intersectAll(List.of(a, b, c)));
        assertArrayEquals(PostingIntersection.intersect(a, b), PostingIntersection.intersect(b, a));
        assertArrayEquals(
            PostingIntersection.intersect(PostingIntersection.intersect(a, b), c),
            PostingIntersection.intersect(a, PostingIntersection.intersect(b, c)));
        assertArrayEquals(expectedArray, PostingIntersection.intersectAll(List.of(c, a, b)));
    }

    @Test
    @DisplayName("结果升序且不修改输入")
    void testDoesNotMutateInput() {
        int[] small = {5, 9};
        int[] large = IntStream.range(0, 20).toArray();
        int[] result = PostingIntersection.intersectAll(List.of(large, small));

        assertArrayEquals(new int[]{5, 9}, result);
        result[0] = -1;
        assertEquals(5, small[0]);
    }

    private int[] randomSorted() {
        return random.ints(random.nextInt(40), 0, 60).distinct().sorted().toArray();
    }

    private static TreeSet<Integer> toSet(int[] values) {
        TreeSet<Integer> set = new TreeSet<>();
        Arrays.stream(values).forEach(set::add);
        return set;
    }
}
