package com.tablesearch.index;

import com.tablesearch.storage.Posting;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PostingsLayoutBuilderTest {

    private static final List<Posting> POSTINGS = List.of(
        new Posting(0, 0, 1),
        new Posting(1, 0, 2),
        new Posting(1, 3, 1),
        new Posting(2, 1, 1),
        new Posting(4, 2, 5));

    @Test
    @DisplayName("按词项分组，词项ID升序")
    void testGroupByTermId() {
        PostingsLayout layout = PostingsLayoutBuilder.build(POSTINGS);

        assertArrayEquals(new int[]{0, 1, 2, 4}, layout.sortedTermIds());
        assertEquals(List.of(new Posting(1, 0, 2), new Posting(1, 3, 1)), layout.postingsFor(1));
        assertEquals(List.of(new Posting(4, 2, 5)), layout.postingsFor(4));
        assertTrue(layout.postingsFor(3).isEmpty());
    }

    @Test
    @DisplayName("过滤词项后目录不连续")
    void testRetainTerms() {
        PostingsLayout layout = PostingsLayoutBuilder.build(POSTINGS).retainTerms(termId -> termId % 2 == 0);

        assertArrayEquals(new int[]{0, 2, 4}, layout.sortedTermIds());
        assertTrue(layout.postingsFor(1).isEmpty());
        assertEquals(3, layout.groups().size());
    }

    @Test
    @DisplayName("空输入产生空布局")
    void testEmpty() {
        PostingsLayout layout = PostingsLayoutBuilder.build(List.of());
        assertEquals(0, layout.sortedTermIds().length);
        assertTrue(layout.groups().isEmpty());
    }

    @Test
    @DisplayName("返回的词项ID数组为副本")
    void testSortedTermIdsIsCopy() {
        PostingsLayout layout = PostingsLayoutBuilder.build(POSTINGS);
        layout.sortedTermIds()[0] = 99;
        assertEquals(0, layout.sortedTermIds()[0]);
    }

    @Test
    @DisplayName("词项ID非递增时拒绝构造")
    void testRejectsUnsortedIds() {
        assertThrows(IllegalArgumentException.class, () -> new PostingsLayout(
            java.util.Map.of(1, List.of(new Posting(1, 0, 1)), 0, List.of(new Posting(0, 0, 1))),
            new int[]{1, 0}));
    }
}
