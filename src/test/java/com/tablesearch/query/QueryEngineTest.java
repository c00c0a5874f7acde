package com.tablesearch.query;

import com.tablesearch.index.InvertedIndex;
import com.tablesearch.storage.PostingList;
import com.tablesearch.text.WordTokenizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryEngineTest {

    @TempDir
    Path tempDir;

    private QueryEngine queryEngine;

    @BeforeEach
    void setUp() throws IOException {
        WordTokenizer tokenizer = new WordTokenizer();
        InvertedIndex index = InvertedIndex.index(
            List.of("apple orange banana", "banana fruit", "orange fruit smoothie"), tempDir.resolve("idx"), tokenizer);
        queryEngine = new QueryEngine(index, tokenizer);
    }

    @Test
    @DisplayName("多词 AND 查询")
    void testAndQuery() throws IOException {
        assertArrayEquals(new int[]{1}, queryEngine.search("banana fruit"));
    }

    @ParameterizedTest
    @CsvSource({
        "banana, 0 1",
        "orange, 0 2",
        "FRUIT, 1 2",
        "'orange, fruit!', 2",
        "banana banana, 0 1",
        "apple smoothie, ''"
    })
    @DisplayName("单词与多词查询结果")
    void testQueries(String query, String expected) throws IOException {
        int[] expectedIds = expected == null || expected.isBlank()
            ? new int[0]
            : Arrays.stream(expected.trim().split(" ")).mapToInt(Integer::parseInt).toArray();
        assertArrayEquals(expectedIds, queryEngine.search(query));
    }

    @Test
    @DisplayName("未出现的词项与空查询返回空结果")
    void testUnseenAndEmpty() throws IOException {
        assertArrayEquals(new int[0], queryEngine.search("grape"));
        assertArrayEquals(new int[0], queryEngine.search("banana grape"));
        assertArrayEquals(new int[0], queryEngine.search(""));
        assertArrayEquals(new int[0], queryEngine.search("   ...  "));
    }

    @Test
    @DisplayName("按查询词项返回倒排列表，去重并保持顺序")
    void testPostingsFor() throws IOException {
        List<PostingList> postingLists = queryEngine.postingsFor("fruit banana fruit grape");

        assertEquals(3, postingLists.size());
        assertArrayEquals(new int[]{1, 2}, postingLists.get(0).docIds());
        assertArrayEquals(new int[]{0, 1}, postingLists.get(1).docIds());
        assertTrue(postingLists.get(2).isEmpty());
    }
}
