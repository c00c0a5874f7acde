package com.tablesearch.index;

import com.tablesearch.storage.Posting;
import com.tablesearch.text.WordTokenizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VocabularyBuilderTest {

    private static final List<String> DOCUMENTS = List.of(
        "apple orange banana",
        "banana fruit",
        "orange fruit smoothie");

    private final VocabularyBuilder builder = new VocabularyBuilder(new WordTokenizer());

    @Test
    @DisplayName("按首次出现顺序分配连续词项ID")
    void testTermIdsInFirstSeenOrder() {
        Vocabulary vocabulary = builder.build(DOCUMENTS);

        assertEquals(Map.of("apple", 0, "orange", 1, "banana", 2, "fruit", 3, "smoothie", 4), vocabulary.termIds());
        assertEquals(List.of("apple", "orange", "banana", "fruit", "smoothie"),
            new ArrayList<>(vocabulary.termIds().keySet()));
        assertEquals(3, vocabulary.docCount());
        assertEquals(5, vocabulary.size());
    }

    @Test
    @DisplayName("三元组按词项ID稳定排序，同词项内 docId 升序")
    void testPostingsSortedByTermId() {
        Vocabulary vocabulary = builder.build(DOCUMENTS);

        assertEquals(List.of(
            new Posting(0, 0, 1),
            new Posting(1, 0, 1),
            new Posting(1, 2, 1),
            new Posting(2, 0, 1),
            new Posting(2, 1, 1),
            new Posting(3, 1, 1),
            new Posting(3, 2, 1),
            new Posting(4, 2, 1)), vocabulary.postings());
    }

    @Test
    @DisplayName("文档频率与词频")
    void testFrequencies() {
        Vocabulary vocabulary = builder.build(List.of("the cat the hat", "the dog"));

        int the = vocabulary.termIds().get("the");
        int cat = vocabulary.termIds().get("cat");
        assertEquals(2, vocabulary.docFreqs().get(the));
        assertEquals(3, vocabulary.wordFreqs().get(the));
        assertEquals(1, vocabulary.docFreqs().get(cat));
        assertTrue(vocabulary.postings().contains(new Posting(the, 0, 2)));
    }

    @Test
    @DisplayName("频次统计之和与三元组一致")
    void testFrequencyConsistency() {
        Vocabulary vocabulary = builder.build(List.of("a b a c", "b b d", "", "c a"));

        for (Map.Entry<Integer, Integer> docFreq : vocabulary.docFreqs().entrySet()) {
            long postings = vocabulary.postings().stream().filter(p -> p.termId() == docFreq.getKey()).count();
            int words = vocabulary.postings().stream().filter(p -> p.termId() == docFreq.getKey())
                .mapToInt(Posting::frequency).sum();
            assertEquals(postings, docFreq.getValue().longValue());
            assertEquals(words, vocabulary.wordFreqs().get(docFreq.getKey()));
        }
        int[] termIds = vocabulary.postings().stream().mapToInt(Posting::termId).toArray();
        int[] sorted = termIds.clone();
        Arrays.sort(sorted);
        assertEquals(Arrays.toString(sorted), Arrays.toString(termIds));
    }

    @Test
    @DisplayName("空文档序列返回空词表，null 文档视为空文本")
    void testEmptyInput() {
        Vocabulary empty = builder.build(List.of());
        assertEquals(0, empty.size());
        assertEquals(0, empty.docCount());
        assertTrue(empty.postings().isEmpty());

        Vocabulary withNull = builder.build(Arrays.asList("alpha", null, "alpha"));
        assertEquals(3, withNull.docCount());
        assertEquals(List.of(new Posting(0, 0, 1), new Posting(0, 2, 1)), withNull.postings());
    }

    @Test
    @DisplayName("非法参数")
    void testIllegalArguments() {
        assertThrows(IllegalArgumentException.class, () -> new VocabularyBuilder(null));
        assertThrows(IllegalArgumentException.class, () -> builder.build(null));
    }
}
