package com.tablesearch.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WordTokenizerTest {

    private final WordTokenizer tokenizer = new WordTokenizer();

    @Test
    @DisplayName("小写化并记录位置与偏移")
    void testSimpleTokenize() {
        List<Token> tokens = tokenizer.tokenize("Hello World");

        assertEquals(2, tokens.size());
        assertToken(tokens.get(0), "hello", 0, 0, 5);
        assertToken(tokens.get(1), "world", 1, 6, 11);
    }

    @Test
    @DisplayName("标点分隔，数字与下划线属于词")
    void testPunctuationAndDigits() {
        assertEquals(List.of("a", "1", "bb", "ccc"), tokenizer.terms("A-1 bb, Ccc!"));
        assertEquals(List.of("foo_bar", "42"), tokenizer.terms("foo_bar (42)"));
    }

    @Test
    @DisplayName("Unicode 字符类：重音字母与中文不被切断")
    void testUnicodeWords() {
        assertEquals(List.of("café", "naïve"), tokenizer.terms("Café NAÏVE"));
        assertEquals(List.of("搜索引擎"), tokenizer.terms("搜索引擎"));
    }

    @Test
    @DisplayName("空文本与 null 返回空列表")
    void testEmptyInput() {
        assertTrue(tokenizer.tokenize("").isEmpty());
        assertTrue(tokenizer.tokenize(null).isEmpty());
        assertTrue(tokenizer.terms("  ,;  ").isEmpty());
    }

    @Test
    @DisplayName("重复词项保留出现顺序")
    void testRepeatedTerms() {
        assertEquals(List.of("to", "be", "or", "not", "to", "be"), tokenizer.terms("To be, or not to be"));
    }

    private void assertToken(Token token, String term, int position, int startOffset, int endOffset) {
        assertEquals(term, token.term());
        assertEquals(position, token.position());
        assertEquals(startOffset, token.startOffset());
        assertEquals(endOffset, token.endOffset());
    }
}
