package com.tablesearch.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 单次正则扫描分词器：先整体小写，再按 Unicode 单词边界提取 {@code \w+}。
 *
 * 建索引与查询必须共用同一实例语义，否则词项无法对齐。
 */
public class WordTokenizer implements Tokenizer {

    private static final Pattern WORD_PATTERN = Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * 对文本分词，偏移基于小写后的文本。
     */
    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        String lowered = text.toLowerCase(Locale.ROOT);
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = WORD_PATTERN.matcher(lowered);
        int nextPosition = 0;
        while (matcher.find()) {
            tokens.add(new Token(matcher.group(), nextPosition, matcher.start(), matcher.end()));
            nextPosition++;
        }
        return List.copyOf(tokens);
    }
}
