package com.tablesearch.text;

import java.util.List;
import java.util.stream.Collectors;

public interface Tokenizer {

    /**
     * 将输入文本切分为词项列表。
     */
    List<Token> tokenize(String text);

    /**
     * 仅返回词项文本，保持原始顺序。
     */
    default List<String> terms(String text) {
        return tokenize(text).stream().map(Token::term).collect(Collectors.toList());
    }
}
