package com.tablesearch.storage;

/**
 * 词典词条，记录词项文本、词项ID以及文档频次与总词频。
 */
public record TermEntry(String term, int termId, int docFreq, int wordFreq) {
}
