package com.tablesearch.storage;

/**
 * 倒排三元组，记录某词项在某文档中的出现次数。
 *
 * @param termId 词项ID
 * @param docId 文档ID
 * @param frequency 文档内词频
 */
public record Posting(int termId, int docId, int frequency) {
}
