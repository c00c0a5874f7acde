package com.tablesearch.table;

import com.tablesearch.rowstore.Row;

import java.util.List;

/**
 * 一次表检索的结果。
 *
 * @param query 原始查询
 * @param rowIds 命中的行号，升序
 * @param rows 与 rowIds 一一对应的行
 * @param elapsedMs 耗时
 */
public record TableSearchResult(
    String query,
    List<Integer> rowIds,
    List<Row> rows,
    long elapsedMs
) {
    public TableSearchResult {
        rowIds = List.copyOf(rowIds);
        rows = List.copyOf(rows);
    }

    public int totalMatches() {
        return rowIds.size();
    }
}
