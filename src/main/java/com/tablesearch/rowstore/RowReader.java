package com.tablesearch.rowstore;

import java.io.IOException;
import java.util.List;

/**
 * 行读取策略。行号已由 {@link RowStore} 校验在范围内，结果顺序必须与请求一致。
 */
interface RowReader {

    List<Row> read(RowStore store, int[] rowNumbers) throws IOException;
}
