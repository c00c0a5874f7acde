package com.tablesearch.rowstore;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.util.ArrayList;
import java.util.List;

/**
 * 单线程逐行定位读取。
 */
final class SequentialRowReader implements RowReader {

    @Override
    public List<Row> read(RowStore store, int[] rowNumbers) throws IOException {
        List<Row> rows = new ArrayList<>(rowNumbers.length);
        try (FileChannel channel = store.openChannel()) {
            for (int rowNumber : rowNumbers) {
                rows.add(store.readRecord(channel, rowNumber));
            }
        }
        return rows;
    }
}
