package com.tablesearch.rowstore;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.util.List;

/**
 * 固定大小线程池，共享一个文件通道做定位读取。
 */
final class ThreadPoolRowReader implements RowReader {
    private final int threads;

    ThreadPoolRowReader(int threads) {
        this.threads = RowReadTasks.boundedThreads(threads);
    }

    @Override
    public List<Row> read(RowStore store, int[] rowNumbers) throws IOException {
        try (FileChannel channel = store.openChannel()) {
            return RowReadTasks.runAll(threads, rowNumbers, rowNumber -> store.readRecord(channel, rowNumber));
        }
    }
}
