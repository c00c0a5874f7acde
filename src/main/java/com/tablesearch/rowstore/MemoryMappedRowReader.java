package com.tablesearch.rowstore;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.util.List;

/**
 * 只读映射整个数据文件，线程池内各自切片解码。
 */
final class MemoryMappedRowReader implements RowReader {
    private final int threads;

    MemoryMappedRowReader(int threads) {
        this.threads = RowReadTasks.boundedThreads(threads);
    }

    @Override
    public List<Row> read(RowStore store, int[] rowNumbers) throws IOException {
        MappedByteBuffer mapped;
        try (FileChannel channel = store.openChannel()) {
            if (channel.size() > Integer.MAX_VALUE) {
                throw new IOException("数据文件超过 2GB，无法整体映射: " + store.binPath());
            }
            mapped = channel.map(FileChannel.MapMode.READ_ONLY, 0, channel.size());
        }
        ByteBuffer readOnly = mapped.asReadOnlyBuffer();
        return RowReadTasks.runAll(threads, rowNumbers, rowNumber -> store.readRecord(readOnly, rowNumber));
    }
}
