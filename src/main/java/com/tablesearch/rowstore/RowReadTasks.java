package com.tablesearch.rowstore;

import com.tablesearch.config.Constants;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池内并发解码行的公共逻辑，按请求顺序收集结果。
 */
final class RowReadTasks {

    @FunctionalInterface
    interface RecordTask {
        Row read(int rowNumber) throws IOException;
    }

    private RowReadTasks() {
    }

    static int boundedThreads(int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("线程数必须为正数: " + parallelism);
        }
        return Math.min(parallelism, Constants.MAX_READ_THREADS);
    }

    static List<Row> runAll(int threads, int[] rowNumbers, RecordTask task) throws IOException {
        int poolSize = Math.max(1, Math.min(threads, rowNumbers.length));
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, new ReaderThreadFactory());
        try {
            List<Future<Row>> futures = new ArrayList<>(rowNumbers.length);
            for (int rowNumber : rowNumbers) {
                Callable<Row> callable = () -> task.read(rowNumber);
                futures.add(executor.submit(callable));
            }
            List<Row> rows = new ArrayList<>(rowNumbers.length);
            for (Future<Row> future : futures) {
                rows.add(future.get());
            }
            return rows;
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new IOException("读取行时线程被中断", exception);
        } catch (ExecutionException exception) {
            Throwable cause = exception.getCause();
            if (cause instanceof IOException ioException) {
                throw ioException;
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IOException("读取行失败", cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private static final class ReaderThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "row-reader-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
