package com.tablesearch;

import com.tablesearch.config.EngineConfig;
import com.tablesearch.rowstore.ReadStrategy;
import com.tablesearch.rowstore.Row;
import com.tablesearch.rowstore.RowSchema;
import com.tablesearch.rowstore.RowStore;
import com.tablesearch.table.TableIndexer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 表检索与行读取基准测试
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class TableSearchBenchmark {

    private static final String[] TOPICS = {
        "java programming", "python data science", "machine learning", "search index", "general content"
    };

    @Param({"SEQUENTIAL", "THREAD_POOL", "MEMORY_MAPPED"})
    public ReadStrategy strategy;

    Path tempDir;
    TableIndexer indexer;
    RowStore rowStore;
    int[] randomRows;

    @Setup
    public void setup() throws IOException {
        tempDir = Files.createTempDirectory("benchmark");
        RowSchema schema = RowSchema.parse("id:i,score:f,title:str,body:str");
        Random random = new Random(42);
        List<Row> rows = new ArrayList<>();
        // 生成 20000 行测试数据
        for (int i = 0; i < 20_000; i++) {
            String topic = TOPICS[i % TOPICS.length];
            rows.add(Row.of(
                "id", i,
                "score", random.nextFloat(),
                "title", "Row " + i + " about " + topic,
                "body", ("The quick brown fox jumps over the lazy dog. " + topic + ". ").repeat(4)));
        }

        EngineConfig config = EngineConfig.defaults();
        config.setReadStrategy(strategy);
        indexer = TableIndexer.build(schema, rows, List.of("title", "body"), tempDir.resolve("table"), config);
        rowStore = indexer.rowStore();
        randomRows = random.ints(500, 0, rows.size()).toArray();
    }

    @TearDown
    public void tearDown() throws IOException {
        try (Stream<Path> paths = Files.walk(tempDir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException exception) {
                    throw new UncheckedIOException(exception);
                }
            });
        }
    }

    @Benchmark
    public int searchSingleTerm() throws IOException {
        return indexer.search("learning").totalMatches();
    }

    @Benchmark
    public int searchConjunction() throws IOException {
        return indexer.search("python science").totalMatches();
    }

    @Benchmark
    public List<Row> readRandomRows() throws IOException {
        return rowStore.readRows(randomRows, strategy);
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(TableSearchBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
