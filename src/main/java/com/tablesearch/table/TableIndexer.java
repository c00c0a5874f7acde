package com.tablesearch.table;

import com.tablesearch.config.Constants;
import com.tablesearch.config.EngineConfig;
import com.tablesearch.index.InvertedIndex;
import com.tablesearch.query.QueryEngine;
import com.tablesearch.rowstore.ReadStrategy;
import com.tablesearch.rowstore.Row;
import com.tablesearch.rowstore.RowSchema;
import com.tablesearch.rowstore.RowStore;
import com.tablesearch.rowstore.RowStoreWriter;
import com.tablesearch.storage.CorruptStorageException;
import com.tablesearch.storage.IndexNotFoundException;
import com.tablesearch.text.Tokenizer;
import com.tablesearch.text.WordTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 表检索：每个被索引的列一份倒排索引，所有行写入一份行存储。
 *
 * 查询在每列内做 AND，列之间取并集，再按配置的读取策略取回命中的行。
 */
public final class TableIndexer {
    private static final Logger logger = LoggerFactory.getLogger(TableIndexer.class);
    private static final Pattern COLUMN_NAME = Pattern.compile("[\\w.-]+");

    private final Path tableDir;
    private final EngineConfig config;
    private final TableMeta meta;
    private final RowStore rowStore;
    private final Map<String, QueryEngine> engines;

    private TableIndexer(Path tableDir, EngineConfig config, TableMeta meta, RowStore rowStore,
                         Map<String, QueryEngine> engines) {
        this.tableDir = tableDir;
        this.config = config;
        this.meta = meta;
        this.rowStore = rowStore;
        this.engines = engines;
    }

    /**
     * 构建表索引：先写行存储（所有行在写入前完成校验），再逐列构建倒排索引，最后写元数据。
     *
     * @param schema 行 schema
     * @param rows 行
     * @param indexColumns 需要建立倒排索引的列，按给定顺序
     * @param tableDir 输出目录
     * @param config 运行配置
     * @return 已打开的表索引
     * @throws com.tablesearch.rowstore.SchemaViolationException 任一行不满足 schema 时抛出
     * @throws IOException 写入失败时抛出
     */
    public static TableIndexer build(RowSchema schema, List<Row> rows, List<String> indexColumns,
                                     Path tableDir, EngineConfig config) throws IOException {
        if (schema == null || rows == null || tableDir == null || config == null) {
            throw new IllegalArgumentException("schema、rows、tableDir 与 config 不能为空");
        }
        List<String> columns = validateIndexColumns(schema, indexColumns);
        List<Map<String, Object>> conformedRows = new ArrayList<>(rows.size());
        for (Row row : rows) {
            conformedRows.add(schema.conform(row));
        }

        long startNanos = System.nanoTime();
        Path metaPath = tableDir.resolve(Constants.TABLE_META_FILE);
        Files.deleteIfExists(metaPath);

        RowStore rowStore = new RowStoreWriter(tableDir.resolve(Constants.ROWS_FILE), schema, config.isCompress())
            .serialize(rows);

        Tokenizer tokenizer = new WordTokenizer();
        Map<String, QueryEngine> engines = new LinkedHashMap<>();
        for (String column : columns) {
            List<String> documents = new ArrayList<>(rows.size());
            for (Map<String, Object> values : conformedRows) {
                documents.add(String.valueOf(values.get(column)));
            }
            InvertedIndex index = InvertedIndex.index(documents, columnIndexDir(tableDir, column), tokenizer);
            engines.put(column, new QueryEngine(index, tokenizer));
        }

        TableMeta meta = new TableMeta(Constants.FORMAT_VERSION, columns, rows.size(), config.isCompress(), Instant.now());
        meta.writeTo(metaPath);
        logger.info("表索引构建完成: dir={}, rows={}, indexColumns={}, elapsedMs={}",
            tableDir, rows.size(), columns, (System.nanoTime() - startNanos) / 1_000_000);
        return new TableIndexer(tableDir, config, meta, rowStore, engines);
    }

    /**
     * 从磁盘重新打开表索引。
     *
     * @throws IndexNotFoundException 目录、元数据或任一组成部分不存在时抛出
     * @throws CorruptStorageException 各部分行数不一致时抛出
     */
    public static TableIndexer open(Path tableDir, EngineConfig config) throws IOException {
        if (tableDir == null || config == null) {
            throw new IllegalArgumentException("tableDir 与 config 不能为空");
        }
        if (!Files.isDirectory(tableDir)) {
            throw new IndexNotFoundException("表索引目录不存在", tableDir);
        }
        Path metaPath = tableDir.resolve(Constants.TABLE_META_FILE);
        if (!Files.exists(metaPath)) {
            throw new IndexNotFoundException("表元数据不存在", metaPath);
        }
        TableMeta meta = TableMeta.readFrom(metaPath);
        if (meta.formatVersion() != Constants.FORMAT_VERSION) {
            throw new CorruptStorageException("表索引版本不支持: " + meta.formatVersion());
        }

        RowStore rowStore = RowStore.open(tableDir.resolve(Constants.ROWS_FILE));
        if (rowStore.manifest().rowCount() != meta.rowCount()) {
            throw new CorruptStorageException("行存储行数与表元数据不一致: expected="
                + meta.rowCount() + ", actual=" + rowStore.manifest().rowCount());
        }

        Tokenizer tokenizer = new WordTokenizer();
        Map<String, QueryEngine> engines = new LinkedHashMap<>();
        for (String column : meta.indexColumns()) {
            InvertedIndex index = InvertedIndex.open(columnIndexDir(tableDir, column));
            if (index.docCount() != meta.rowCount()) {
                throw new CorruptStorageException("列索引文档数与表元数据不一致: column=" + column
                    + ", expected=" + meta.rowCount() + ", actual=" + index.docCount());
            }
            engines.put(column, new QueryEngine(index, tokenizer));
        }
        logger.debug("打开表索引: dir={}, rows={}, indexColumns={}", tableDir, meta.rowCount(), meta.indexColumns());
        return new TableIndexer(tableDir, config, meta, rowStore, engines);
    }

    /**
     * 检索并取回命中的行。
     *
     * @param query 查询语句，为空时返回空结果
     * @return 命中的行号与行
     * @throws IOException 读取失败时抛出
     */
    public TableSearchResult search(String query) throws IOException {
        String safeQuery = query == null ? "" : query.trim();
        if (safeQuery.length() > Constants.MAX_QUERY_LENGTH) {
            throw new IllegalArgumentException("查询长度超过限制（最大 " + Constants.MAX_QUERY_LENGTH + " 字符）");
        }
        long startNanos = System.nanoTime();

        int[] matched = new int[0];
        for (Map.Entry<String, QueryEngine> entry : engines.entrySet()) {
            int[] columnMatches = entry.getValue().search(safeQuery);
            logger.debug("列匹配: column={}, matches={}", entry.getKey(), columnMatches.length);
            matched = union(matched, columnMatches);
        }

        ReadStrategy strategy = config.getReadStrategy();
        int parallelism = strategy == ReadStrategy.PROCESS_POOL ? config.getReadProcesses() : config.getReadThreads();
        List<Row> rows = rowStore.readRows(matched, strategy, parallelism);

        List<Integer> rowIds = new ArrayList<>(matched.length);
        for (int rowId : matched) {
            rowIds.add(rowId);
        }
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.info("检索完成: query=\"{}\", matches={}, strategy={}, elapsedMs={}",
            safeQuery, rowIds.size(), strategy, elapsedMs);
        return new TableSearchResult(safeQuery, rowIds, rows, elapsedMs);
    }

    /**
     * 两个升序数组的并集，结果升序且无重复。
     */
    static int[] union(int[] left, int[] right) {
        int[] merged = new int[left.length + right.length];
        int i = 0;
        int j = 0;
        int size = 0;
        while (i < left.length || j < right.length) {
            int next;
            if (j >= right.length || (i < left.length && left[i] < right[j])) {
                next = left[i++];
            } else if (i >= left.length || right[j] < left[i]) {
                next = right[j++];
            } else {
                next = left[i++];
                j++;
            }
            merged[size++] = next;
        }
        return Arrays.copyOf(merged, size);
    }

    public static Path columnIndexDir(Path tableDir, String column) {
        return tableDir.resolve(Constants.COLUMN_INDEX_PREFIX + column);
    }

    private static List<String> validateIndexColumns(RowSchema schema, List<String> indexColumns) {
        if (indexColumns == null || indexColumns.isEmpty()) {
            throw new IllegalArgumentException("至少需要一个索引列");
        }
        LinkedHashSet<String> distinct = new LinkedHashSet<>();
        for (String column : indexColumns) {
            if (column == null || !COLUMN_NAME.matcher(column).matches()) {
                throw new IllegalArgumentException("索引列名非法: " + column);
            }
            if (!schema.hasColumn(column)) {
                throw new IllegalArgumentException("索引列不在 schema 中: " + column);
            }
            distinct.add(column);
        }
        return List.copyOf(distinct);
    }

    public InvertedIndex columnIndex(String column) {
        QueryEngine engine = engines.get(column);
        if (engine == null) {
            throw new IllegalArgumentException("列未建立索引: " + column);
        }
        return engine.index();
    }

    public List<String> indexColumns() {
        return meta.indexColumns();
    }

    public int rowCount() throws IOException {
        return rowStore.rowCount();
    }

    public RowStore rowStore() {
        return rowStore;
    }

    public TableMeta meta() {
        return meta;
    }

    public Path tableDir() {
        return tableDir;
    }

    public EngineConfig config() {
        return config;
    }
}
