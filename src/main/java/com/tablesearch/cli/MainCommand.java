package com.tablesearch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tablesearch.config.Constants;
import com.tablesearch.config.EngineConfig;
import com.tablesearch.index.InvertedIndex;
import com.tablesearch.rowstore.ReadStrategy;
import com.tablesearch.rowstore.Row;
import com.tablesearch.rowstore.RowSchema;
import com.tablesearch.storage.PostingList;
import com.tablesearch.storage.TermEntry;
import com.tablesearch.table.TableIndexer;
import com.tablesearch.table.TableSearchResult;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
    name = "tsearch",
    description = "🔍 表格行全文检索：倒排索引 + 列式行存储",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.IndexSubcommand.class,
        MainCommand.SearchSubcommand.class,
        MainCommand.LookupSubcommand.class,
        MainCommand.StatusSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--index-dir"}, description = "索引目录路径（默认 ./index）")
    private Path indexDir;

    @Option(names = {"--threads"}, description = "读取线程数")
    private Integer threads;

    @Option(names = {"--processes"}, description = "读取子进程数")
    private Integer processes;

    @Option(names = {"--config"}, description = "JSON 配置文件")
    private Path configFile;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 表格行全文检索");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 合并配置：默认值 < 配置文件 < 命令行选项。
     */
    EngineConfig resolveConfig() throws IOException {
        EngineConfig config = configFile == null ? EngineConfig.defaults() : EngineConfig.load(configFile);
        if (indexDir != null) {
            config.setIndexDir(indexDir);
        }
        config.setReadThreads(clamp("线程数", threads == null ? config.getReadThreads() : threads,
            Constants.DEFAULT_READ_THREADS, Constants.MAX_READ_THREADS));
        config.setReadProcesses(clamp("进程数", processes == null ? config.getReadProcesses() : processes,
            Constants.DEFAULT_READ_PROCESSES, Constants.MAX_READ_PROCESSES));
        return config;
    }

    private static int clamp(String name, int value, int fallback, int max) {
        if (value <= 0) {
            System.err.printf("⚠️ 非法%s %d，已回退为默认值 %d%n", name, value, fallback);
            return fallback;
        }
        if (value > max) {
            System.err.printf("⚠️ %s %d 超过安全上限 %d，已自动限制%n", name, value, max);
            return max;
        }
        return value;
    }

    private String sanitizeQuery(String rawQuery) {
        if (rawQuery == null) {
            return "";
        }
        String trimmed = rawQuery.trim();
        if (trimmed.length() > Constants.MAX_QUERY_LENGTH) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "查询长度超过限制（最大 " + Constants.MAX_QUERY_LENGTH + " 字符）");
        }
        return trimmed;
    }

    @Command(name = "index", description = "📂 从 JSON Lines 文件构建表索引")
    static class IndexSubcommand implements Callable<Integer> {
        private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {
        };

        @Parameters(description = "JSON Lines 输入文件，每行一个 JSON 对象", arity = "1")
        private Path rowsFile;

        @Option(names = {"--schema"}, description = "列声明，如 id:i,score:f,title:str", required = true)
        private String schema;

        @Option(names = {"--index-column"}, description = "建立倒排索引的列（可指定多个）", required = true)
        private List<String> indexColumns;

        @Option(names = {"--no-compress"}, description = "变长列不压缩")
        private boolean noCompress;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                if (noCompress) {
                    config.setCompress(false);
                }
                RowSchema rowSchema = RowSchema.parse(schema);
                System.out.println("🚀 开始索引...");
                System.out.println("📁 索引目录: " + config.getIndexDir());
                System.out.println("📄 输入文件: " + rowsFile);

                long start = System.currentTimeMillis();
                List<Row> rows = readRows(rowsFile);
                TableIndexer indexer = TableIndexer.build(rowSchema, rows, indexColumns, config.getIndexDir(), config);
                long elapsed = System.currentTimeMillis() - start;

                System.out.println("✅ 索引完成！");
                System.out.println("📊 统计:");
                System.out.println("   行数: " + indexer.rowCount());
                for (String column : indexer.indexColumns()) {
                    System.out.println("   " + column + " 词条数: " + indexer.columnIndex(column).vocabularySize());
                }
                System.out.println("   用时: " + elapsed + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 索引失败: " + exception.getMessage());
                return 1;
            }
        }

        static List<Row> readRows(Path file) throws IOException {
            List<Row> rows = new ArrayList<>();
            try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                String line;
                int lineNumber = 0;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    if (line.isBlank()) {
                        continue;
                    }
                    try {
                        rows.add(new Row(OBJECT_MAPPER.readValue(line, ROW_TYPE)));
                    } catch (JsonProcessingException exception) {
                        throw new IOException("JSON 行解析失败: file=" + file + ", line=" + lineNumber, exception);
                    }
                }
            }
            return rows;
        }
    }

    @Command(name = "search", description = "🔎 执行检索并取回命中的行")
    static class SearchSubcommand implements Callable<Integer> {

        @Parameters(description = "查询语句，词之间为 AND", arity = "1")
        private String query;

        @Option(names = {"--strategy"}, description = "读取策略: ${COMPLETION-CANDIDATES}")
        private ReadStrategy strategy;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                if (strategy != null) {
                    config.setReadStrategy(strategy);
                }
                String safeQuery = main.sanitizeQuery(query);
                TableSearchResult result = TableIndexer.open(config.getIndexDir(), config).search(safeQuery);

                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(result);
                } else {
                    System.out.println("🔍 查询: \"" + safeQuery + "\"");
                    System.out.println();
                    printTextResult(result);
                    System.out.println();
                    System.out.println("📊 共 " + result.totalMatches() + " 条匹配，用时 " + result.elapsedMs() + "ms");
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 搜索失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printTextResult(TableSearchResult result) {
            if (result.rows().isEmpty()) {
                System.out.println("⚠️ 未找到匹配结果");
                return;
            }
            for (int index = 0; index < result.rows().size(); index++) {
                System.out.println("─────────────────────────────────");
                System.out.printf("#%d %s%n", result.rowIds().get(index), result.rows().get(index).values());
            }
        }

        private void printJsonResult(TableSearchResult result) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        }
    }

    @Command(name = "lookup", description = "🔤 查看某列中一个词条的倒排列表")
    static class LookupSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "列名")
        private String column;

        @Parameters(index = "1", description = "词条")
        private String term;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                InvertedIndex index = TableIndexer.open(config.getIndexDir(), config).columnIndex(column);
                Optional<TermEntry> entry = index.termEntry(term);
                if (entry.isEmpty()) {
                    System.out.println("⚠️ 列 " + column + " 中未找到词条: " + term);
                    return 0;
                }
                PostingList postings = index.lookup(entry.get().termId());
                System.out.printf("🔤 %s (termId=%d, docFreq=%d, wordFreq=%d)%n",
                    entry.get().term(), entry.get().termId(), entry.get().docFreq(), entry.get().wordFreq());
                for (int i = 0; i < postings.size(); i++) {
                    System.out.printf("   row=%d freq=%d%n", postings.docId(i), postings.termFreq(i));
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 查询词条失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "status", description = "📊 查看索引统计信息")
    static class StatusSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                TableIndexer indexer = TableIndexer.open(config.getIndexDir(), config);
                Map<String, Integer> vocabularySizes = new LinkedHashMap<>();
                for (String column : indexer.indexColumns()) {
                    vocabularySizes.put(column, indexer.columnIndex(column).vocabularySize());
                }

                System.out.println("📊 索引状态");
                System.out.println("═══════════");
                System.out.println("📁 索引目录: " + config.getIndexDir());
                System.out.println("📄 行数: " + indexer.rowCount());
                System.out.println("🗜️ 压缩: " + indexer.meta().compress());
                System.out.println("🔤 索引列词条数: " + vocabularySizes);
                System.out.println("💾 行数据大小: " + formatBytes(indexer.rowStore().manifest().dataBytes()));
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取状态失败: " + exception.getMessage());
                return 1;
            }
        }

        private String formatBytes(long bytes) {
            if (bytes < 1024) {
                return bytes + " B";
            }
            if (bytes < 1024 * 1024L) {
                return String.format("%.2f KB", bytes / 1024.0);
            }
            if (bytes < 1024 * 1024L * 1024L) {
                return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
            }
            return String.format("%.2f GB", bytes / (1024.0 * 1024.0 * 1024.0));
        }
    }
}
