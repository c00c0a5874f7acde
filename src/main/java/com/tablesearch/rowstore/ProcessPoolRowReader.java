package com.tablesearch.rowstore;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tablesearch.config.Constants;
import com.tablesearch.storage.CorruptStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * 子进程池：把行号切成连续的块，每块交给一个独立 JVM 读取，父进程按块顺序拼接结果。
 *
 * 请求与响应通过临时目录中的 JSON 文件传递，子进程输出重定向到同目录的日志文件。
 * 浮点列以原始位模式传递，结果与其他读取策略逐位一致。
 */
final class ProcessPoolRowReader implements RowReader {
    private static final Logger logger = LoggerFactory.getLogger(ProcessPoolRowReader.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<List<Map<String, Object>>> RESPONSE_TYPE = new TypeReference<>() {
    };

    private final int processes;

    ProcessPoolRowReader(int processes) {
        if (processes <= 0) {
            throw new IllegalArgumentException("进程数必须为正数: " + processes);
        }
        this.processes = Math.min(processes, Constants.MAX_READ_PROCESSES);
    }

    @Override
    public List<Row> read(RowStore store, int[] rowNumbers) throws IOException {
        List<int[]> chunks = split(rowNumbers, Math.min(processes, rowNumbers.length));
        Path workDir = Files.createTempDirectory("row-read-");
        List<Process> started = new ArrayList<>(chunks.size());
        try {
            for (int chunk = 0; chunk < chunks.size(); chunk++) {
                Path requestPath = workDir.resolve("request-" + chunk + ".json");
                OBJECT_MAPPER.writeValue(requestPath.toFile(),
                    new RowReadWorker.Request(store.binPath().toAbsolutePath().toString(), chunks.get(chunk)));
                started.add(launch(requestPath, workDir.resolve("response-" + chunk + ".json"),
                    workDir.resolve("worker-" + chunk + ".log")));
            }
            logger.debug("已启动读取子进程: processes={}, rows={}", started.size(), rowNumbers.length);

            List<Row> rows = new ArrayList<>(rowNumbers.length);
            RowSchema schema = store.schema();
            for (int chunk = 0; chunk < started.size(); chunk++) {
                Process process = started.get(chunk);
                int exitCode = process.waitFor();
                if (exitCode != 0) {
                    throw new IOException("读取子进程失败: pid=" + process.pid() + ", exitCode=" + exitCode
                        + ", output=" + tail(workDir.resolve("worker-" + chunk + ".log")));
                }
                List<Map<String, Object>> response = OBJECT_MAPPER.readValue(
                    workDir.resolve("response-" + chunk + ".json").toFile(), RESPONSE_TYPE);
                if (response.size() != chunks.get(chunk).length) {
                    throw new CorruptStorageException("子进程返回行数不一致: expected="
                        + chunks.get(chunk).length + ", actual=" + response.size());
                }
                for (Map<String, Object> values : response) {
                    rows.add(RowReadWorker.fromWire(schema, values));
                }
            }
            return rows;
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new IOException("等待读取子进程时被中断", exception);
        } finally {
            for (Process process : started) {
                if (process.isAlive()) {
                    process.destroyForcibly();
                }
            }
            deleteQuietly(workDir);
        }
    }

    static List<int[]> split(int[] rowNumbers, int parts) {
        List<int[]> chunks = new ArrayList<>(parts);
        int base = rowNumbers.length / parts;
        int extra = rowNumbers.length % parts;
        int from = 0;
        for (int part = 0; part < parts; part++) {
            int size = base + (part < extra ? 1 : 0);
            chunks.add(Arrays.copyOfRange(rowNumbers, from, from + size));
            from += size;
        }
        return chunks;
    }

    private static Process launch(Path requestPath, Path responsePath, Path logPath) throws IOException {
        Path javaBinary = Path.of(System.getProperty("java.home"), "bin", "java");
        ProcessBuilder builder = new ProcessBuilder(
            javaBinary.toString(),
            "-cp", System.getProperty("java.class.path"),
            RowReadWorker.class.getName(),
            requestPath.toString(),
            responsePath.toString());
        builder.redirectErrorStream(true);
        builder.redirectOutput(logPath.toFile());
        return builder.start();
    }

    private static String tail(Path logPath) {
        try {
            String output = Files.readString(logPath, StandardCharsets.UTF_8);
            return output.length() > 2000 ? output.substring(output.length() - 2000) : output;
        } catch (IOException exception) {
            return "<无法读取子进程输出: " + exception.getMessage() + ">";
        }
    }

    private static void deleteQuietly(Path workDir) {
        try (Stream<Path> paths = Files.walk(workDir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException exception) {
                    logger.warn("删除临时文件失败: {}", path, exception);
                }
            });
        } catch (IOException exception) {
            logger.warn("清理临时目录失败: {}", workDir, exception);
        }
    }
}
