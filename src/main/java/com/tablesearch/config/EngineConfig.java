package com.tablesearch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tablesearch.rowstore.ReadStrategy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 引擎运行时配置
 *
 * 支持从CLI参数或 JSON 配置文件注入，覆盖Constants默认值
 */
public class EngineConfig {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private Path indexDir = Paths.get("./index");
    private int readThreads = Constants.DEFAULT_READ_THREADS;
    private int readProcesses = Constants.DEFAULT_READ_PROCESSES;
    private boolean compress = true;
    private ReadStrategy readStrategy = ReadStrategy.THREAD_POOL;

    public Path getIndexDir() {
        return indexDir;
    }

    public void setIndexDir(Path indexDir) {
        this.indexDir = indexDir;
    }

    public int getReadThreads() {
        return readThreads;
    }

    public void setReadThreads(int readThreads) {
        this.readThreads = readThreads;
    }

    public int getReadProcesses() {
        return readProcesses;
    }

    public void setReadProcesses(int readProcesses) {
        this.readProcesses = readProcesses;
    }

    public boolean isCompress() {
        return compress;
    }

    public void setCompress(boolean compress) {
        this.compress = compress;
    }

    public ReadStrategy getReadStrategy() {
        return readStrategy;
    }

    public void setReadStrategy(ReadStrategy readStrategy) {
        this.readStrategy = readStrategy;
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * 从 JSON 配置文件加载，未出现的字段保持默认值。
     *
     * @param configFile 配置文件
     * @return 加载后的配置
     * @throws IOException 文件不存在或解析失败时抛出
     */
    public static EngineConfig load(Path configFile) throws IOException {
        if (configFile == null) {
            throw new IllegalArgumentException("配置文件不能为空");
        }
        if (!Files.isRegularFile(configFile)) {
            throw new IOException("配置文件不存在: " + configFile.toAbsolutePath());
        }
        try {
            return OBJECT_MAPPER.readValue(configFile.toFile(), EngineConfig.class);
        } catch (IOException exception) {
            throw new IOException("读取配置文件失败: " + configFile.toAbsolutePath(), exception);
        }
    }
}
