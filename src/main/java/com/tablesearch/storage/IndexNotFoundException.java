package com.tablesearch.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 索引目录或其必需文件不存在。
 */
public class IndexNotFoundException extends IOException {
    private final Path path;

    public IndexNotFoundException(String message, Path path) {
        super(message + ": " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
