package com.tablesearch.rowstore;

/**
 * 行数据或 schema 声明不满足列约束，在任何写入之前抛出。
 */
public class SchemaViolationException extends IllegalArgumentException {
    private final String column;

    public SchemaViolationException(String column, String message) {
        super(message + ": column=" + column);
        this.column = column;
    }

    /**
     * 违反约束的列名。
     */
    public String getColumn() {
        return column;
    }
}
