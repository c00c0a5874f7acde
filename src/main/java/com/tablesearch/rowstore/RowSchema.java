package com.tablesearch.rowstore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 行 schema：有序的列名到列类型声明。
 *
 * 定长列按声明顺序紧密排列在记录头部，变长列按声明顺序追加在其后。
 */
public final class RowSchema {

    /**
     * 单列声明。
     */
    public record Column(String name, ColumnType type) {
        public Column {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("列名不能为空");
            }
            if (type == null) {
                throw new SchemaViolationException(name, "列类型不能为空");
            }
        }
    }

    private final List<Column> columns;
    private final List<Column> fixedColumns;
    private final List<Column> variableColumns;
    private final Map<String, Column> columnsByName;
    private final int fixedWidth;

    public RowSchema(List<Column> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("schema 至少需要一列");
        }
        Map<String, Column> byName = new LinkedHashMap<>();
        List<Column> fixed = new ArrayList<>();
        List<Column> variable = new ArrayList<>();
        int width = 0;
        for (Column column : columns) {
            if (byName.put(column.name(), column) != null) {
                throw new SchemaViolationException(column.name(), "列名重复");
            }
            if (column.type().isVariableLength()) {
                variable.add(column);
            } else {
                fixed.add(column);
                width += column.type().width();
            }
        }
        this.columns = List.copyOf(columns);
        this.fixedColumns = List.copyOf(fixed);
        this.variableColumns = List.copyOf(variable);
        this.columnsByName = byName;
        this.fixedWidth = width;
    }

    /**
     * 以格式字符声明 schema，并显式列出变长列。
     *
     * 变长列必须声明为 {@code str}，定长列不得声明为 {@code str}，在任何 I/O 之前校验。
     * 显式给出变长列时，列顺序为定长列（按 codes 顺序）后接变长列（按该列表顺序），
     * 记录中变长区也按此顺序排列。
     *
     * @param codes 有序的列名到格式字符
     * @param variableLengthColumns 有序的变长列名；为 null 时按 {@code str} 推断，保持 codes 顺序
     * @return schema
     * @throws SchemaViolationException 声明不一致时抛出
     */
    public static RowSchema fromCodes(Map<String, String> codes, Collection<String> variableLengthColumns) {
        if (codes == null || codes.isEmpty()) {
            throw new IllegalArgumentException("schema 至少需要一列");
        }
        Set<String> variable = variableLengthColumns == null ? null : new LinkedHashSet<>(variableLengthColumns);
        if (variable != null) {
            for (String name : variable) {
                if (!codes.containsKey(name)) {
                    throw new SchemaViolationException(name, "变长列未在 schema 中声明");
                }
            }
        }

        List<Column> columns = new ArrayList<>(codes.size());
        for (Map.Entry<String, String> entry : codes.entrySet()) {
            String name = entry.getKey();
            ColumnType type;
            try {
                type = ColumnType.fromCode(entry.getValue());
            } catch (IllegalArgumentException exception) {
                throw new SchemaViolationException(name, "未知列类型 " + entry.getValue());
            }
            boolean declaredVariable = variable == null ? type.isVariableLength() : variable.contains(name);
            if (declaredVariable && !type.isVariableLength()) {
                throw new SchemaViolationException(name, "变长列必须使用 str 格式");
            }
            if (!declaredVariable && type.isVariableLength()) {
                throw new SchemaViolationException(name, "定长列不能使用 str 格式");
            }
            if (variable == null || !declaredVariable) {
                columns.add(new Column(name, type));
            }
        }
        if (variable != null) {
            for (String name : variable) {
                columns.add(new Column(name, ColumnType.STRING));
            }
        }
        return new RowSchema(columns);
    }

    /**
     * 解析 {@code name:type,name:type} 形式的声明，type 可为格式字符或枚举名。
     */
    public static RowSchema parse(String declaration) {
        if (declaration == null || declaration.isBlank()) {
            throw new IllegalArgumentException("schema 声明不能为空");
        }
        Map<String, String> codes = new LinkedHashMap<>();
        for (String part : declaration.split(",")) {
            int separator = part.lastIndexOf(':');
            if (separator <= 0 || separator == part.length() - 1) {
                throw new IllegalArgumentException("schema 声明格式错误，应为 name:type: " + part);
            }
            String name = part.substring(0, separator).trim();
            if (codes.put(name, part.substring(separator + 1).trim()) != null) {
                throw new SchemaViolationException(name, "列名重复");
            }
        }
        return fromCodes(codes, null);
    }

    /**
     * 校验行包含全部声明列，并返回按 schema 顺序规整后的值。
     *
     * @param row 行
     * @return 规整后的列值
     * @throws SchemaViolationException 缺列、空值或类型不符时抛出，消息包含列名
     */
    public Map<String, Object> conform(Row row) {
        if (row == null) {
            throw new IllegalArgumentException("row 不能为空");
        }
        Map<String, Object> conformed = new LinkedHashMap<>();
        for (Column column : columns) {
            if (!row.has(column.name())) {
                throw new SchemaViolationException(column.name(), "行缺少列");
            }
            conformed.put(column.name(), column.type().coerce(column.name(), row.get(column.name())));
        }
        return conformed;
    }

    public List<Column> columns() {
        return columns;
    }

    public List<Column> fixedColumns() {
        return fixedColumns;
    }

    public List<Column> variableColumns() {
        return variableColumns;
    }

    public Column column(String name) {
        Column column = columnsByName.get(name);
        if (column == null) {
            throw new IllegalArgumentException("schema 中不存在列: " + name);
        }
        return column;
    }

    public boolean hasColumn(String name) {
        return columnsByName.containsKey(name);
    }

    public List<String> columnNames() {
        return List.copyOf(columnsByName.keySet());
    }

    /**
     * 定长区总字节数，编译期确定。
     */
    public int fixedWidth() {
        return fixedWidth;
    }

    /**
     * 对应的 struct 格式串，如 {@code if}。
     */
    public String structFormat() {
        StringBuilder format = new StringBuilder();
        for (Column column : fixedColumns) {
            format.append(column.type().code());
        }
        return format.toString();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof RowSchema that && columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "RowSchema(fixed=" + fixedColumns + ", variable=" + variableColumns + ")";
    }
}
