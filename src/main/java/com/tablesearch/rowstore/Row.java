package com.tablesearch.rowstore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一行数据：有序的列名到列值。
 *
 * @param values 列值，迭代顺序即列顺序
 */
public record Row(Map<String, Object> values) {

    public Row {
        if (values == null) {
            throw new IllegalArgumentException("values 不能为null");
        }
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * 以 name, value, name, value ... 的形式构造行。
     */
    public static Row of(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("参数必须成对出现");
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (int index = 0; index < namesAndValues.length; index += 2) {
            values.put((String) namesAndValues[index], namesAndValues[index + 1]);
        }
        return new Row(values);
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public Object get(String column) {
        return values.get(column);
    }
}
