package com.tablesearch.rowstore;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 子进程入口：读取请求文件中的行号，顺序读取后把行写入响应文件。
 *
 * 用法：{@code RowReadWorker <request.json> <response.json>}，成功退出码为 0。
 */
public final class RowReadWorker {
    private static final Logger logger = LoggerFactory.getLogger(RowReadWorker.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    /**
     * 子进程请求。
     *
     * @param binPath 行数据文件绝对路径
     * @param rowNumbers 待读取的行号
     */
    public record Request(String binPath, int[] rowNumbers) {
    }

    private RowReadWorker() {
    }

    /**
     * 转为响应中的值：浮点列传原始位模式，NaN、无穷与 -0.0 不经十进制文本往返。
     */
    static Map<String, Object> toWire(RowSchema schema, Row row) {
        Map<String, Object> wire = new LinkedHashMap<>();
        for (RowSchema.Column column : schema.columns()) {
            Object value = row.get(column.name());
            if (column.type() == ColumnType.FLOAT32) {
                value = Float.floatToRawIntBits((Float) value);
            } else if (column.type() == ColumnType.FLOAT64) {
                value = Double.doubleToRawLongBits((Double) value);
            }
            wire.put(column.name(), value);
        }
        return wire;
    }

    /**
     * {@link #toWire} 的逆过程，其余列按 schema 规整。
     *
     * @throws SchemaViolationException 缺列或类型不符时抛出
     */
    static Row fromWire(RowSchema schema, Map<String, Object> wire) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (RowSchema.Column column : schema.columns()) {
            String name = column.name();
            Object value = wire.get(name);
            if (value == null) {
                throw new SchemaViolationException(name, "子进程响应缺少列");
            }
            switch (column.type()) {
                case FLOAT32 -> values.put(name, Float.intBitsToFloat(bits(name, value).intValue()));
                case FLOAT64 -> values.put(name, Double.longBitsToDouble(bits(name, value).longValue()));
                default -> values.put(name, column.type().coerce(name, value));
            }
        }
        return new Row(values);
    }

    private static Number bits(String column, Object value) {
        if (value instanceof Integer || value instanceof Long) {
            return (Number) value;
        }
        throw new SchemaViolationException(column, "浮点列需要位模式整数, actual=" + value.getClass().getSimpleName());
    }

    public static void main(String[] args) {
        if (args.length != 2) {
            logger.error("参数错误，用法: RowReadWorker <request.json> <response.json>");
            System.exit(2);
        }
        try {
            Path requestPath = Path.of(args[0]);
            Path responsePath = Path.of(args[1]);
            Request request = OBJECT_MAPPER.readValue(requestPath.toFile(), Request.class);

            RowStore store = RowStore.open(Path.of(request.binPath()));
            List<Row> rows = store.readRows(request.rowNumbers(), ReadStrategy.SEQUENTIAL);
            List<Map<String, Object>> values = new ArrayList<>(rows.size());
            for (Row row : rows) {
                values.add(toWire(store.schema(), row));
            }
            OBJECT_MAPPER.writeValue(responsePath.toFile(), values);
            logger.debug("子进程读取完成: file={}, rows={}", request.binPath(), rows.size());
        } catch (Exception exception) {
            logger.error("子进程读取失败", exception);
            System.exit(1);
        }
    }
}
