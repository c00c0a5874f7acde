package com.tablesearch.rowstore;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Locale;

/**
 * 列类型。定长类型沿用 struct 格式字符，变长字符串使用 {@code str} 标记。
 */
public enum ColumnType {
    INT8("b", Byte.BYTES),
    INT16("h", Short.BYTES),
    INT32("i", Integer.BYTES),
    INT64("q", Long.BYTES),
    FLOAT32("f", Float.BYTES),
    FLOAT64("d", Double.BYTES),
    BOOL("?", 1),
    STRING("str", -1);

    private final String code;
    private final int width;

    ColumnType(String code, int width) {
        this.code = code;
        this.width = width;
    }

    public String code() {
        return code;
    }

    /**
     * 定长类型的字节宽度，变长类型返回 -1。
     */
    public int width() {
        return width;
    }

    public boolean isVariableLength() {
        return this == STRING;
    }

    /**
     * 按格式字符或枚举名解析列类型。
     *
     * @param codeOrName 如 {@code i}、{@code str}、{@code INT32}
     * @return 列类型
     * @throws IllegalArgumentException 无法识别时抛出
     */
    public static ColumnType fromCode(String codeOrName) {
        if (codeOrName == null) {
            throw new IllegalArgumentException("列类型不能为空");
        }
        String trimmed = codeOrName.trim();
        for (ColumnType type : values()) {
            if (type.code.equals(trimmed) || type.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知列类型: " + codeOrName);
    }

    /**
     * 将任意来源的值规整为该类型的标准 Java 类型，整数类型做范围检查。
     *
     * @param column 列名（用于错误消息）
     * @param value 原始值
     * @return Byte/Short/Integer/Long/Float/Double/Boolean/String 之一
     * @throws SchemaViolationException 值为空、类型不符或越界时抛出
     */
    public Object coerce(String column, Object value) {
        if (value == null) {
            throw new SchemaViolationException(column, "列值不能为null");
        }
        switch (this) {
            case INT8:
                return (byte) integral(column, value, Byte.MIN_VALUE, Byte.MAX_VALUE);
            case INT16:
                return (short) integral(column, value, Short.MIN_VALUE, Short.MAX_VALUE);
            case INT32:
                return (int) integral(column, value, Integer.MIN_VALUE, Integer.MAX_VALUE);
            case INT64:
                return integral(column, value, Long.MIN_VALUE, Long.MAX_VALUE);
            case FLOAT32:
                if (value instanceof BigDecimal decimal) {
                    return Float.parseFloat(decimal.toString());
                }
                return number(column, value).floatValue();
            case FLOAT64:
                if (value instanceof BigDecimal decimal) {
                    return Double.parseDouble(decimal.toString());
                }
                return number(column, value).doubleValue();
            case BOOL:
                if (value instanceof Boolean bool) {
                    return bool;
                }
                throw new SchemaViolationException(column, "BOOL 列需要布尔值, actual=" + value.getClass().getSimpleName());
            case STRING:
                if (value instanceof CharSequence text) {
                    return text.toString();
                }
                throw new SchemaViolationException(column, "STRING 列需要字符串, actual=" + value.getClass().getSimpleName());
            default:
                throw new IllegalStateException("未处理的列类型: " + this);
        }
    }

    /**
     * 以小端序写入定长值，值需已规整。
     */
    void write(ByteBuffer buffer, Object value) {
        switch (this) {
            case INT8 -> buffer.put((Byte) value);
            case INT16 -> buffer.putShort((Short) value);
            case INT32 -> buffer.putInt((Integer) value);
            case INT64 -> buffer.putLong((Long) value);
            case FLOAT32 -> buffer.putFloat((Float) value);
            case FLOAT64 -> buffer.putDouble((Double) value);
            case BOOL -> buffer.put((byte) (((Boolean) value) ? 1 : 0));
            default -> throw new IllegalStateException("变长类型不能写入定长区: " + this);
        }
    }

    /**
     * 从缓冲区读取定长值。
     */
    Object read(ByteBuffer buffer) {
        return switch (this) {
            case INT8 -> buffer.get();
            case INT16 -> buffer.getShort();
            case INT32 -> buffer.getInt();
            case INT64 -> buffer.getLong();
            case FLOAT32 -> buffer.getFloat();
            case FLOAT64 -> buffer.getDouble();
            case BOOL -> buffer.get() != 0;
            default -> throw new IllegalStateException("变长类型不能从定长区读取: " + this);
        };
    }

    private static Number number(String column, Object value) {
        if (value instanceof Number number) {
            return number;
        }
        throw new SchemaViolationException(column, "数值列需要数字, actual=" + value.getClass().getSimpleName());
    }

    private static long integral(String column, Object value, long min, long max) {
        Number number = number(column, value);
        long result;
        if (number instanceof Byte || number instanceof Short || number instanceof Integer || number instanceof Long) {
            result = number.longValue();
        } else if (number instanceof BigInteger bigInteger && bigInteger.bitLength() < Long.SIZE) {
            result = bigInteger.longValue();
        } else if (number instanceof BigDecimal decimal && decimal.stripTrailingZeros().scale() <= 0) {
            try {
                result = decimal.longValueExact();
            } catch (ArithmeticException exception) {
                throw new SchemaViolationException(column, "整数越界, value=" + value);
            }
        } else {
            throw new SchemaViolationException(column, "整数列需要整数值, actual=" + value);
        }
        if (result < min || result > max) {
            throw new SchemaViolationException(column, "整数越界, value=" + value);
        }
        return result;
    }
}
