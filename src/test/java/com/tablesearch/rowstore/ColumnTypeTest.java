package com.tablesearch.rowstore;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ColumnTypeTest {

    @ParameterizedTest
    @CsvSource({
        "b, INT8, 1",
        "h, INT16, 2",
        "i, INT32, 4",
        "q, INT64, 8",
        "f, FLOAT32, 4",
        "d, FLOAT64, 8",
        "?, BOOL, 1",
        "str, STRING, -1"
    })
    @DisplayName("格式字符与枚举名互相解析")
    void testFromCode(String code, ColumnType type, int width) {
        assertEquals(type, ColumnType.fromCode(code));
        assertEquals(type, ColumnType.fromCode(type.name().toLowerCase()));
        assertEquals(code, type.code());
        assertEquals(width, type.width());
    }

    @Test
    @DisplayName("未知格式字符")
    void testUnknownCode() {
        assertThrows(IllegalArgumentException.class, () -> ColumnType.fromCode("x"));
    }

    @Test
    @DisplayName("数值规整为标准类型")
    void testCoerceNumbers() {
        assertEquals((byte) 12, ColumnType.INT8.coerce("c", 12));
        assertEquals((short) -300, ColumnType.INT16.coerce("c", -300L));
        assertEquals(7, ColumnType.INT32.coerce("c", new BigInteger("7")));
        assertEquals(9_000_000_000L, ColumnType.INT64.coerce("c", new BigDecimal("9000000000")));
        assertEquals(1.1f, ColumnType.FLOAT32.coerce("c", new BigDecimal("1.1")));
        assertEquals(2.5f, ColumnType.FLOAT32.coerce("c", 2.5d));
        assertEquals(0.1d, ColumnType.FLOAT64.coerce("c", new BigDecimal("0.1")));
        assertEquals(3.0d, ColumnType.FLOAT64.coerce("c", 3));
    }

    @Test
    @DisplayName("越界、类型不符与空值抛出 SchemaViolationException 并携带列名")
    void testCoerceViolations() {
        SchemaViolationException overflow = assertThrows(SchemaViolationException.class,
            () -> ColumnType.INT8.coerce("age", 128));
        assertEquals("age", overflow.getColumn());
        assertTrue(overflow.getMessage().contains("age"));

        assertThrows(SchemaViolationException.class, () -> ColumnType.INT32.coerce("c", 1.5d));
        assertThrows(SchemaViolationException.class, () -> ColumnType.INT32.coerce("c", "12"));
        assertThrows(SchemaViolationException.class, () -> ColumnType.BOOL.coerce("c", 1));
        assertThrows(SchemaViolationException.class, () -> ColumnType.STRING.coerce("c", 5));
        assertThrows(SchemaViolationException.class, () -> ColumnType.FLOAT64.coerce("c", null));
    }
}
