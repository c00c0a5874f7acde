package com.tablesearch.rowstore;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RowSchemaTest {

    @Test
    @DisplayName("定长列在前，变长列在后，定长区宽度为各列宽度之和")
    void testLayout() {
        RowSchema schema = RowSchema.parse("id:i, title:str, score:f, flag:?, body:str");

        assertEquals(List.of("id", "score", "flag"),
            schema.fixedColumns().stream().map(RowSchema.Column::name).toList());
        assertEquals(List.of("title", "body"),
            schema.variableColumns().stream().map(RowSchema.Column::name).toList());
        assertEquals(9, schema.fixedWidth());
        assertEquals("if?", schema.structFormat());
        assertEquals(List.of("id", "title", "score", "flag", "body"), schema.columnNames());
    }

    @Test
    @DisplayName("显式变长列声明必须与 str 一致")
    void testFromCodesWithVariableColumns() {
        Map<String, String> codes = new LinkedHashMap<>();
        codes.put("id", "i");
        codes.put("text", "str");

        assertEquals(RowSchema.parse("id:i,text:str"), RowSchema.fromCodes(codes, List.of("text")));

        SchemaViolationException missingMarker = assertThrows(SchemaViolationException.class,
            () -> RowSchema.fromCodes(codes, List.of("id", "text")));
        assertEquals("id", missingMarker.getColumn());

        SchemaViolationException undeclared = assertThrows(SchemaViolationException.class,
            () -> RowSchema.fromCodes(codes, List.of()));
        assertEquals("text", undeclared.getColumn());

        assertThrows(SchemaViolationException.class, () -> RowSchema.fromCodes(codes, List.of("nope")));
    }

    @Test
    @DisplayName("显式变长列按列表顺序排在定长列之后并按此顺序编码")
    void testExplicitVariableColumnOrder() {
        Map<String, String> codes = new LinkedHashMap<>();
        codes.put("a", "str");
        codes.put("id", "b");
        codes.put("b", "str");

        RowSchema schema = RowSchema.fromCodes(codes, List.of("b", "a"));
        assertEquals(List.of("id", "b", "a"), schema.columnNames());
        assertEquals(List.of("b", "a"),
            schema.variableColumns().stream().map(RowSchema.Column::name).toList());

        byte[] record = new RowRecordCodec(schema, false)
            .encode(schema.conform(Row.of("a", "x", "id", 7, "b", "yy")));
        assertArrayEquals(new byte[]{7, 2, 0, 0, 0, 'y', 'y', 1, 0, 0, 0, 'x'}, record);
    }

    @Test
    @DisplayName("重复列名与非法声明")
    void testInvalidDeclarations() {
        assertThrows(SchemaViolationException.class, () -> RowSchema.parse("a:i,a:f"));
        assertThrows(SchemaViolationException.class, () -> RowSchema.parse("a:z"));
        assertThrows(IllegalArgumentException.class, () -> RowSchema.parse("a"));
        assertThrows(IllegalArgumentException.class, () -> RowSchema.parse(""));
    }

    @Test
    @DisplayName("规整行：按 schema 顺序返回，缺列时报告列名")
    void testConform() {
        RowSchema schema = RowSchema.parse("id:i,name:str");

        Map<String, Object> conformed = schema.conform(Row.of("name", "n", "id", 3L, "extra", true));
        assertEquals(List.of("id", "name"), List.copyOf(conformed.keySet()));
        assertEquals(3, conformed.get("id"));

        SchemaViolationException exception = assertThrows(SchemaViolationException.class,
            () -> schema.conform(Row.of("id", 1)));
        assertEquals("name", exception.getColumn());
    }
}
