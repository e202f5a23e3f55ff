package com.example.sheetconsolidator.service;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnTransformerTest {

    private final ColumnTransformer transformer = new ColumnTransformer();
    private final List<ConsolidationIssue> issues = new ArrayList<>();

    @Test
    void wordCountDerivesNewColumnAndKeepsOriginal() {
        SheetTable table = table("Text", "the quick fox", "", null, "single", "  padded   words ");

        transformer.apply(table, config("Text", new ColumnSpec(true, null, null)), "S1", issues);

        assertThat(table.columns()).containsExactly("Text", "Text_word_count");
        assertThat(table.column("Text_word_count")).containsExactly(3L, 0L, 0L, 1L, 2L);
        assertThat(table.column("Text")).containsExactly("the quick fox", "", null, "single", "  padded   words ");
        assertThat(issues).isEmpty();
    }

    @Test
    void intCoercionNullsUnparseableValues() {
        SheetTable table = table("N", "3", "x", "", "5");

        transformer.apply(table, config("N", new ColumnSpec(false, "int", null)), "S1", issues);

        assertThat(table.column("N")).containsExactly(3L, null, null, 5L);
    }

    @Test
    void intCoercionAcceptsNumbersAndBooleans() {
        SheetTable table = table("N", 7L, 2.0, true, " 12 ");

        transformer.apply(table, config("N", new ColumnSpec(false, "integer", null)), "S1", issues);

        assertThat(table.column("N")).containsExactly(7L, 2L, 1L, 12L);
    }

    @Test
    void intCoercionOfFractionalValueFailsOnlyThatColumn() {
        SheetTable table = new SheetTable();
        table.addRow(row("Price", "3.5", "Qty", "2"));
        table.addRow(row("Price", "4", "Qty", "x"));
        Map<String, ColumnSpec> columns = new LinkedHashMap<>();
        columns.put("Price", new ColumnSpec(false, "int", null));
        columns.put("Qty", new ColumnSpec(false, "number", null));

        transformer.apply(table, new ColumnConfig(columns), "Prices", issues);

        assertThat(table.column("Price")).containsExactly("3.5", "4");
        assertThat(table.column("Qty")).containsExactly(2L, null);
        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.sheetName()).isEqualTo("Prices");
            assertThat(issue.columnName()).isEqualTo("Price");
            assertThat(issue.message()).contains("3.5");
        });
    }

    @Test
    void floatCoercion() {
        SheetTable table = table("F", "1.25", 3L, "n/a", null);

        transformer.apply(table, config("F", new ColumnSpec(false, "decimal", null)), "S1", issues);

        assertThat(table.column("F")).containsExactly(1.25, 3.0, null, null);
    }

    @Test
    void boolCoercionMapsKnownTokensOnly() {
        SheetTable table = table("B", "True", "0", "yes", "FALSE");

        transformer.apply(table, config("B", new ColumnSpec(false, "bool", null)), "S1", issues);

        assertThat(table.column("B")).containsExactly(true, false, null, false);
    }

    @Test
    void boolCoercionOfNativeValues() {
        SheetTable table = table("B", true, 1L, 0L, null);

        transformer.apply(table, config("B", new ColumnSpec(false, "BOOLEAN", null)), "S1", issues);

        assertThat(table.column("B")).containsExactly(true, true, false, null);
    }

    @Test
    void stringCoercionStringifiesValues() {
        LocalDateTime noon = LocalDateTime.of(2024, 3, 1, 12, 0);
        SheetTable table = table("S", 42L, 1.5, true, noon, null);

        transformer.apply(table, config("S", new ColumnSpec(false, "text", null)), "S1", issues);

        assertThat(table.column("S")).containsExactly("42", "1.5", "true", "2024-03-01 12:00:00", null);
    }

    @Test
    void dateCoercionParsesCommonForms() {
        LocalDateTime existing = LocalDateTime.of(2023, 12, 31, 8, 30);
        SheetTable table = table("D", "2024-01-05", "2024/02/03", "2024-01-05T10:15:30", existing, "soon", 45292L);

        transformer.apply(table, config("D", new ColumnSpec(false, "date", null)), "S1", issues);

        assertThat(table.column("D")).containsExactly(
                LocalDateTime.of(2024, 1, 5, 0, 0),
                LocalDateTime.of(2024, 2, 3, 0, 0),
                LocalDateTime.of(2024, 1, 5, 10, 15, 30),
                existing,
                null,
                LocalDateTime.of(2024, 1, 1, 0, 0));
    }

    @Test
    void categoryMarksColumnWithoutChangingValues() {
        SheetTable table = table("C", "red", "blue");

        transformer.apply(table, config("C", new ColumnSpec(false, "category", null)), "S1", issues);

        assertThat(table.isCategorical("C")).isTrue();
        assertThat(table.column("C")).containsExactly("red", "blue");
    }

    @Test
    void autoAndUnknownDtypesLeaveColumnUnchanged() {
        SheetTable table = table("X", "1", "2");

        transformer.apply(table, config("X", new ColumnSpec(false, "auto", null)), "S1", issues);
        transformer.apply(table, config("X", new ColumnSpec(false, "complex128", null)), "S1", issues);

        assertThat(table.column("X")).containsExactly("1", "2");
        assertThat(issues).isEmpty();
    }

    @Test
    void unconfiguredAndMissingColumnsAreIgnored() {
        SheetTable table = table("Present", "a b");

        transformer.apply(table, config("Absent", new ColumnSpec(true, "int", null)), "S1", issues);

        assertThat(table.columns()).containsExactly("Present");
        assertThat(table.column("Present")).containsExactly("a b");
        assertThat(issues).isEmpty();
    }

    @Test
    void wordCountUsesValueBeforeCoercion() {
        SheetTable table = table("T", "one two", "3");

        transformer.apply(table, config("T", new ColumnSpec(true, "int", null)), "S1", issues);

        assertThat(table.column("T_word_count")).containsExactly(2L, 1L);
        assertThat(table.column("T")).containsExactly(null, 3L);
    }

    private static SheetTable table(String column, Object... values) {
        SheetTable table = new SheetTable(List.of(column));
        for (Object value : values) {
            Map<String, Object> row = new HashMap<>();
            row.put(column, value);
            table.addRow(row);
        }
        return table;
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    private static ColumnConfig config(String column, ColumnSpec spec) {
        return new ColumnConfig(Map.of(column, spec));
    }
}
