package com.example.sheetconsolidator.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory table of one sheet: ordered column names and ordered rows. A cell missing from a row
 * reads as {@code null}.
 */
public class SheetTable {
    private final LinkedHashSet<String> columns = new LinkedHashSet<>();
    private final List<Map<String, Object>> rows = new ArrayList<>();
    private final Set<String> categoricalColumns = new LinkedHashSet<>();

    public SheetTable() {
    }

    public SheetTable(List<String> columns) {
        this.columns.addAll(columns);
    }

    public List<String> columns() {
        return List.copyOf(columns);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int rowCount() {
        return rows.size();
    }

    public void addColumn(String column) {
        columns.add(column);
    }

    /**
     * Append a row. Keys that are not yet columns of the table are added as columns.
     */
    public void addRow(Map<String, Object> values) {
        columns.addAll(values.keySet());
        rows.add(new HashMap<>(values));
    }

    public Object get(int row, String column) {
        return rows.get(row).get(column);
    }

    public Map<String, Object> row(int row) {
        Map<String, Object> ordered = new LinkedHashMap<>();
        Map<String, Object> values = rows.get(row);
        for (String column : columns) {
            ordered.put(column, values.get(column));
        }
        return ordered;
    }

    public List<Object> column(String column) {
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    /**
     * Replace every value of a column, adding the column at the end if it is new.
     *
     * @param values one value per row, in row order
     */
    public void setColumn(String column, List<?> values) {
        if (values.size() != rows.size()) {
            throw new IllegalArgumentException("Column '" + column + "' has " + values.size()
                    + " values but the table has " + rows.size() + " rows");
        }
        columns.add(column);
        for (int r = 0; r < rows.size(); r++) {
            rows.get(r).put(column, values.get(r));
        }
    }

    public void fillColumn(String column, Object value) {
        setColumn(column, Collections.nCopies(rows.size(), value));
    }

    public void markCategorical(String column) {
        categoricalColumns.add(column);
    }

    public boolean isCategorical(String column) {
        return categoricalColumns.contains(column);
    }

    /**
     * Row-wise union of tables. Columns keep first-seen order across the inputs; cells of columns a
     * table does not have are {@code null}.
     */
    public static SheetTable concat(List<SheetTable> tables) {
        SheetTable combined = new SheetTable();
        for (SheetTable table : tables) {
            combined.columns.addAll(table.columns);
            combined.categoricalColumns.addAll(table.categoricalColumns);
            for (Map<String, Object> row : table.rows) {
                combined.rows.add(new HashMap<>(row));
            }
        }
        return combined;
    }
}
