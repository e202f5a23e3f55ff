package com.example.sheetconsolidator.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Column name to {@link ColumnSpec} mapping, in file order. Immutable once loaded.
 */
public record ColumnConfig(Map<String, ColumnSpec> columns) {

    private static final ColumnConfig EMPTY = new ColumnConfig(Map.of());

    public ColumnConfig {
        columns = columns == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public static ColumnConfig empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }
}
