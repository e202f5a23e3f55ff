package com.example.sheetconsolidator.service;

import lombok.Getter;

/**
 * Thrown when a configured transform cannot be applied to a column. Always recovered by the
 * caller: the column keeps its previous values.
 */
@Getter
public class ColumnTransformException extends ConsolidationException {
    private final String columnName;

    public ColumnTransformException(String columnName, String message) {
        super(message);
        this.columnName = columnName;
    }
}
