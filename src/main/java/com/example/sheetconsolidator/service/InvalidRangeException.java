package com.example.sheetconsolidator.service;

import lombok.Getter;

/**
 * Thrown when a sheet range expression is malformed or points outside the workbook.
 */
@Getter
public class InvalidRangeException extends ConsolidationException {
    private final String rangeExpression;
    private final int sheetCount;

    /**
     * Create a new exception.
     *
     * @param rangeExpression the expression as the user typed it
     * @param sheetCount number of sheets in the workbook
     * @param reason what was wrong with the expression
     */
    public InvalidRangeException(String rangeExpression, int sheetCount, String reason) {
        super("Invalid sheet range format: " + rangeExpression + " (" + reason + ", workbook has "
                + sheetCount + " sheet" + (sheetCount == 1 ? "" : "s") + "). Use format like '1-5' or '1,3,5'");
        this.rangeExpression = rangeExpression;
        this.sheetCount = sheetCount;
    }
}
