package com.example.sheetconsolidator.service;

/**
 * Thrown when a workbook, or one sheet of it, cannot be opened or parsed.
 */
public class WorkbookReadException extends ConsolidationException {
    public WorkbookReadException(String message) {
        super(message);
    }

    public WorkbookReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
