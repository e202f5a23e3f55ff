package com.example.sheetconsolidator.service;

/**
 * Thrown when the consolidated workbook or a configuration template cannot be written.
 */
public class OutputWriteException extends ConsolidationException {
    public OutputWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
