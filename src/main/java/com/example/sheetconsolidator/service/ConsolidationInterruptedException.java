package com.example.sheetconsolidator.service;

/**
 * Thrown when a run observes a cancellation request between two sheets.
 */
public class ConsolidationInterruptedException extends ConsolidationException {
    public ConsolidationInterruptedException(int processedSheets, int targetedSheets) {
        super("Operation interrupted by user after " + processedSheets + " of " + targetedSheets + " sheets");
    }
}
