package com.example.sheetconsolidator.service;

/**
 * Thrown when every targeted sheet failed, so there is nothing to write.
 */
public class NoDataProcessedException extends ConsolidationException {
    public NoDataProcessedException(int targetedSheets) {
        super("No data was processed successfully: all " + targetedSheets + " targeted sheet"
                + (targetedSheets == 1 ? "" : "s") + " failed");
    }
}
