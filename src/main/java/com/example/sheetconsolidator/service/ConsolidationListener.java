package com.example.sheetconsolidator.service;

import java.nio.file.Path;
import java.util.List;

/**
 * Receives progress of a consolidation run. All methods are called on the thread running it.
 */
public interface ConsolidationListener {

    ConsolidationListener NONE = new ConsolidationListener() {
    };

    default void onStateChanged(ConsolidationState state) {
    }

    default void onSheetsResolved(int totalSheets, List<String> targetSheets) {
    }

    default void onSheetProcessed(int position, int total, String sheetName, int rowCount) {
    }

    default void onSheetFailed(int position, int total, String sheetName, Exception error) {
    }

    default void onCombining(int processedSheets) {
    }

    default void onWriting(Path outputFile) {
    }
}
