package com.example.sheetconsolidator.cli;

import com.example.sheetconsolidator.service.ColumnConfig;
import com.example.sheetconsolidator.service.ColumnSpec;
import com.example.sheetconsolidator.service.ConsolidationListener;
import com.example.sheetconsolidator.service.ConsolidationRequest;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Prints human-readable progress of a run.
 */
class ConsoleProgressReporter implements ConsolidationListener {
    private static final String RULE = "=".repeat(60);

    private final PrintWriter out;

    ConsoleProgressReporter(PrintWriter out) {
        this.out = out;
    }

    void printHeader(ConsolidationRequest request) {
        out.println();
        out.println("Starting Sheet Consolidation");
        out.println("Input: " + request.inputFile());
        out.println("Output: " + request.outputFile());
        out.println("Sheet Range: " + request.sheetRange());
        out.println(request.columnConfig().isEmpty()
                ? "Column Properties: DISABLED (using raw data)"
                : "Column Properties: ENABLED");
        out.println(RULE);
        out.flush();
    }

    void printColumnConfig(Path configFile, ColumnConfig config) {
        out.println("Loaded column configuration from: " + configFile);
        if (config.isEmpty()) {
            out.flush();
            return;
        }
        out.println("Column Configuration:");
        for (Map.Entry<String, ColumnSpec> entry : config.columns().entrySet()) {
            List<String> properties = new ArrayList<>();
            if (entry.getValue().wordCount()) {
                properties.add("word_count");
            }
            String dtype = entry.getValue().dtype();
            if (dtype != null && !dtype.isBlank()) {
                properties.add("dtype=" + dtype);
            }
            out.println("    " + entry.getKey() + ": "
                    + (properties.isEmpty() ? "no transformations" : String.join(", ", properties)));
        }
        out.flush();
    }

    @Override
    public void onSheetsResolved(int totalSheets, List<String> targetSheets) {
        out.println("Total sheets found: " + totalSheets);
        out.println("Processing " + targetSheets.size() + " sheets: " + String.join(", ", targetSheets));
        out.flush();
    }

    @Override
    public void onSheetProcessed(int position, int total, String sheetName, int rowCount) {
        out.println(progress(position, total) + " " + sheetName + ": " + rowCount + " rows");
        out.flush();
    }

    @Override
    public void onSheetFailed(int position, int total, String sheetName, Exception error) {
        out.println(progress(position, total) + " " + sheetName + ": skipped (" + error.getMessage() + ")");
        out.flush();
    }

    @Override
    public void onCombining(int processedSheets) {
        out.println();
        out.println("Combining data from " + processedSheets + " sheets...");
        out.flush();
    }

    @Override
    public void onWriting(Path outputFile) {
        out.println("Saving to " + outputFile + "...");
        out.flush();
    }

    private String progress(int position, int total) {
        int width = String.valueOf(total).length();
        return String.format("[%" + width + "d/%d]", position, total);
    }
}
