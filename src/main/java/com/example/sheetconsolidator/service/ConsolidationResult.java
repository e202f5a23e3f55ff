package com.example.sheetconsolidator.service;

import java.nio.file.Path;
import java.util.List;

public record ConsolidationResult(
        Path outputFile,
        List<String> processedSheets,
        List<String> failedSheets,
        int rowCount,
        List<String> columns,
        List<ConsolidationIssue> issues
) {
}
