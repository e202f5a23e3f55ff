package com.example.sheetconsolidator.service;

import java.nio.file.Path;

public record ConsolidationRequest(
        Path inputFile,
        Path outputFile,
        String sheetRange,
        ColumnConfig columnConfig
) {
    public ConsolidationRequest {
        if (columnConfig == null) {
            columnConfig = ColumnConfig.empty();
        }
    }
}
