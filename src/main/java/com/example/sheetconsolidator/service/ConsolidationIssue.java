package com.example.sheetconsolidator.service;

public record ConsolidationIssue(
        String sheetName,
        String columnName,
        String message
) {
}
