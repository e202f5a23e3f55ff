package com.example.sheetconsolidator.service;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Thrown when the input workbook does not exist.
 */
@Getter
public class InputNotFoundException extends ConsolidationException {
    private final Path inputFile;

    public InputNotFoundException(Path inputFile) {
        super("Input file not found: " + inputFile);
        this.inputFile = inputFile;
    }
}
