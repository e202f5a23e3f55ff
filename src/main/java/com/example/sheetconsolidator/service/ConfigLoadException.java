package com.example.sheetconsolidator.service;

/**
 * Thrown when a column configuration file is missing, unreadable or structurally invalid.
 */
public class ConfigLoadException extends ConsolidationException {
    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
