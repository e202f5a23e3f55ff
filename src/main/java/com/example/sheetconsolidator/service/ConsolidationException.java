package com.example.sheetconsolidator.service;

/**
 * Base type for every failure raised while consolidating sheets or generating a template.
 */
public class ConsolidationException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public ConsolidationException(String message) {
        super(message);
    }

    /**
     * Create a new exception with a cause.
     *
     * @param message error message
     * @param cause underlying failure
     */
    public ConsolidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
