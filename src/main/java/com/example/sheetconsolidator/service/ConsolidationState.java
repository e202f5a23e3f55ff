package com.example.sheetconsolidator.service;

public enum ConsolidationState {
    IDLE,
    VALIDATING,
    RANGE_RESOLVING,
    PROCESSING,
    COMBINING,
    WRITING,
    DONE,
    FAILED,
    INTERRUPTED
}
