package com.example.sheetconsolidator.service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Target types a configured column can be coerced to, with the tokens accepted for each.
 */
public enum ColumnDtype {
    STRING(List.of("string", "str", "text")),
    INT(List.of("int", "integer", "number")),
    FLOAT(List.of("float", "decimal")),
    BOOL(List.of("bool", "boolean")),
    DATE(List.of("date", "datetime")),
    CATEGORY(List.of("category")),
    // template placeholder, no coercion
    AUTO(List.of("auto"));

    private final List<String> tokens;

    ColumnDtype(List<String> tokens) {
        this.tokens = tokens;
    }

    public String token() {
        return tokens.get(0);
    }

    /**
     * Resolve a configuration token, ignoring case and surrounding whitespace.
     *
     * @param token dtype as written in the configuration file
     * @return the matching type, empty when the token is blank or unknown
     */
    public static Optional<ColumnDtype> fromToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        for (ColumnDtype dtype : values()) {
            if (dtype.tokens.contains(normalized)) {
                return Optional.of(dtype);
            }
        }
        return Optional.empty();
    }
}
