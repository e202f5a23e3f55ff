package com.example.sheetconsolidator.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Per-column instructions of a transform configuration entry.
 *
 * @param wordCount derive a {@code <column>_word_count} column
 * @param dtype type token to coerce the column to, {@code null} for none
 * @param description free text, ignored by the transforms
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"word_count", "dtype", "description"})
public record ColumnSpec(
        @JsonProperty("word_count") boolean wordCount,
        @JsonProperty("dtype") String dtype,
        @JsonProperty("description") String description
) {
    public static ColumnSpec template(String columnName) {
        return new ColumnSpec(false, ColumnDtype.AUTO.token(), "Column: " + columnName);
    }

    public boolean hasTransform() {
        return wordCount || ColumnDtype.fromToken(dtype).filter(d -> d != ColumnDtype.AUTO).isPresent();
    }
}
