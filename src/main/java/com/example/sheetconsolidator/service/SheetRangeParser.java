package com.example.sheetconsolidator.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a 1-based range expression such as {@code 2-5} or {@code 1,3,3,2} into zero-based sheet
 * indexes. An expression containing {@code -} is a range, anything else a comma list.
 */
@Component
public class SheetRangeParser {

    public List<Integer> parse(String rangeExpression, int sheetCount) {
        if (rangeExpression == null || rangeExpression.isBlank()) {
            throw new InvalidRangeException(rangeExpression, sheetCount, "empty expression");
        }
        if (rangeExpression.contains("-")) {
            return parseDashRange(rangeExpression, sheetCount);
        }
        return parseCommaList(rangeExpression, sheetCount);
    }

    private List<Integer> parseDashRange(String expression, int sheetCount) {
        String[] parts = expression.split("-", -1);
        if (parts.length != 2) {
            throw new InvalidRangeException(expression, sheetCount, "expected exactly one '-'");
        }
        int start = parseSheetNumber(parts[0], expression, sheetCount);
        int end = parseSheetNumber(parts[1], expression, sheetCount);
        if (start > end) {
            throw new InvalidRangeException(expression, sheetCount, "start " + start + " is after end " + end);
        }
        List<Integer> indexes = new ArrayList<>(end - start + 1);
        for (int sheet = start; sheet <= end; sheet++) {
            indexes.add(sheet - 1);
        }
        return indexes;
    }

    private List<Integer> parseCommaList(String expression, int sheetCount) {
        List<Integer> indexes = new ArrayList<>();
        for (String token : expression.split(",", -1)) {
            indexes.add(parseSheetNumber(token, expression, sheetCount) - 1);
        }
        return indexes;
    }

    private int parseSheetNumber(String token, String expression, int sheetCount) {
        String trimmed = token.trim();
        int sheet;
        try {
            sheet = Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            throw new InvalidRangeException(expression, sheetCount, "'" + trimmed + "' is not a sheet number");
        }
        if (sheet < 1 || sheet > sheetCount) {
            throw new InvalidRangeException(expression, sheetCount, "sheet " + sheet + " is out of range");
        }
        return sheet;
    }
}
