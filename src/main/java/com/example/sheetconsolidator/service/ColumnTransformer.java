package com.example.sheetconsolidator.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.DateUtil;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Applies a {@link ColumnConfig} to one table: derives word-count columns and coerces column types.
 * A failing column is logged and recorded as an issue; the remaining columns are still processed.
 */
@Slf4j
@Component
public class ColumnTransformer {
    static final String WORD_COUNT_SUFFIX = "_word_count";

    private static final DateTimeFormatter TEXT_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss")
    );
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy-M-d"),
            DateTimeFormatter.ofPattern("yyyy/M/d"),
            DateTimeFormatter.ofPattern("yyyy.M.d"),
            DateTimeFormatter.ofPattern("yyyyMMdd"),
            DateTimeFormatter.ofPattern("M/d/yyyy")
    );

    /**
     * Transform {@code table} in place.
     *
     * @param table the sheet's table
     * @param config transform configuration, may be empty
     * @param sheetName sheet the table was read from, for warnings
     * @param issues receives one entry per column whose transform failed
     */
    public void apply(SheetTable table, ColumnConfig config, String sheetName, List<ConsolidationIssue> issues) {
        if (config == null || config.isEmpty()) {
            return;
        }
        for (Map.Entry<String, ColumnSpec> entry : config.columns().entrySet()) {
            String column = entry.getKey();
            ColumnSpec spec = entry.getValue();
            if (!table.hasColumn(column) || spec == null) {
                continue;
            }
            try {
                if (spec.wordCount()) {
                    table.setColumn(column + WORD_COUNT_SUFFIX, countWords(table.column(column)));
                }
                Optional<ColumnDtype> dtype = ColumnDtype.fromToken(spec.dtype());
                if (dtype.isPresent()) {
                    convert(table, column, dtype.get());
                }
            } catch (RuntimeException e) {
                log.warn("Could not apply properties to column '{}' of sheet '{}': {}", column, sheetName, e.getMessage());
                log.debug("Column transform failure", e);
                issues.add(new ConsolidationIssue(sheetName, column, e.getMessage()));
            }
        }
    }

    void convert(SheetTable table, String column, ColumnDtype dtype) {
        List<Object> values = table.column(column);
        switch (dtype) {
            case STRING -> table.setColumn(column, map(values, ColumnTransformer::stringValue));
            case INT -> table.setColumn(column, toIntegers(column, values));
            case FLOAT -> table.setColumn(column, map(values, v -> {
                BigDecimal number = toNumber(v);
                return number == null ? null : number.doubleValue();
            }));
            case BOOL -> table.setColumn(column, map(values, ColumnTransformer::toBoolean));
            case DATE -> table.setColumn(column, map(values, ColumnTransformer::toDateTime));
            case CATEGORY -> table.markCategorical(column);
            case AUTO -> {
            }
        }
    }

    static List<Object> countWords(List<Object> values) {
        return map(values, value -> {
            String text = stringValue(value);
            if (text == null || text.isBlank()) {
                return 0L;
            }
            return (long) text.trim().split("\\s+").length;
        });
    }

    /**
     * String form of a cell value as it is shown to users: integral numbers without a fraction,
     * date-times as {@code yyyy-MM-dd HH:mm:ss}.
     */
    static String stringValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.format(TEXT_DATE_TIME);
        }
        return value.toString();
    }

    private List<Object> toIntegers(String column, List<Object> values) {
        List<Object> result = new ArrayList<>(values.size());
        for (Object value : values) {
            BigDecimal number = toNumber(value);
            if (number == null) {
                result.add(null);
                continue;
            }
            try {
                result.add(number.longValueExact());
            } catch (ArithmeticException e) {
                throw new ColumnTransformException(column,
                        "cannot convert non-integral value " + number.toPlainString() + " to int");
            }
        }
        return result;
    }

    private static BigDecimal toNumber(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Long l) {
            return BigDecimal.valueOf(l);
        }
        if (value instanceof Double d) {
            return d.isNaN() || d.isInfinite() ? null : BigDecimal.valueOf(d);
        }
        if (value instanceof Boolean b) {
            return b ? BigDecimal.ONE : BigDecimal.ZERO;
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(trimmed);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Boolean toBoolean(Object value) {
        String text = stringValue(value);
        if (text == null) {
            return null;
        }
        return switch (text.toLowerCase(Locale.ROOT)) {
            case "true", "1" -> Boolean.TRUE;
            case "false", "0" -> Boolean.FALSE;
            default -> null;
        };
    }

    private static LocalDateTime toDateTime(Object value) {
        if (value instanceof LocalDateTime dateTime) {
            return dateTime;
        }
        if (value instanceof Long || value instanceof Double) {
            double serial = ((Number) value).doubleValue();
            return DateUtil.isValidExcelDate(serial) ? DateUtil.getLocalDateTime(serial) : null;
        }
        if (value instanceof String s) {
            return parseDateTime(s.trim());
        }
        return null;
    }

    private static LocalDateTime parseDateTime(String text) {
        if (text.isEmpty()) {
            return null;
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(text, format);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(text, format).atStartOfDay();
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return null;
    }

    private static List<Object> map(List<Object> values, Function<Object, Object> mapper) {
        List<Object> result = new ArrayList<>(values.size());
        for (Object value : values) {
            result.add(mapper.apply(value));
        }
        return result;
    }
}
