package com.example.sheetconsolidator.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads sheets of a workbook into {@link SheetTable}s and writes a table as a one-sheet workbook.
 * The first row of a sheet is its header.
 */
@Slf4j
@Component
public class WorkbookIo {
    private static final String DATE_TIME_FORMAT = "yyyy-mm-dd hh:mm:ss";
    private static final int MAX_COLUMN_WIDTH_CHARS = 80;
    // doubles above this cannot all be represented exactly as longs
    private static final double MAX_EXACT_INTEGER = 9_007_199_254_740_992d;

    public List<String> listSheetNames(Path workbookFile) {
        try (Workbook workbook = open(workbookFile)) {
            List<String> names = new ArrayList<>();
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                names.add(workbook.getSheetName(i));
            }
            return names;
        } catch (IOException e) {
            throw new WorkbookReadException("Failed to read Excel file " + workbookFile + ": " + e.getMessage(), e);
        }
    }

    public SheetTable readSheet(Path workbookFile, String sheetName) {
        return readSheet(workbookFile, sheetName, -1);
    }

    /**
     * Read one sheet.
     *
     * @param workbookFile workbook to read
     * @param sheetName name of the sheet
     * @param maxRows maximum number of data rows to read, negative for all
     * @return the sheet's table, without columns if the sheet is empty
     */
    public SheetTable readSheet(Path workbookFile, String sheetName, int maxRows) {
        try (Workbook workbook = open(workbookFile)) {
            Sheet sheet = workbook.getSheet(sheetName);
            if (sheet == null) {
                throw new WorkbookReadException("Sheet '" + sheetName + "' not found in " + workbookFile);
            }
            return toTable(sheet, maxRows);
        } catch (IOException e) {
            throw new WorkbookReadException("Failed to read sheet '" + sheetName + "': " + e.getMessage(), e);
        }
    }

    /**
     * Write {@code table} as the only sheet of a new workbook, replacing {@code outputFile} once the
     * workbook has been written completely.
     */
    public void writeTable(SheetTable table, Path outputFile, String sheetName) {
        Path target = outputFile.toAbsolutePath();
        try {
            Path directory = target.getParent();
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, ".consolidating-", ".tmp");
            try {
                try (Workbook workbook = new XSSFWorkbook();
                     OutputStream out = Files.newOutputStream(temp)) {
                    fillSheet(workbook, workbook.createSheet(sheetName), table);
                    workbook.write(out);
                }
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(temp);
            }
            log.debug("Wrote {} rows to {}", table.rowCount(), target);
        } catch (IOException | RuntimeException e) {
            throw new OutputWriteException("Failed to write " + outputFile + ": " + e.getMessage(), e);
        }
    }

    private Workbook open(Path workbookFile) {
        try {
            return WorkbookFactory.create(workbookFile.toFile(), null, true);
        } catch (IOException | RuntimeException e) {
            throw new WorkbookReadException("Failed to read Excel file " + workbookFile + ": " + e.getMessage(), e);
        }
    }

    private SheetTable toTable(Sheet sheet, int maxRows) {
        if (sheet.getPhysicalNumberOfRows() == 0) {
            return new SheetTable();
        }
        int headerRowIndex = sheet.getFirstRowNum();
        Row headerRow = sheet.getRow(headerRowIndex);

        List<Map<Integer, Object>> dataRows = new ArrayList<>();
        int width = Math.max(headerRow.getLastCellNum(), 0);
        for (int r = headerRowIndex + 1; r <= sheet.getLastRowNum(); r++) {
            if (maxRows >= 0 && dataRows.size() >= maxRows) {
                break;
            }
            Row row = sheet.getRow(r);
            if (row == null || row.getLastCellNum() < 0) {
                continue;
            }
            Map<Integer, Object> values = new HashMap<>();
            for (int c = Math.max(row.getFirstCellNum(), 0); c < row.getLastCellNum(); c++) {
                Object value = cellValue(row.getCell(c));
                if (value != null) {
                    values.put(c, value);
                }
            }
            if (values.isEmpty()) {
                continue;
            }
            width = Math.max(width, row.getLastCellNum());
            dataRows.add(values);
        }

        List<String> headers = resolveHeaders(headerRow, width, dataRows);
        SheetTable table = new SheetTable();
        for (String header : headers) {
            if (header != null) {
                table.addColumn(header);
            }
        }
        for (Map<Integer, Object> values : dataRows) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int c = 0; c < headers.size(); c++) {
                if (headers.get(c) != null) {
                    row.put(headers.get(c), values.get(c));
                }
            }
            table.addRow(row);
        }
        return table;
    }

    /**
     * Header name per column index. Blank headers become {@code Unnamed: <index>}, or {@code null}
     * (column dropped) when the column holds no data either. Repeated names get the first free {@code .n} suffix.
     */
    private List<String> resolveHeaders(Row headerRow, int width, List<Map<Integer, Object>> dataRows) {
        DataFormatter fmt = new DataFormatter();
        Set<String> seen = new HashSet<>();
        List<String> headers = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            Cell cell = headerRow.getCell(c);
            String name = cell == null ? "" : fmt.formatCellValue(cell).trim();
            if (name.isBlank()) {
                final int column = c;
                boolean hasData = dataRows.stream().anyMatch(values -> values.containsKey(column));
                if (!hasData) {
                    headers.add(null);
                    continue;
                }
                name = "Unnamed: " + c;
            }
            String unique = name;
            for (int suffix = 1; seen.contains(unique); suffix++) {
                unique = name + "." + suffix;
            }
            seen.add(unique);
            headers.add(unique);
        }
        return headers;
    }

    private Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType cellType = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        switch (cellType) {
            case STRING:
                String text = cell.getStringCellValue();
                return text == null || text.isEmpty() ? null : text;
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                double numeric = cell.getNumericCellValue();
                if (numeric == Math.floor(numeric) && Math.abs(numeric) < MAX_EXACT_INTEGER) {
                    return (long) numeric;
                }
                return numeric;
            case BOOLEAN:
                return cell.getBooleanCellValue();
            default:
                return null;
        }
    }

    private void fillSheet(Workbook workbook, Sheet sheet, SheetTable table) {
        CellStyle dateStyle = workbook.createCellStyle();
        dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat(DATE_TIME_FORMAT));

        List<String> columns = table.columns();
        int[] widths = new int[columns.size()];
        Row header = sheet.createRow(0);
        for (int c = 0; c < columns.size(); c++) {
            header.createCell(c).setCellValue(columns.get(c));
            widths[c] = columns.get(c).length();
        }

        for (int r = 0; r < table.rowCount(); r++) {
            Row row = sheet.createRow(r + 1);
            for (int c = 0; c < columns.size(); c++) {
                Object value = table.get(r, columns.get(c));
                if (value == null) {
                    continue;
                }
                Cell cell = row.createCell(c);
                if (value instanceof String s) {
                    cell.setCellValue(s);
                } else if (value instanceof Number n) {
                    cell.setCellValue(n.doubleValue());
                } else if (value instanceof Boolean b) {
                    cell.setCellValue(b);
                } else if (value instanceof LocalDateTime dateTime) {
                    cell.setCellValue(dateTime);
                    cell.setCellStyle(dateStyle);
                } else {
                    cell.setCellValue(value.toString());
                }
                int length = value instanceof LocalDateTime ? DATE_TIME_FORMAT.length() : value.toString().length();
                widths[c] = Math.max(widths[c], length);
            }
        }

        for (int c = 0; c < columns.size(); c++) {
            sheet.setColumnWidth(c, (Math.min(widths[c], MAX_COLUMN_WIDTH_CHARS) + 2) * 256);
        }
    }
}
