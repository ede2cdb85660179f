package com.poc.eurverifier.service;

import com.poc.eurverifier.dto.Discrepancy;
import com.poc.eurverifier.dto.DiscrepancyReason;
import com.poc.eurverifier.dto.VerificationReport;
import com.poc.eurverifier.engine.ExchangeRate;
import com.poc.eurverifier.engine.Grid;
import com.poc.eurverifier.engine.GridRow;
import com.poc.eurverifier.engine.RateConverter;
import com.poc.eurverifier.exception.InvalidWorkbookException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.openxml4j.exceptions.OpenXML4JRuntimeException;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.streaming.SXSSFWorkbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.*;

/**
 * Reads .xlsx reports into {@link Grid}s and writes mismatch reports.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExcelService {

    private static final String SHEET_DISCREPANCIES = "Discrepancies";
    private static final String SHEET_SUMMARY = "Summary";
    private static final List<String> REPORT_HEADERS = List.of(
            "Row", "Column", "Source BGN", "Calculated EUR", "File EUR", "Diff", "Reason", "Details");

    private final RateConverter rateConverter;

    // =========================================================================
    // Reading
    // =========================================================================

    /**
     * Reads the data rows under the header row of the given sheet (first sheet when null).
     * Formula cells yield their last computed value, never formula text.
     */
    public Grid readGrid(InputStream in, String sheetName) throws IOException {
        try (XSSFWorkbook workbook = openWorkbook(in)) {
            Sheet sheet = selectSheet(workbook, sheetName);
            Map<String, Integer> columnIndex = extractHeaders(sheet);

            List<GridRow> rows = new ArrayList<>();
            for (int i = 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                Map<String, Object> cells = new LinkedHashMap<>();
                for (Map.Entry<String, Integer> column : columnIndex.entrySet()) {
                    Cell cell = row != null ? row.getCell(column.getValue()) : null;
                    cells.put(column.getKey(), getCellValue(cell));
                }
                rows.add(new GridRow(i + 1, cells));
            }

            // Formatted but empty rows at the bottom are not data
            while (!rows.isEmpty() && isEmptyRow(rows.get(rows.size() - 1))) {
                rows.remove(rows.size() - 1);
            }

            log.info("Read sheet '{}': {} columns, {} data rows", sheet.getSheetName(), columnIndex.size(), rows.size());
            return new Grid(new ArrayList<>(columnIndex.keySet()), rows);
        }
    }

    public List<String> readHeaders(InputStream in, String sheetName) throws IOException {
        try (XSSFWorkbook workbook = openWorkbook(in)) {
            return new ArrayList<>(extractHeaders(selectSheet(workbook, sheetName)).keySet());
        }
    }

    private XSSFWorkbook openWorkbook(InputStream in) {
        try {
            return new XSSFWorkbook(in);
        } catch (IOException | POIXMLException | OpenXML4JRuntimeException | IllegalArgumentException e) {
            throw new InvalidWorkbookException("File is not a readable .xlsx workbook: " + e.getMessage(), e);
        }
    }

    private Sheet selectSheet(Workbook workbook, String sheetName) {
        if (sheetName == null || sheetName.isBlank()) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new InvalidWorkbookException("Workbook contains no sheets");
            }
            return workbook.getSheetAt(0);
        }
        Sheet sheet = workbook.getSheet(sheetName.trim());
        if (sheet == null) {
            throw new InvalidWorkbookException("Sheet not found: " + sheetName);
        }
        return sheet;
    }

    /**
     * Header name to 0-based column index, in sheet order. Blank headers are ignored
     * and a repeated header resolves to its first occurrence.
     */
    private Map<String, Integer> extractHeaders(Sheet sheet) {
        Row headerRow = sheet.getRow(0);
        if (headerRow == null) {
            throw new InvalidWorkbookException("Header row is missing in sheet '" + sheet.getSheetName() + "'");
        }
        Map<String, Integer> headers = new LinkedHashMap<>();
        for (Cell cell : headerRow) {
            String header = getCellValueAsString(cell).trim();
            if (header.isEmpty()) continue;
            if (headers.containsKey(header)) {
                log.warn("Duplicate header '{}' in sheet '{}', using first occurrence", header, sheet.getSheetName());
                continue;
            }
            headers.put(header, cell.getColumnIndex());
        }
        return headers;
    }

    private Object getCellValue(Cell cell) {
        if (cell == null) return null;
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case STRING: return cell.getStringCellValue();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) return cell.getLocalDateTimeCellValue();
                return BigDecimal.valueOf(cell.getNumericCellValue());
            case BOOLEAN: return cell.getBooleanCellValue();
            default: return null;
        }
    }

    private String getCellValueAsString(Cell cell) {
        if (cell == null) return "";
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case STRING: return cell.getStringCellValue();
            case NUMERIC: return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
            case BOOLEAN: return String.valueOf(cell.getBooleanCellValue());
            default: return "";
        }
    }

    private boolean isEmptyRow(GridRow row) {
        return row.getCells().values().stream()
                .allMatch(v -> v == null || (v instanceof String && ((String) v).isBlank()));
    }

    // =========================================================================
    // Mismatch report
    // =========================================================================

    public byte[] generateMismatchReport(VerificationReport report) throws IOException {
        try (SXSSFWorkbook workbook = new SXSSFWorkbook(100)) {
            Map<String, CellStyle> styles = createStyles(workbook);

            Sheet sheet = workbook.createSheet(SHEET_DISCREPANCIES);
            Row headerRow = sheet.createRow(0);
            for (int i = 0; i < REPORT_HEADERS.size(); i++) {
                Cell cell = headerRow.createCell(i);
                cell.setCellValue(REPORT_HEADERS.get(i));
                cell.setCellStyle(styles.get("header"));
                sheet.setColumnWidth(i, i == REPORT_HEADERS.size() - 1 ? 12000 : 4000);
            }

            int rowIdx = 1;
            for (Discrepancy d : report.getDiscrepancies()) {
                Row row = sheet.createRow(rowIdx++);
                setCellValue(row.createCell(0), d.getRowNumber(), null);
                setCellValue(row.createCell(1), d.getColumn(), null);
                setCellValue(row.createCell(2), d.getSourceValue(), null);
                setCellValue(row.createCell(3), d.getExpectedValue(), styles.get("amount"));
                setCellValue(row.createCell(4), d.getActualValue(), styles.get("amount"));
                setCellValue(row.createCell(5), d.getDelta(), styles.get("amount"));

                Cell reasonCell = row.createCell(6);
                reasonCell.setCellValue(d.getReason().getLabel());
                if (d.getReason() == DiscrepancyReason.VALUE_MISMATCH) {
                    reasonCell.setCellStyle(styles.get("error"));
                }
                setCellValue(row.createCell(7), d.getDetails(), null);
            }

            writeSummary(workbook.createSheet(SHEET_SUMMARY), report);

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            workbook.write(out);
            workbook.dispose();
            return out.toByteArray();
        }
    }

    private void writeSummary(Sheet sheet, VerificationReport report) {
        ExchangeRate rate = rateConverter.getRate();
        Object[][] lines = {
                {"Result", report.isPassed() ? "PASSED" : "FAILED"},
                {"Conversion rate", "1 " + rate.getTo() + " = " + rate.getDivisor().toPlainString() + " " + rate.getFrom()},
                {"Columns", String.join(", ", report.getColumns())},
                {"Source rows", report.getSourceRowCount()},
                {"Target rows", report.getTargetRowCount()},
                {"Cells checked", report.getCheckedCount()},
                {"Cells skipped", report.getSkippedCount()},
                {"Discrepancies", report.getDiscrepancyCount()},
        };
        for (int i = 0; i < lines.length; i++) {
            Row row = sheet.createRow(i);
            setCellValue(row.createCell(0), lines[i][0], null);
            setCellValue(row.createCell(1), lines[i][1], null);
        }
        sheet.setColumnWidth(0, 5000);
        sheet.setColumnWidth(1, 12000);
    }

    private void setCellValue(Cell cell, Object value, CellStyle numberStyle) {
        if (value instanceof Number) {
            cell.setCellValue(((Number) value).doubleValue());
            if (numberStyle != null) cell.setCellStyle(numberStyle);
        } else if (value != null) {
            cell.setCellValue(value.toString());
        }
    }

    private Map<String, CellStyle> createStyles(Workbook wb) {
        Map<String, CellStyle> styles = new HashMap<>();

        CellStyle header = wb.createCellStyle();
        Font headerFont = wb.createFont();
        headerFont.setBold(true);
        header.setFont(headerFont);
        header.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
        header.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        styles.put("header", header);

        CellStyle amount = wb.createCellStyle();
        amount.setDataFormat(wb.createDataFormat().getFormat("0.00"));
        styles.put("amount", amount);

        CellStyle error = wb.createCellStyle();
        Font errorFont = wb.createFont();
        errorFont.setColor(IndexedColors.RED.getIndex());
        error.setFont(errorFont);
        styles.put("error", error);

        return styles;
    }
}
