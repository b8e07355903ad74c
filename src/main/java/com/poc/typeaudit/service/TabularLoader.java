package com.poc.typeaudit.service;

import com.poc.typeaudit.dto.CellValue;
import com.poc.typeaudit.dto.Dataset;
import com.poc.typeaudit.dto.RowData;
import com.poc.typeaudit.exception.ReportErrorKind;
import com.poc.typeaudit.exception.TypeAuditException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Reads the first sheet of an uploaded workbook into a {@link Dataset}.
 */
@Slf4j
@Service
public class TabularLoader {

    private static final List<String> REQUIRED_COLUMNS = List.of(Dataset.NAME_COLUMN, Dataset.DATA_TYPE_COLUMN);

    public LoadedDocument load(InputStream in, SpreadsheetFormat format) {
        Workbook workbook = open(in, format);
        try {
            Sheet sheet = resolvePrimarySheet(workbook);
            Dataset dataset = readSheet(sheet);
            requireColumns(dataset);
            log.info("Loaded sheet '{}': {} columns, {} rows", sheet.getSheetName(),
                    dataset.getHeaders().size(), dataset.getRows().size());
            return new LoadedDocument(format, workbook, sheet, dataset);
        } catch (RuntimeException e) {
            closeAfterFailure(workbook, e);
            throw e;
        }
    }

    private Workbook open(InputStream in, SpreadsheetFormat format) {
        Workbook workbook;
        try {
            workbook = WorkbookFactory.create(in);
        } catch (IOException | RuntimeException e) {
            log.warn("Could not parse {} workbook: {}", format.getExtension(), e.getMessage());
            throw new TypeAuditException(ReportErrorKind.UNREADABLE_DOCUMENT,
                    "Unable to read the Excel file. Make sure it is a valid ." + format.getExtension()
                            + " file that contains data. Details: " + e.getMessage(), e);
        }

        boolean legacy = workbook instanceof HSSFWorkbook;
        boolean ooxml = workbook instanceof XSSFWorkbook;
        if ((format == SpreadsheetFormat.XLS && !legacy) || (format != SpreadsheetFormat.XLS && !ooxml)) {
            TypeAuditException mismatch = new TypeAuditException(ReportErrorKind.UNREADABLE_DOCUMENT,
                    "File content does not match its ." + format.getExtension() + " extension.");
            closeAfterFailure(workbook, mismatch);
            throw mismatch;
        }
        return workbook;
    }

    /**
     * Tries the first sheet directly. When that fails, a single-sheet workbook is
     * retried by sheet name; a multi-sheet workbook is rejected instead of guessing.
     */
    private Sheet resolvePrimarySheet(Workbook workbook) {
        int sheetCount = workbook.getNumberOfSheets();
        if (sheetCount == 0) {
            throw new TypeAuditException(ReportErrorKind.UNREADABLE_DOCUMENT, "The Excel file contains no sheets.");
        }

        Sheet first = workbook.getSheetAt(0);
        if (findHeaderRow(first) != null) {
            return first;
        }
        if (sheetCount == 1) {
            String sheetName = workbook.getSheetName(0);
            log.warn("First sheet has no header row, retrying sheet '{}'", sheetName);
            // an empty sole sheet still loads; the required-column check reports what is missing
            return workbook.getSheet(sheetName);
        }

        List<String> names = new ArrayList<>();
        for (int i = 0; i < sheetCount; i++) {
            names.add(workbook.getSheetName(i));
        }
        log.error("First sheet unreadable and workbook has {} sheets {}", sheetCount, names);
        throw new TypeAuditException(ReportErrorKind.AMBIGUOUS_SHEET_SELECTION,
                "The Excel file contains " + sheetCount + " sheets " + names
                        + " and the first one has no readable header. Upload a file with a single sheet.");
    }

    /**
     * @return row 0 when it holds at least one non-blank cell, otherwise {@code null}
     */
    private Row findHeaderRow(Sheet sheet) {
        Row header = sheet.getRow(0);
        if (header == null || header.getLastCellNum() <= 0) {
            return null;
        }
        for (Cell cell : header) {
            if (!decode(cell).isBlank()) {
                return header;
            }
        }
        return null;
    }

    Dataset readSheet(Sheet sheet) {
        Row headerRow = findHeaderRow(sheet);
        if (headerRow == null) {
            return new Dataset(sheet.getSheetName(), List.of(), List.of());
        }
        List<String> headers = readHeaders(headerRow);

        List<RowData> rows = new ArrayList<>();
        for (int r = 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) continue;

            Map<String, CellValue> values = new LinkedHashMap<>();
            for (int c = 0; c < headers.size(); c++) {
                values.put(headers.get(c), decode(row.getCell(c)));
            }
            rows.add(new RowData(r, values));
        }
        return new Dataset(sheet.getSheetName(), headers, rows);
    }

    /**
     * Header texts up to the last non-blank header cell. Blank headers become
     * "Unnamed: n" and repeated ones get ".1", ".2" suffixes so each column keeps its own key.
     */
    private List<String> readHeaders(Row headerRow) {
        int width = 0;
        for (int c = 0; c < headerRow.getLastCellNum(); c++) {
            if (!decode(headerRow.getCell(c)).isBlank()) {
                width = c + 1;
            }
        }

        List<String> headers = new ArrayList<>(width);
        Map<String, Integer> seen = new HashMap<>();
        for (int c = 0; c < width; c++) {
            CellValue value = decode(headerRow.getCell(c));
            String name = value.isBlank() ? "Unnamed: " + c : value.asText().trim();
            Integer dupes = seen.merge(name, 1, Integer::sum) - 1;
            if (dupes > 0) {
                String candidate = name + "." + dupes;
                while (seen.containsKey(candidate)) {
                    candidate = name + "." + (++dupes);
                }
                seen.put(candidate, 1);
                name = candidate;
            }
            headers.add(name);
        }
        return headers;
    }

    private void requireColumns(Dataset dataset) {
        List<String> missing = new ArrayList<>();
        for (String required : REQUIRED_COLUMNS) {
            if (!dataset.getHeaders().contains(required)) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            log.warn("Sheet '{}' is missing required columns: {}", dataset.getSheetName(), missing);
            throw TypeAuditException.missingColumns(missing);
        }
    }

    static CellValue decode(Cell cell) {
        if (cell == null) return CellValue.empty();
        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        switch (type) {
            case STRING:
                return CellValue.text(cell.getStringCellValue());
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) return CellValue.date(cell.getLocalDateTimeCellValue());
                return CellValue.number(cell.getNumericCellValue());
            case BOOLEAN:
                return CellValue.bool(cell.getBooleanCellValue());
            default:
                return CellValue.empty();
        }
    }

    private void closeAfterFailure(Workbook workbook, RuntimeException failure) {
        try {
            workbook.close();
        } catch (IOException closeFailure) {
            failure.addSuppressed(closeFailure);
        }
    }
}
