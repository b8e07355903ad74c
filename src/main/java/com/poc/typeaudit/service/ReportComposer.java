package com.poc.typeaudit.service;

import com.poc.typeaudit.config.ReportProperties;
import com.poc.typeaudit.dto.AnalysisResult;
import com.poc.typeaudit.dto.CellValue;
import com.poc.typeaudit.dto.Dataset;
import com.poc.typeaudit.dto.RowData;
import com.poc.typeaudit.dto.SummaryEntry;
import com.poc.typeaudit.exception.ReportErrorKind;
import com.poc.typeaudit.exception.TypeAuditException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.formula.FormulaParseException;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.ss.util.CellReference;
import org.apache.poi.ss.util.WorkbookUtil;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.*;

/**
 * Draws an {@link AnalysisResult} onto a workbook: flagged rows are filled yellow
 * and a summary sheet is appended whose Name cells jump back to the source rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportComposer {

    static final List<String> SUMMARY_HEADERS = List.of("Name", "Data Type", "Count");

    // Excel's limit on a string literal inside a formula
    private static final int MAX_FORMULA_LITERAL = 255;

    private final List<SheetPreparationStrategy> strategies;
    private final ReportProperties properties;

    public byte[] compose(LoadedDocument document, AnalysisResult analysis) throws IOException {
        SheetPreparationStrategy strategy = strategyFor(document.getFormat());
        Sheet primary = strategy.prepare(document, analysis);
        Workbook workbook = primary.getWorkbook();
        try {
            highlightFlaggedRows(primary, analysis);

            Sheet summary = replaceSummarySheet(workbook, primary);
            writeSummary(summary, analysis.getSummary());
            linkSummaryToSource(summary, primary);

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            workbook.write(out);
            log.info("Report composed: {} flagged rows highlighted on '{}', {} summary rows on '{}'",
                    analysis.getFlaggedCount(), primary.getSheetName(),
                    analysis.getSummary().size(), summary.getSheetName());
            return out.toByteArray();
        } finally {
            if (workbook != document.getWorkbook()) {
                workbook.close();
            }
        }
    }

    private SheetPreparationStrategy strategyFor(SpreadsheetFormat format) {
        return strategies.stream()
                .filter(s -> s.supports(format))
                .findFirst()
                .orElseThrow(() -> new TypeAuditException(ReportErrorKind.INTERNAL_FAILURE,
                        "No report strategy registered for ." + format.getExtension()));
    }

    // =========================================================================
    // Highlighting
    // =========================================================================
    private void highlightFlaggedRows(Sheet sheet, AnalysisResult analysis) {
        Workbook workbook = sheet.getWorkbook();
        Map<Short, CellStyle> highlighted = new HashMap<>();
        int headerWidth = analysis.getHeaders().size();

        for (RowData data : analysis.getRows()) {
            if (!data.isFlagged()) continue;

            Row row = sheet.getRow(data.getOriginalRowIndex());
            if (row == null) {
                log.warn("Flagged row {} not found on sheet '{}'", data.getOriginalRowIndex() + 1, sheet.getSheetName());
                continue;
            }
            int width = Math.max(headerWidth, row.getLastCellNum());
            for (int c = 0; c < width; c++) {
                Cell cell = row.getCell(c, Row.MissingCellPolicy.CREATE_NULL_AS_BLANK);
                CellStyle original = cell.getCellStyle();
                // one cloned style per source style keeps number formats and stays under the style limit
                cell.setCellStyle(highlighted.computeIfAbsent(original.getIndex(), idx -> {
                    CellStyle style = workbook.createCellStyle();
                    style.cloneStyleFrom(original);
                    style.setFillForegroundColor(IndexedColors.YELLOW.getIndex());
                    style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
                    return style;
                }));
            }
        }
    }

    // =========================================================================
    // Summary sheet
    // =========================================================================
    private Sheet replaceSummarySheet(Workbook workbook, Sheet primary) {
        String summaryName = WorkbookUtil.createSafeSheetName(properties.getSummarySheetName());
        if (summaryName.equalsIgnoreCase(primary.getSheetName())) {
            summaryName = WorkbookUtil.createSafeSheetName(summaryName + "_1");
            log.warn("Data sheet is named like the summary sheet, writing summary to '{}'", summaryName);
        }

        int existing = workbook.getSheetIndex(summaryName);
        if (existing >= 0) {
            workbook.removeSheetAt(existing);
            log.info("Removed existing '{}' sheet", summaryName);
        }
        return workbook.createSheet(summaryName);
    }

    private void writeSummary(Sheet summary, List<SummaryEntry> entries) {
        CellValueWriter writer = new CellValueWriter(summary.getWorkbook());

        Row header = summary.createRow(0);
        for (int c = 0; c < SUMMARY_HEADERS.size(); c++) {
            header.createCell(c).setCellValue(SUMMARY_HEADERS.get(c));
        }

        int rowIdx = 1;
        for (SummaryEntry entry : entries) {
            Row row = summary.createRow(rowIdx++);
            writer.write(row.createCell(0), entry.getName());
            writer.write(row.createCell(1), entry.getDataType());
            row.createCell(2).setCellValue(entry.getCount());
        }
    }

    // =========================================================================
    // Hyperlinks from summary rows back to the data sheet
    // =========================================================================
    private void linkSummaryToSource(Sheet summary, Sheet primary) {
        int nameCol = findNameColumn(primary);
        if (nameCol < 0) {
            log.warn("No 'Name' column in sheet '{}'; summary rows will not be linked", primary.getSheetName());
            return;
        }

        Map<String, Integer> firstRowByName = new HashMap<>();
        for (int r = 1; r <= primary.getLastRowNum(); r++) {
            Row row = primary.getRow(r);
            if (row == null) continue;
            CellValue value = TabularLoader.decode(row.getCell(nameCol));
            if (!value.isBlank()) {
                firstRowByName.putIfAbsent(matchKey(value), r);
            }
        }

        String target = "#" + quoteSheetName(primary.getSheetName()) + "!" + CellReference.convertNumToColString(nameCol);
        CellStyle linkStyle = linkStyle(summary.getWorkbook());
        int linked = 0;

        for (int r = 1; r <= summary.getLastRowNum(); r++) {
            Cell nameCell = summary.getRow(r).getCell(0);
            CellValue name = TabularLoader.decode(nameCell);
            if (name.isBlank()) continue;

            Integer sourceRow = firstRowByName.get(matchKey(name));
            if (sourceRow == null) continue;

            String location = target + (sourceRow + 1);
            String display = name.asText();
            if (location.length() > MAX_FORMULA_LITERAL || display.length() > MAX_FORMULA_LITERAL) {
                log.warn("Summary row {} not linked: link text exceeds {} characters", r + 1, MAX_FORMULA_LITERAL);
                continue;
            }

            String formula = "HYPERLINK(\"" + escape(location) + "\",\"" + escape(display) + "\")";
            try {
                nameCell.setCellFormula(formula);
                nameCell.setCellStyle(linkStyle);
                linked++;
            } catch (FormulaParseException | IllegalArgumentException e) {
                log.warn("Could not link summary row {} ('{}'): {}", r + 1, name, e.getMessage());
            }
        }
        log.info("Linked {} of {} summary rows to sheet '{}'", linked, summary.getLastRowNum(), primary.getSheetName());
    }

    private int findNameColumn(Sheet sheet) {
        Row header = sheet.getRow(0);
        if (header == null) return -1;
        for (Cell cell : header) {
            if (Dataset.NAME_COLUMN.equals(TabularLoader.decode(cell).asText().trim())) {
                return cell.getColumnIndex();
            }
        }
        return -1;
    }

    private CellStyle linkStyle(Workbook workbook) {
        Font font = workbook.createFont();
        font.setColor(IndexedColors.BLUE.getIndex());
        font.setUnderline(Font.U_SINGLE);
        CellStyle style = workbook.createCellStyle();
        style.setFont(font);
        return style;
    }

    private static String matchKey(CellValue value) {
        return value.asText().trim().toLowerCase(Locale.ROOT);
    }

    private static String quoteSheetName(String sheetName) {
        return "'" + sheetName.replace("'", "''") + "'";
    }

    private static String escape(String formulaText) {
        return formulaText.replace("\"", "\"\"");
    }
}
