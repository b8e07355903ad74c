package com.poc.typeaudit.service;

import com.poc.typeaudit.dto.AnalysisResult;
import com.poc.typeaudit.dto.RowData;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Writes the analyzed rows into a brand new .xlsx workbook. Used for legacy .xls
 * uploads, which are never written back in their own format.
 */
@Slf4j
@Component
public class RebuildStrategy implements SheetPreparationStrategy {

    @Override
    public boolean supports(SpreadsheetFormat format) {
        return !format.isInPlaceEditable();
    }

    @Override
    public Sheet prepare(LoadedDocument document, AnalysisResult analysis) {
        String sheetName = WorkbookUtil.createSafeSheetName(document.getDataset().getSheetName());
        log.info("Rebuilding sheet '{}' from .{} upload into a new .xlsx workbook",
                sheetName, document.getFormat().getExtension());

        XSSFWorkbook workbook = new XSSFWorkbook();
        Sheet sheet = workbook.createSheet(sheetName);
        CellValueWriter writer = new CellValueWriter(workbook);
        List<String> headers = analysis.getHeaders();

        Row headerRow = sheet.createRow(0);
        for (int c = 0; c < headers.size(); c++) {
            headerRow.createCell(c).setCellValue(headers.get(c));
        }

        for (RowData data : analysis.getRows()) {
            Row row = sheet.createRow(data.getOriginalRowIndex());
            for (int c = 0; c < headers.size(); c++) {
                writer.write(row.createCell(c), data.get(headers.get(c)));
            }
        }
        return sheet;
    }
}
