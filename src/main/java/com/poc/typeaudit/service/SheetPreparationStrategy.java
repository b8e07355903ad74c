package com.poc.typeaudit.service;

import com.poc.typeaudit.dto.AnalysisResult;
import org.apache.poi.ss.usermodel.Sheet;

/**
 * Produces the sheet the report is drawn on. Formats POI can write back are
 * edited in place; the others are rebuilt from the decoded rows.
 */
public interface SheetPreparationStrategy {

    boolean supports(SpreadsheetFormat format);

    /**
     * @return the primary sheet of the report workbook. Every analyzed row must sit at
     * its {@code originalRowIndex}, under a header row at index 0.
     */
    Sheet prepare(LoadedDocument document, AnalysisResult analysis);
}
