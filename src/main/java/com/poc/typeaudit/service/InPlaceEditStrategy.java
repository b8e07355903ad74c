package com.poc.typeaudit.service;

import com.poc.typeaudit.dto.AnalysisResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Sheet;
import org.springframework.stereotype.Component;

/**
 * Reuses the uploaded workbook, so formatting, other sheets and VBA parts of
 * .xlsm files survive untouched.
 */
@Slf4j
@Component
public class InPlaceEditStrategy implements SheetPreparationStrategy {

    @Override
    public boolean supports(SpreadsheetFormat format) {
        return format.isInPlaceEditable();
    }

    @Override
    public Sheet prepare(LoadedDocument document, AnalysisResult analysis) {
        log.info("Editing sheet '{}' of the uploaded .{} workbook in place",
                document.getPrimarySheet().getSheetName(), document.getFormat().getExtension());
        return document.getPrimarySheet();
    }
}
