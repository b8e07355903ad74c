package com.poc.typeaudit.service;

import com.poc.typeaudit.dto.Dataset;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;

import java.io.IOException;

/**
 * An opened workbook together with the sheet that was read and its decoded rows.
 * Owns the workbook: close it once the report has been written.
 */
@Getter
@RequiredArgsConstructor
public class LoadedDocument implements AutoCloseable {

    private final SpreadsheetFormat format;
    private final Workbook workbook;
    private final Sheet primarySheet;
    private final Dataset dataset;

    @Override
    public void close() throws IOException {
        workbook.close();
    }
}
