package com.poc.typeaudit.service;

import com.poc.typeaudit.dto.CellValue;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Workbook;

import java.time.LocalDateTime;

/**
 * Writes decoded values back into cells of one workbook.
 */
class CellValueWriter {

    private static final String DATE_FORMAT = "yyyy-mm-dd hh:mm:ss";

    private final Workbook workbook;
    private CellStyle dateStyle;

    CellValueWriter(Workbook workbook) {
        this.workbook = workbook;
    }

    void write(Cell cell, CellValue value) {
        switch (value.getKind()) {
            case TEXT:
                cell.setCellValue((String) value.getValue());
                break;
            case NUMBER:
                cell.setCellValue((Double) value.getValue());
                break;
            case BOOLEAN:
                cell.setCellValue((Boolean) value.getValue());
                break;
            case DATE:
                cell.setCellValue((LocalDateTime) value.getValue());
                cell.setCellStyle(dateStyle());
                break;
            default:
                cell.setBlank();
        }
    }

    private CellStyle dateStyle() {
        if (dateStyle == null) {
            dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat(DATE_FORMAT));
        }
        return dateStyle;
    }
}
