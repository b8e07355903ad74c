package com.poc.typeaudit.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RowData {
    /**
     * 0-based row index in the sheet the row was read from (header is row 0).
     * Highlighting and rebuilt sheets use it so rows land where they came from.
     */
    private int originalRowIndex;

    /**
     * Key: column header, in sheet order.
     * Value: the decoded cell.
     */
    private Map<String, CellValue> cellValues;

    /**
     * Set by the analyzer when this row's Data Type differs from the dominant
     * Data Type of its Name.
     */
    private boolean flagged;

    public RowData(int originalRowIndex, Map<String, CellValue> cellValues) {
        this(originalRowIndex, cellValues, false);
    }

    public CellValue get(String column) {
        CellValue value = cellValues.get(column);
        return value == null ? CellValue.empty() : value;
    }
}
