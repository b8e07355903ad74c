package com.poc.typeaudit.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResult {
    /**
     * The header names of the analyzed sheet.
     * Needed so a legacy file can be rebuilt column for column.
     */
    private List<String> headers;

    /**
     * Rows that took part in the analysis (Name and Data Type both present),
     * in sheet order, with {@link RowData#isFlagged()} set.
     */
    private List<RowData> rows;

    /**
     * Dominant Data Type per Name.
     */
    private Map<CellValue, CellValue> dominantTypes;

    /**
     * Names with at least one flagged row, in first-seen order.
     */
    private Set<CellValue> inconsistentNames;

    /**
     * Rows for the summary sheet, in first-appearance order.
     */
    private List<SummaryEntry> summary;

    public long getFlaggedCount() {
        return rows.stream().filter(RowData::isFlagged).count();
    }
}
