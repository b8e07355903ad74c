package com.poc.typeaudit.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReportResult {
    /**
     * Name under which the report was published; pass it to the download endpoint.
     */
    private String outputFilename;
    private int analyzedRows;
    private long flaggedRows;
    private int inconsistentNames;
    private int summaryRows;
}
