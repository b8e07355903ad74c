package com.poc.typeaudit.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of the summary sheet: how many rows carry a given Name / Data Type pair.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SummaryEntry {
    private CellValue name;
    private CellValue dataType;
    private long count;
}
