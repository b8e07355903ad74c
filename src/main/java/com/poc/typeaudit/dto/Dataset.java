package com.poc.typeaudit.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Dataset {
    public static final String NAME_COLUMN = "Name";
    public static final String DATA_TYPE_COLUMN = "Data Type";

    /**
     * Name of the sheet the rows were read from. Rebuilt reports reuse it.
     */
    private String sheetName;

    /**
     * Unique column names in sheet order.
     */
    private List<String> headers;

    private List<RowData> rows;
}
