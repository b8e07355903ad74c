package com.poc.typeaudit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Report generation settings bound from {@code application.properties}.
 */
@Data
@ConfigurationProperties(prefix = "excel.report")
public class ReportProperties {

    /**
     * Prefix of every generated report filename.
     */
    private String outputPrefix = "result_";

    /**
     * Reserved name of the appended summary sheet. An existing sheet with this
     * name is replaced on every run.
     */
    private String summarySheetName = "Summary";

    /**
     * Append a content hash to output filenames so different uploads with the
     * same name never overwrite each other.
     */
    private boolean uniqueToken = true;

    private SummaryScope summaryScope = SummaryScope.ALL_TYPES;

    public enum SummaryScope {
        /** Every row of an inconsistent Name, across all of its Data Type values. */
        ALL_TYPES,
        /** Only the rows that disagree with their Name's dominant Data Type. */
        DEVIATIONS_ONLY
    }
}
