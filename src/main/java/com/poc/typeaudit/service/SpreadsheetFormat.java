package com.poc.typeaudit.service;

import com.poc.typeaudit.exception.ReportErrorKind;
import com.poc.typeaudit.exception.TypeAuditException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Spreadsheet formats accepted for upload and how each one is written back.
 */
public enum SpreadsheetFormat {

    XLSX("xlsx", "xlsx", true,
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"),
    XLSM("xlsm", "xlsm", true,
            "application/vnd.ms-excel.sheet.macroEnabled.12"),
    // No legacy writer: .xls input is rebuilt into a new .xlsx workbook
    XLS("xls", "xlsx", false,
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final String extension;
    private final String outputExtension;
    private final boolean inPlaceEditable;
    private final String outputContentType;

    SpreadsheetFormat(String extension, String outputExtension, boolean inPlaceEditable, String outputContentType) {
        this.extension = extension;
        this.outputExtension = outputExtension;
        this.inPlaceEditable = inPlaceEditable;
        this.outputContentType = outputContentType;
    }

    public String getExtension() {
        return extension;
    }

    public String getOutputExtension() {
        return outputExtension;
    }

    public boolean isInPlaceEditable() {
        return inPlaceEditable;
    }

    public String getOutputContentType() {
        return outputContentType;
    }

    /**
     * Resolves a hint that may be a bare extension ("xls", ".XLS") or a full filename.
     *
     * @throws TypeAuditException with {@link ReportErrorKind#UNSUPPORTED_FORMAT} for anything else
     */
    public static SpreadsheetFormat fromHint(String hint) {
        if (hint != null) {
            String trimmed = hint.trim();
            int dot = trimmed.lastIndexOf('.');
            String ext = (dot == -1 ? trimmed : trimmed.substring(dot + 1)).toLowerCase(Locale.ROOT);
            for (SpreadsheetFormat format : values()) {
                if (format.extension.equals(ext)) {
                    return format;
                }
            }
        }
        throw new TypeAuditException(ReportErrorKind.UNSUPPORTED_FORMAT,
                "Unsupported file format '" + hint + "'. Only " + supportedList() + " files are accepted.");
    }

    /**
     * Content type for a stored report, looked up by its extension.
     */
    public static String contentTypeOf(String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        return lower.endsWith("." + XLSM.outputExtension)
                ? XLSM.getOutputContentType()
                : XLSX.getOutputContentType();
    }

    private static String supportedList() {
        return Arrays.stream(values())
                .map(f -> "." + f.extension)
                .collect(Collectors.joining(", "));
    }
}
