package com.poc.typeaudit.exception;

import lombok.Getter;

/**
 * Classification of audit failures, used by the HTTP layer to pick a status.
 */
@Getter
public enum ReportErrorKind {

    UNSUPPORTED_FORMAT("UNSUPPORTED_FORMAT", true),
    AMBIGUOUS_SHEET_SELECTION("AMBIGUOUS_SHEET", true),
    UNREADABLE_DOCUMENT("UNREADABLE_DOCUMENT", true),
    MISSING_REQUIRED_COLUMNS("MISSING_COLUMNS", true),
    INTERNAL_FAILURE("INTERNAL_FAILURE", false);

    private final String code;
    private final boolean userError;

    ReportErrorKind(String code, boolean userError) {
        this.code = code;
        this.userError = userError;
    }
}
