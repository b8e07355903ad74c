package com.poc.typeaudit.exception;

import lombok.Getter;

import java.util.List;

/**
 * Failure raised anywhere in the load / analyze / compose pipeline.
 */
@Getter
public class TypeAuditException extends RuntimeException {

    private final ReportErrorKind kind;
    private final List<String> missingColumns;

    public TypeAuditException(ReportErrorKind kind, String message) {
        this(kind, message, null);
    }

    public TypeAuditException(ReportErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.missingColumns = List.of();
    }

    private TypeAuditException(List<String> missingColumns) {
        super("Uploaded file is missing required columns: " + String.join(", ", missingColumns));
        this.kind = ReportErrorKind.MISSING_REQUIRED_COLUMNS;
        this.missingColumns = List.copyOf(missingColumns);
    }

    public static TypeAuditException missingColumns(List<String> missingColumns) {
        return new TypeAuditException(missingColumns);
    }
}
