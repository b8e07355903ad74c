package com.poc.typeaudit.dto;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A single decoded cell. Grouping and comparison happen on these values, so two
 * cells are equal only when both their kind and their value match ("1" text is
 * not the number 1).
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class CellValue {

    public enum Kind { TEXT, NUMBER, BOOLEAN, DATE, EMPTY }

    private static final CellValue EMPTY = new CellValue(Kind.EMPTY, null);

    private final Kind kind;
    private final Object value;

    public static CellValue text(String value) {
        return value == null ? EMPTY : new CellValue(Kind.TEXT, value);
    }

    public static CellValue number(double value) {
        // -0.0 and 0.0 must group together
        return new CellValue(Kind.NUMBER, value == 0.0d ? 0.0d : value);
    }

    public static CellValue bool(boolean value) {
        return new CellValue(Kind.BOOLEAN, value);
    }

    public static CellValue date(LocalDateTime value) {
        return value == null ? EMPTY : new CellValue(Kind.DATE, value);
    }

    public static CellValue empty() {
        return EMPTY;
    }

    public boolean isBlank() {
        return kind == Kind.EMPTY || (kind == Kind.TEXT && ((String) value).isBlank());
    }

    public String asText() {
        switch (kind) {
            case TEXT:
                return (String) value;
            case NUMBER:
                double d = (Double) value;
                if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                    return String.valueOf((long) d);
                }
                return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
            case BOOLEAN:
                return ((Boolean) value) ? "TRUE" : "FALSE";
            case DATE:
                return value.toString();
            default:
                return "";
        }
    }

    @Override
    public String toString() {
        return asText();
    }
}
