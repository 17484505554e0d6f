package com.venturegate.boundary;

import com.venturegate.evidence.Timestamps;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reads typed values out of one raw row, recording an issue instead of throwing when a
 * value has the wrong shape. Absent and null columns are both treated as "not provided".
 */
final class RowReader {

    private final Map<String, Object> row;
    private final String pathPrefix;
    private final List<BoundaryIssue> issues = new ArrayList<>();

    RowReader(Map<String, Object> row, EntityKind kind, int index) {
        this.row = row;
        this.pathPrefix = kind.getTable() + "." + index + ".";
    }

    List<BoundaryIssue> issues() {
        return issues;
    }

    boolean valid() {
        return issues.isEmpty();
    }

    Object raw(RowField field) {
        return row.get(field.column());
    }

    String requiredString(RowField field) {
        Object value = raw(field);
        if (value == null) {
            issue(field, BoundaryIssue.REQUIRED, "is required");
            return null;
        }
        if (!(value instanceof String text) || text.isBlank()) {
            issue(field, BoundaryIssue.INVALID_TYPE, "must be a non-blank string");
            return null;
        }
        return text;
    }

    String optionalString(RowField field) {
        Object value = raw(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            issue(field, BoundaryIssue.INVALID_TYPE, "must be a string");
            return null;
        }
        return text;
    }

    Boolean optionalBoolean(RowField field) {
        Object value = raw(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Boolean flag)) {
            issue(field, BoundaryIssue.INVALID_TYPE, "must be a boolean");
            return null;
        }
        return flag;
    }

    Integer optionalInteger(RowField field, int minimum) {
        Object value = raw(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number number) || !isIntegral(number)) {
            issue(field, BoundaryIssue.INVALID_TYPE, "must be an integer");
            return null;
        }
        if (number.longValue() < minimum) {
            issue(field, BoundaryIssue.TOO_SMALL, "must be >= " + minimum);
            return null;
        }
        return number.intValue();
    }

    <E> E optionalEnum(RowField field, Function<String, Optional<E>> lookup) {
        Object value = raw(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            issue(field, BoundaryIssue.INVALID_TYPE, "must be a string");
            return null;
        }
        Optional<E> resolved = lookup.apply(text);
        if (resolved.isEmpty()) {
            issue(field, BoundaryIssue.INVALID_ENUM_VALUE, "is not an accepted value");
            return null;
        }
        return resolved.get();
    }

    List<String> optionalStringList(RowField field) {
        Object value = raw(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List<?> list)) {
            issue(field, BoundaryIssue.INVALID_TYPE, "must be an array of strings");
            return null;
        }
        List<String> strings = new ArrayList<>(list.size());
        for (Object element : list) {
            if (!(element instanceof String text)) {
                issue(field, BoundaryIssue.INVALID_TYPE, "must be an array of strings");
                return null;
            }
            strings.add(text);
        }
        return strings;
    }

    /** Calendar date column; date objects are rendered as ISO {@code yyyy-MM-dd}. */
    String optionalDate(RowField field) {
        Object value = raw(field);
        if (value == null) {
            return null;
        }
        if (value instanceof String text) {
            return text.isEmpty() ? null : text;
        }
        if (value instanceof LocalDate date) {
            return date.toString();
        }
        if (value instanceof Date date) {
            return date.toInstant().atOffset(ZoneOffset.UTC).toLocalDate().toString();
        }
        if (value instanceof TemporalAccessor temporal) {
            try {
                return LocalDate.from(temporal).toString();
            } catch (RuntimeException ex) {
                issue(field, BoundaryIssue.INVALID_TYPE, "must be a date or string");
                return null;
            }
        }
        issue(field, BoundaryIssue.INVALID_TYPE, "must be a date or string");
        return null;
    }

    /** Never records an issue: unusable timestamps become {@code clock.instant()}. */
    Instant timestamp(RowField field, Clock clock) {
        return Timestamps.parseOrNow(raw(field), clock);
    }

    private void issue(RowField field, String code, String message) {
        issues.add(new BoundaryIssue(pathPrefix + field.column(), code, field.column() + " " + message));
    }

    private static boolean isIntegral(Number number) {
        if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return true;
        }
        if (number instanceof Long l) {
            return l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE;
        }
        double d = number.doubleValue();
        return !Double.isNaN(d) && !Double.isInfinite(d) && d == Math.rint(d)
            && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE;
    }
}
