package com.venturegate.evidence;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;

/**
 * Defensive timestamp parsing for created/updated columns.
 * <p>
 * Never throws: absent or unparseable values resolve to {@code clock.instant()}.
 * Null dates used to surface as a fatal range error far downstream, so every
 * timestamp entering the normalized model goes through here.
 */
public final class Timestamps {

    /** ISO-8601 with 'T' or Postgres-style ' ' separator; time and offset optional. */
    private static final DateTimeFormatter LENIENT = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffset("+HH:MM:ss", "Z").optionalEnd()
            .optionalStart().appendOffset("+HH", "Z").optionalEnd()
        .optionalEnd()
        .toFormatter();

    private Timestamps() {
    }

    public static Instant parseOrNow(Object value, Clock clock) {
        Instant parsed = parse(value);
        return parsed != null ? parsed : clock.instant();
    }

    public static Instant orNow(Instant value, Clock clock) {
        return value != null ? value : clock.instant();
    }

    /**
     * @return the parsed instant, or null when the value is absent or not a recognizable timestamp
     */
    static Instant parse(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate ld) {
            return ld.atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Number number) {
            double millis = number.doubleValue();
            if (Double.isNaN(millis) || Double.isInfinite(millis)) {
                return null;
            }
            return Instant.ofEpochMilli(number.longValue());
        }
        if (value instanceof String text) {
            return parseText(text.trim());
        }
        return null;
    }

    private static Instant parseText(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            TemporalAccessor parsed = LENIENT.parseBest(text, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime odt) {
                return odt.toInstant();
            }
            if (parsed instanceof LocalDateTime ldt) {
                return ldt.toInstant(ZoneOffset.UTC);
            }
            return ((LocalDate) parsed).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }
}
