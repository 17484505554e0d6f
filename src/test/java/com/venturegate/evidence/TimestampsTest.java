package com.venturegate.evidence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

class TimestampsTest {

    private static final Instant NOW = Instant.parse("2026-03-15T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Nested
    @DisplayName("Recognized values")
    class Recognized {

        @Test
        void isoInstantString() {
            assertEquals(Instant.parse("2025-11-02T08:30:00Z"), Timestamps.parseOrNow("2025-11-02T08:30:00Z", CLOCK));
        }

        @Test
        void postgresStyleWithSpaceAndShortOffset() {
            assertEquals(Instant.parse("2025-11-02T06:30:00Z"),
                Timestamps.parseOrNow("2025-11-02 08:30:00.123456+02", CLOCK).truncatedTo(ChronoUnit.SECONDS));
        }

        @Test
        void localDateTimeStringIsUtc() {
            assertEquals(Instant.parse("2025-11-02T08:30:00Z"), Timestamps.parseOrNow("2025-11-02T08:30:00", CLOCK));
        }

        @Test
        void dateOnlyStringIsStartOfDayUtc() {
            assertEquals(Instant.parse("2025-11-02T00:00:00Z"), Timestamps.parseOrNow("2025-11-02", CLOCK));
        }

        @Test
        void javaTimeAndLegacyTypes() {
            Instant expected = Instant.parse("2025-01-01T00:00:00Z");
            assertEquals(expected, Timestamps.parseOrNow(expected, CLOCK));
            assertEquals(expected, Timestamps.parseOrNow(Date.from(expected), CLOCK));
            assertEquals(expected, Timestamps.parseOrNow(OffsetDateTime.ofInstant(expected, ZoneOffset.UTC), CLOCK));
            assertEquals(expected, Timestamps.parseOrNow(LocalDateTime.of(2025, 1, 1, 0, 0), CLOCK));
            assertEquals(expected, Timestamps.parseOrNow(LocalDate.of(2025, 1, 1), CLOCK));
        }

        @Test
        void epochMillis() {
            assertEquals(Instant.ofEpochMilli(1_700_000_000_000L), Timestamps.parseOrNow(1_700_000_000_000L, CLOCK));
        }
    }

    @Nested
    @DisplayName("Unusable values fall back to now")
    class Fallback {

        @Test
        void nullIsNow() {
            assertEquals(NOW, Timestamps.parseOrNow(null, CLOCK));
            assertEquals(NOW, Timestamps.orNow(null, CLOCK));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "not a date", "2025-13-45", "yesterday", "Invalid Date"})
        void garbageStringIsNow(String raw) {
            assertEquals(NOW, Timestamps.parseOrNow(raw, CLOCK));
        }

        @Test
        void nonFiniteNumberIsNow() {
            assertEquals(NOW, Timestamps.parseOrNow(Double.NaN, CLOCK));
            assertEquals(NOW, Timestamps.parseOrNow(Double.POSITIVE_INFINITY, CLOCK));
        }

        @Test
        void unrelatedTypeIsNow() {
            assertEquals(NOW, Timestamps.parseOrNow(new Object(), CLOCK));
            assertEquals(NOW, Timestamps.parseOrNow(true, CLOCK));
        }
    }
}
