package com.raceintel.racedata.parser;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RaceTimeParserTest {

    @Test
    void testClockStringsBecomeMilliseconds() {
        assertEquals(94_500.0, RaceTimeParser.durationMillis("1:34.500", TimeUnit.MILLISECONDS));
        assertEquals(3_723_250.0, RaceTimeParser.durationMillis("1:02:03.250", TimeUnit.MILLISECONDS));
        assertEquals(45_123.0, RaceTimeParser.durationMillis("0:45.123", TimeUnit.SECONDS), 1e-6);
    }

    @Test
    void testPlainNumbersUseTheGivenUnit() {
        assertEquals(95_123.0, RaceTimeParser.durationMillis("95123", TimeUnit.MILLISECONDS));
        assertEquals(32_456.0, RaceTimeParser.durationMillis("32.456", TimeUnit.SECONDS), 1e-6);
    }

    @Test
    void testBlankDurationIsNull() {
        assertNull(RaceTimeParser.durationMillis("  ", TimeUnit.SECONDS));
        assertNull(RaceTimeParser.durationMillis(null, TimeUnit.SECONDS));
    }

    @Test
    void testInvalidClockStringRejected() {
        assertThrows(NumberFormatException.class, () -> RaceTimeParser.durationMillis("1:75.000", TimeUnit.SECONDS));
        assertThrows(NumberFormatException.class, () -> RaceTimeParser.durationMillis("abc", TimeUnit.SECONDS));
    }

    @Test
    void testTruncatedClockStringRejected() {
        assertThrows(NumberFormatException.class, () -> RaceTimeParser.durationMillis("1:", TimeUnit.MILLISECONDS));
        assertThrows(NumberFormatException.class, () -> RaceTimeParser.durationMillis(":", TimeUnit.MILLISECONDS));
        assertThrows(NumberFormatException.class, () -> RaceTimeParser.durationMillis(":34.500", TimeUnit.MILLISECONDS));
        assertThrows(NumberFormatException.class, () -> RaceTimeParser.durationMillis("1::34.500", TimeUnit.MILLISECONDS));
    }

    @Test
    void testTimestampFormats() {
        Instant expected = Instant.parse("2025-04-27T14:00:00.250Z");

        assertEquals(expected, RaceTimeParser.timestamp("2025-04-27T14:00:00.250Z"));
        assertEquals(expected, RaceTimeParser.timestamp("2025-04-27T16:00:00.250+02:00"));
        assertEquals(expected, RaceTimeParser.timestamp("2025-04-27 14:00:00.250"));
        assertEquals(expected, RaceTimeParser.timestamp(String.valueOf(expected.toEpochMilli())));
        assertEquals(expected, RaceTimeParser.timestamp((expected.toEpochMilli() / 1000) + ".25"));
    }

    @Test
    void testUnreadableTimestampRejected() {
        assertThrows(DateTimeParseException.class, () -> RaceTimeParser.timestamp("yesterday"));
    }

    @Test
    void testIntegersTolerateTrailingZeroDecimals() {
        assertEquals(12, RaceTimeParser.integer("12"));
        assertEquals(12, RaceTimeParser.integer("12.0"));
        assertThrows(NumberFormatException.class, () -> RaceTimeParser.integer("12.5"));
    }

    @Test
    void testDecimalCommaAccepted() {
        assertEquals(23.5, RaceTimeParser.decimal("23,5"));
        assertThrows(NumberFormatException.class, () -> RaceTimeParser.decimal("NaN"));
    }
}
