package com.raceintel.racedata.parser;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.concurrent.TimeUnit;

/**
 * Converts the textual encodings used by timing and logger exports into numbers.
 *
 * <ul>
 *   <li>clock strings {@code m:ss.mmm} / {@code h:mm:ss.mmm} become milliseconds</li>
 *   <li>ISO-8601 timestamps (with or without offset), and epoch seconds or millis, become {@link Instant}</li>
 * </ul>
 *
 * All methods return null for blank input and throw {@link NumberFormatException} or
 * {@link DateTimeParseException} for input they cannot read.
 */
public final class RaceTimeParser {

    /** Epoch values above this are taken as milliseconds (year 5138 in seconds) */
    private static final double EPOCH_MILLIS_THRESHOLD = 1e11;

    private RaceTimeParser() {
    }

    /**
     * Parse a duration. Clock strings are always read as clock time; a plain number
     * is read in {@code plainUnit} (MILLISECONDS or SECONDS).
     */
    public static Double durationMillis(String text, TimeUnit plainUnit) {
        if (isBlank(text)) return null;
        String value = text.trim();

        if (value.indexOf(':') < 0) {
            double plain = Double.parseDouble(value);
            return plainUnit == TimeUnit.SECONDS ? plain * 1000.0 : plain;
        }

        String[] parts = value.split(":", -1);
        if (parts.length < 2 || parts.length > 3) {
            throw new NumberFormatException("Not a clock time: " + text);
        }
        for (String part : parts) {
            if (part.isBlank()) {
                throw new NumberFormatException("Not a clock time: " + text);
            }
        }
        double seconds = Double.parseDouble(parts[parts.length - 1]);
        int minutes = Integer.parseInt(parts[parts.length - 2].trim());
        int hours = parts.length == 3 ? Integer.parseInt(parts[0].trim()) : 0;
        if (seconds < 0 || seconds >= 60 || minutes < 0 || hours < 0) {
            throw new NumberFormatException("Not a clock time: " + text);
        }
        return ((hours * 60 + minutes) * 60 + seconds) * 1000.0;
    }

    public static Instant timestamp(String text) {
        if (isBlank(text)) return null;
        String value = text.trim();

        if (isNumeric(value)) {
            double epoch = Double.parseDouble(value);
            long millis = epoch > EPOCH_MILLIS_THRESHOLD
                    ? (long) epoch
                    : new BigDecimal(value).movePointRight(3).longValue();
            return Instant.ofEpochMilli(millis);
        }

        String iso = value.replace(' ', 'T');
        try {
            return OffsetDateTime.parse(iso).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(iso).toInstant(ZoneOffset.UTC);
        }
    }

    /** Accepts "12" and "12.0"; rejects "12.5". */
    public static Integer integer(String text) {
        if (isBlank(text)) return null;
        String value = text.trim();
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            try {
                return new BigDecimal(value).intValueExact();
            } catch (ArithmeticException notWhole) {
                throw new NumberFormatException("Not a whole number: " + text);
            }
        }
    }

    public static Double decimal(String text) {
        if (isBlank(text)) return null;
        double value = Double.parseDouble(text.trim().replace(',', '.'));
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new NumberFormatException("Not a finite number: " + text);
        }
        return value;
    }

    static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }

    private static boolean isNumeric(String value) {
        int dots = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '.') {
                dots++;
            } else if (!Character.isDigit(c)) {
                return false;
            }
        }
        return dots <= 1 && !value.isEmpty();
    }
}
