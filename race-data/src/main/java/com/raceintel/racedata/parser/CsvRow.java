package com.raceintel.racedata.parser;

import java.time.Instant;
import java.time.DateTimeException;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * One data line of a CSV file, addressed by normalised header name.
 *
 * Every accessor takes a list of candidate column names and uses the first one
 * present with a non-blank value, so a parser can accept the spellings different
 * exports use for the same column.
 */
public final class CsvRow {

    private final Map<String, Integer> header;
    private final String[] values;
    private final long lineNumber;

    CsvRow(Map<String, Integer> header, String[] values, long lineNumber) {
        this.header = header;
        this.values = values;
        this.lineNumber = lineNumber;
    }

    public long lineNumber() {
        return lineNumber;
    }

    public String get(String... columns) {
        for (String column : columns) {
            Integer idx = header.get(column);
            if (idx == null || idx >= values.length) continue;
            String value = values[idx];
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    public String require(String... columns) {
        String value = get(columns);
        if (value == null) {
            throw new CsvRowException("missing " + columns[0]);
        }
        return value;
    }

    public int requireInt(String... columns) {
        return convert(require(columns), columns[0], RaceTimeParser::integer);
    }

    public Integer optionalInt(String... columns) {
        return convert(get(columns), columns[0], RaceTimeParser::integer);
    }

    public double requireDouble(String... columns) {
        return convert(require(columns), columns[0], RaceTimeParser::decimal);
    }

    public Double optionalDouble(String... columns) {
        return convert(get(columns), columns[0], RaceTimeParser::decimal);
    }

    public Double duration(TimeUnit plainUnit, String... columns) {
        return convert(get(columns), columns[0], v -> RaceTimeParser.durationMillis(v, plainUnit));
    }

    public Instant requireTimestamp(String... columns) {
        return convert(require(columns), columns[0], RaceTimeParser::timestamp);
    }

    public Instant optionalTimestamp(String... columns) {
        return convert(get(columns), columns[0], RaceTimeParser::timestamp);
    }

    private <R> R convert(String raw, String column, Function<String, R> converter) {
        if (raw == null) return null;
        try {
            return converter.apply(raw);
        } catch (IllegalArgumentException | ArithmeticException | DateTimeException e) {
            throw new CsvRowException("bad " + column + " '" + raw + "'");
        }
    }
}
