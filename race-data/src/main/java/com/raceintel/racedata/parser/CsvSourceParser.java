package com.raceintel.racedata.parser;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.ICSVParser;
import com.opencsv.exceptions.CsvValidationException;
import com.raceintel.racedata.exception.ImportException;
import com.raceintel.racedata.model.SourceType;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Base for the per-source CSV parsers.
 *
 * Handles what every timing export has in common:
 *  - delimiter sniffed from the header line (timing sheets use ';', logger exports ',')
 *  - header names trimmed, BOM stripped and lower-cased; unknown columns ignored
 *  - no escape character: backslashes in channel names are data
 *  - a malformed row is dropped and counted, never fatal to the file
 *
 * Only an unreadable file (I/O failure, no header) raises {@link ImportException}.
 */
@Slf4j
public abstract class CsvSourceParser<T> {

    private static final int MAX_REPORTED_SKIPS = 5;
    private static final int HEADER_PEEK_CHARS = 64 * 1024;

    public abstract SourceType sourceType();

    /**
     * Map one data row. Throw {@link CsvRowException} (via the {@link CsvRow} accessors)
     * when the row cannot yield a record.
     */
    protected abstract T mapRow(CsvRow row);

    public ParseResult<T> parse(Path file) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader, file.getFileName().toString());
        } catch (IOException e) {
            throw new ImportException("Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    public ParseResult<T> parse(Reader source, String sourceName) {
        BufferedReader reader = source instanceof BufferedReader b ? b : new BufferedReader(source);
        try {
            char separator = sniffSeparator(reader);
            CSVReader csv = new CSVReaderBuilder(reader)
                    .withCSVParser(new CSVParserBuilder()
                            .withSeparator(separator)
                            .withEscapeChar(ICSVParser.NULL_CHARACTER)
                            .build())
                    .build();

            String[] headerLine = csv.readNext();
            if (headerLine == null) {
                throw new ImportException("No header row in " + sourceName);
            }
            Map<String, Integer> header = normaliseHeader(headerLine);

            List<T> rows = new ArrayList<>();
            List<String> skipReasons = new ArrayList<>();
            int skipped = 0;

            String[] values;
            while ((values = csv.readNext()) != null) {
                if (isBlankLine(values)) continue;
                long lineNumber = csv.getLinesRead();
                try {
                    rows.add(mapRow(new CsvRow(header, values, lineNumber)));
                } catch (CsvRowException e) {
                    skipped++;
                    if (skipReasons.size() < MAX_REPORTED_SKIPS) {
                        skipReasons.add("line " + lineNumber + ": " + e.getMessage());
                    }
                }
            }

            if (skipped > 0) {
                log.warn("Parsed {} ({}): {} records, {} malformed skipped, e.g. {}",
                        sourceName, sourceType(), rows.size(), skipped, skipReasons);
            } else {
                log.info("Parsed {} ({}): {} records", sourceName, sourceType(), rows.size());
            }
            return new ParseResult<>(sourceName, rows, skipped, skipReasons);

        } catch (IOException | CsvValidationException e) {
            throw new ImportException("Cannot parse " + sourceName + ": " + e.getMessage(), e);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private char sniffSeparator(BufferedReader reader) throws IOException {
        reader.mark(HEADER_PEEK_CHARS);
        String first = reader.readLine();
        reader.reset();
        if (first == null) return ',';

        long semicolons = first.chars().filter(c -> c == ';').count();
        long commas = first.chars().filter(c -> c == ',').count();
        return semicolons > commas ? ';' : ',';
    }

    private Map<String, Integer> normaliseHeader(String[] headerLine) {
        Map<String, Integer> header = new HashMap<>();
        for (int i = 0; i < headerLine.length; i++) {
            String name = headerLine[i] == null ? "" : headerLine[i];
            name = name.replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
            if (!name.isEmpty()) {
                header.putIfAbsent(name, i);
            }
        }
        return header;
    }

    private boolean isBlankLine(String[] values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return false;
        }
        return true;
    }
}
