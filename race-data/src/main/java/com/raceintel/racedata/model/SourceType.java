package com.raceintel.racedata.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The five CSV source shapes, declared in import order.
 *
 * Files are matched by a case-insensitive substring of the file name plus a
 * {@code .csv} extension, e.g. {@code R1_lap_time.csv}, {@code 03_Results GR Cup Race 1.CSV},
 * {@code 23_AnalysisEnduranceWithSections_Race 1.CSV}, {@code 26_Weather_Race 1.CSV}.
 */
public enum SourceType {

    RESULTS("race_results", List.of("results")),
    LAP_TIMES("lap_times", List.of("lap_time")),
    SECTIONS("section_times", List.of("endurance", "section")),
    TELEMETRY("telemetry", List.of("telemetry")),
    WEATHER("weather", List.of("weather"));

    private final String table;
    private final List<String> fileMarkers;

    SourceType(String table, List<String> fileMarkers) {
        this.table = table;
        this.fileMarkers = fileMarkers;
    }

    public String table() {
        return table;
    }

    public static Optional<SourceType> forFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (!lower.endsWith(".csv")) return Optional.empty();
        for (SourceType type : values()) {
            if (type.fileMarkers.stream().anyMatch(lower::contains)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
