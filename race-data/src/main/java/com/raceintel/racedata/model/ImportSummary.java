package com.raceintel.racedata.model;

import lombok.Data;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-entity counts for one import run, printed by the CLI.
 */
@Data
public class ImportSummary {

    private int vehicles;
    private final Map<SourceType, Integer> written = new EnumMap<>(SourceType.class);
    private int rowsSkipped;
    private int filesImported;
    private int filesSkipped;

    public void addWritten(SourceType type, int count) {
        written.merge(type, count, Integer::sum);
    }

    public int written(SourceType type) {
        return written.getOrDefault(type, 0);
    }
}
