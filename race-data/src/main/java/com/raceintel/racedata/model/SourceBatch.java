package com.raceintel.racedata.model;

import java.util.List;

/**
 * All rows parsed from one source file, tagged with their source type.
 * This is the unit the loader writes in a single transaction.
 */
public record SourceBatch(String fileName, SourceType type, List<?> rows) {

    public int size() {
        return rows.size();
    }

    public <T> List<T> rowsAs(Class<T> rowType) {
        return rows.stream().map(rowType::cast).toList();
    }
}
