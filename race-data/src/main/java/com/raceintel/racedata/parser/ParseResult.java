package com.raceintel.racedata.parser;

import java.util.List;

/**
 * Rows recovered from one source file, plus what had to be dropped.
 *
 * @param skipReasons the first few skip reasons, "line N: reason", for logging
 */
public record ParseResult<T>(String source, List<T> rows, int skipped, List<String> skipReasons) {

    public int parsed() {
        return rows.size() + skipped;
    }
}
