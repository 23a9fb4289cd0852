package com.raceintel.racedata.parser;

import com.raceintel.racedata.model.ResultRow;
import com.raceintel.racedata.model.SourceType;
import org.springframework.stereotype.Component;

/**
 * Official classification sheet (semicolon separated).
 *
 * Columns: POSITION, NUMBER, LAPS, TOTAL_TIME, GAP_FIRST, GAP_PREVIOUS, FL_TIME, CLASS.
 * Lines without a position, number or lap count (DNS entries) are dropped.
 */
@Component
public class RaceResultCsvParser extends VehicleCsvSourceParser<ResultRow> {

    @Override
    public SourceType sourceType() {
        return SourceType.RESULTS;
    }

    @Override
    protected ResultRow mapRow(CsvRow row) {
        int number = row.requireInt("number");
        return ResultRow.builder()
                .vehicleRef(String.valueOf(number))
                .carNumber(number)
                .position(row.requireInt("position", "pos"))
                .laps(row.requireInt("laps"))
                .totalTime(row.get("total_time"))
                .gapFirst(row.get("gap_first"))
                .gapPrevious(row.get("gap_previous"))
                .bestLapTime(row.get("fl_time", "best_lap_time"))
                .vehicleClass(row.get("class"))
                .build();
    }
}
