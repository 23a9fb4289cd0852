package com.raceintel.racedata.parser;

import com.raceintel.racedata.model.LapRow;
import com.raceintel.racedata.model.SourceType;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Lap timing export: one line per lap crossing.
 *
 * Columns: vehicle_id (or vehicle_number), lap, value (milliseconds, or an m:ss.mmm string), timestamp.
 */
@Component
public class LapTimeCsvParser extends VehicleCsvSourceParser<LapRow> {

    @Override
    public SourceType sourceType() {
        return SourceType.LAP_TIMES;
    }

    @Override
    protected LapRow mapRow(CsvRow row) {
        Double lapTime = row.duration(TimeUnit.MILLISECONDS, "value", "lap_time");
        if (lapTime == null) {
            throw new CsvRowException("missing value");
        }
        if (lapTime <= 0) {
            throw new CsvRowException("non-positive lap time " + lapTime);
        }

        return LapRow.builder()
                .vehicleRef(row.require("vehicle_id", "vehicle_number", "number"))
                .lap(row.requireInt("lap"))
                .lapTime(lapTime)
                .timestamp(row.optionalTimestamp("timestamp", "meta_time"))
                .build();
    }
}
