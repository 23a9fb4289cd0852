package com.raceintel.racedata.parser;

import com.raceintel.racedata.model.SectionRow;
import com.raceintel.racedata.model.SourceType;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Endurance analysis with sections: one line per lap with sector splits.
 *
 * Columns: NUMBER, LAP_NUMBER, LAP_TIME, S1, S2, S3, TOP_SPEED. Times are clock strings
 * or plain seconds. Missing sectors are kept as null.
 */
@Component
public class SectionCsvParser extends VehicleCsvSourceParser<SectionRow> {

    @Override
    public SourceType sourceType() {
        return SourceType.SECTIONS;
    }

    @Override
    protected SectionRow mapRow(CsvRow row) {
        int number = row.requireInt("number");
        return SectionRow.builder()
                .vehicleRef(String.valueOf(number))
                .lap(row.requireInt("lap_number", "lap"))
                .s1(row.duration(TimeUnit.SECONDS, "s1", "s1_seconds"))
                .s2(row.duration(TimeUnit.SECONDS, "s2", "s2_seconds"))
                .s3(row.duration(TimeUnit.SECONDS, "s3", "s3_seconds"))
                .lapTime(row.duration(TimeUnit.SECONDS, "lap_time"))
                .topSpeed(row.optionalDouble("top_speed"))
                .build();
    }
}
