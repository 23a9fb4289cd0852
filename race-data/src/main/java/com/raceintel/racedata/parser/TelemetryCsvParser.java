package com.raceintel.racedata.parser;

import com.raceintel.racedata.model.SourceType;
import com.raceintel.racedata.model.TelemetryRow;
import org.springframework.stereotype.Component;

/**
 * Logger export in long format: one line per (timestamp, channel) sample.
 *
 * Columns: vehicle_id (or vehicle_number), lap, timestamp, telemetry_name, telemetry_value.
 * Rows are not assumed to be in time order.
 */
@Component
public class TelemetryCsvParser extends VehicleCsvSourceParser<TelemetryRow> {

    @Override
    public SourceType sourceType() {
        return SourceType.TELEMETRY;
    }

    @Override
    protected TelemetryRow mapRow(CsvRow row) {
        return TelemetryRow.builder()
                .vehicleRef(row.require("vehicle_id", "vehicle_number", "number"))
                .lap(row.optionalInt("lap"))
                .timestamp(row.requireTimestamp("timestamp", "meta_time"))
                .telemetryName(row.require("telemetry_name"))
                .telemetryValue(row.requireDouble("telemetry_value"))
                .build();
    }
}
