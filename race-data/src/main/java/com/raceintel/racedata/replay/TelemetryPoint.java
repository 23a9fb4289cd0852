package com.raceintel.racedata.replay;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.raceintel.racedata.output.StoreTimestamps;

import java.time.Instant;

/**
 * A stored telemetry row as sent to replay subscribers. JSON names follow the table columns.
 */
public record TelemetryPoint(
        long id,
        @JsonProperty("vehicle_id") String vehicleId,
        Integer lap,
        String timestamp,
        @JsonProperty("telemetry_name") String telemetryName,
        @JsonProperty("telemetry_value") double telemetryValue) {

    @JsonIgnore
    public Instant instant() {
        return StoreTimestamps.parse(timestamp);
    }
}
