package com.raceintel.racedata.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

@Value
@Builder
public class LapRow implements VehicleScopedRow<LapRow> {

    String vehicleRef;

    @With
    String vehicleId;

    int lap;

    /** Elapsed lap time in milliseconds */
    double lapTime;

    /** Nullable: some timing feeds omit the crossing time */
    Instant timestamp;
}
