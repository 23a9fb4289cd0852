package com.raceintel.racedata.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Classification line for one vehicle. Time and gap columns are kept as the
 * timing system printed them ("+1.234", "1 Lap", "45:12.345").
 */
@Value
@Builder
public class ResultRow implements VehicleScopedRow<ResultRow> {

    String vehicleRef;

    @With
    String vehicleId;

    int position;
    int carNumber;
    int laps;
    String totalTime;
    String gapFirst;
    String gapPrevious;
    String bestLapTime;
    String vehicleClass;
}
