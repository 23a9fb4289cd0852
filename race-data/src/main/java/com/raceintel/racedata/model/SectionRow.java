package com.raceintel.racedata.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Sector split for one lap. All times in milliseconds; any sector may be missing.
 */
@Value
@Builder
public class SectionRow implements VehicleScopedRow<SectionRow> {

    String vehicleRef;

    @With
    String vehicleId;

    int lap;
    Double s1;
    Double s2;
    Double s3;
    Double lapTime;
    Double topSpeed;
}
