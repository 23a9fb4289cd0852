package com.raceintel.racedata.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

@Value
@Builder
public class TelemetryRow implements VehicleScopedRow<TelemetryRow> {

    String vehicleRef;

    @With
    String vehicleId;

    /** Null when the logger had not assigned a lap yet */
    Integer lap;

    Instant timestamp;

    /** Channel name, e.g. vCar, speed_can, pbrake_f, aps */
    String telemetryName;

    double telemetryValue;
}
