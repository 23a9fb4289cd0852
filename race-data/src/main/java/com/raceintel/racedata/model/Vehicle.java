package com.raceintel.racedata.model;

import lombok.Builder;
import lombok.Data;

/**
 * A row of the vehicles table. Summary fields are derived from the raw rows
 * and are null until the aggregate pass has run (or when there is nothing to derive from).
 */
@Data
@Builder
public class Vehicle {

    private String vehicleId;
    private int carNumber;
    private String vehicleClass;
    private Double fastestLap;
    private Double averageLap;
    private Integer totalLaps;
    private Double maxSpeed;
    private Integer position;
}
