package com.raceintel.racedata.model;

/**
 * A parsed row that belongs to a vehicle.
 *
 * {@code vehicleRef} is whatever the source supplied (a vehicle id or a bare car number);
 * {@code vehicleId} is the canonical id, filled in once the row has been resolved.
 */
public interface VehicleScopedRow<T extends VehicleScopedRow<T>> {

    String getVehicleRef();

    String getVehicleId();

    T withVehicleId(String vehicleId);
}
