package com.raceintel.racedata.model;

/**
 * Canonical vehicle id and the car number it was derived from.
 */
public record VehicleIdentity(String vehicleId, int carNumber) {}
