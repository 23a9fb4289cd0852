package com.raceintel.racedata.model;

/**
 * Count and range of one telemetry channel for a vehicle.
 */
public record ChannelSummary(String telemetryName, long count, double min, double max, double avg) {}
