package com.raceintel.racedata.replay;

import com.raceintel.racedata.config.RaceDataProperties;

import java.util.Arrays;
import java.util.List;

/**
 * What a subscriber asked to replay.
 *
 * @param lap            null replays every lap
 * @param telemetryNames empty replays every channel
 * @param playbackSpeed  1.0 is real time, 2.0 twice as fast
 */
public record ReplayRequest(String vehicleId, Integer lap, List<String> telemetryNames, double playbackSpeed) {

    public ReplayRequest {
        if (vehicleId == null || vehicleId.isBlank()) {
            throw new IllegalArgumentException("vehicleId is required");
        }
        if (lap != null && lap < 1) {
            throw new IllegalArgumentException("lap must be a positive integer");
        }
        if (!(playbackSpeed > 0) || Double.isInfinite(playbackSpeed)) {
            throw new IllegalArgumentException("playbackSpeed must be a positive number");
        }
        telemetryNames = telemetryNames == null ? List.of() : List.copyOf(telemetryNames);
    }

    /**
     * Build a request from raw query values, applying the configured default speed
     * and clamping the speed into the configured range.
     *
     * @param telemetryNames comma-separated channel names, may be null
     */
    public static ReplayRequest of(String vehicleId, Integer lap, String telemetryNames,
                                   Double playbackSpeed, RaceDataProperties.Replay config) {
        double speed = playbackSpeed == null || playbackSpeed.isNaN()
                ? config.getDefaultPlaybackSpeed()
                : Math.max(config.getMinPlaybackSpeed(), Math.min(config.getMaxPlaybackSpeed(), playbackSpeed));

        List<String> names = telemetryNames == null ? List.of() : Arrays.stream(telemetryNames.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();

        return new ReplayRequest(vehicleId == null ? null : vehicleId.trim(), lap, names, speed);
    }
}
