package com.raceintel.racedata.replay;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One event of a replay stream. {@code data} is serialised to JSON by the sink.
 */
public record ReplayEvent(ReplayEventType type, Object data) {

    public static ReplayEvent connected(ReplayRequest request) {
        // lap is null for a whole-session replay, so Map.of is not an option
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("vehicleId", request.vehicleId());
        data.put("lap", request.lap());
        data.put("playbackSpeed", request.playbackSpeed());
        return new ReplayEvent(ReplayEventType.CONNECTED, data);
    }

    public static ReplayEvent telemetry(TelemetryPoint point) {
        return new ReplayEvent(ReplayEventType.TELEMETRY, point);
    }

    public static ReplayEvent complete() {
        return new ReplayEvent(ReplayEventType.COMPLETE, Map.of("message", "Stream completed"));
    }

    public static ReplayEvent error(String message) {
        return new ReplayEvent(ReplayEventType.ERROR, Map.of("error", message == null ? "Stream failed" : message));
    }
}
