package com.raceintel.racedata.config;

import com.raceintel.racedata.exception.RaceDataException;
import com.raceintel.racedata.output.SchemaManager;
import com.raceintel.racedata.replay.ReplayRequest;
import com.raceintel.racedata.replay.ReplayScheduler;
import com.raceintel.racedata.replay.ReplaySession;
import com.raceintel.racedata.replay.SseReplayEventSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ReplayController {

    private final ReplayScheduler replayScheduler;
    private final SchemaManager schemaManager;
    private final RaceDataProperties properties;

    // ── Replay stream ─────────────────────────────────────────────────────────

    /**
     * Replay a vehicle's telemetry as server-sent events.
     *
     * GET /api/telemetry/stream/GR86-004-78?lap=3&telemetryNames=speed,gear&playbackSpeed=2
     *
     * Events: connected, telemetry (one per row, chronological), then complete or error.
     */
    @GetMapping("/api/telemetry/stream/{vehicleId}")
    public ResponseEntity<?> stream(
            @PathVariable String vehicleId,
            @RequestParam(required = false) Integer lap,
            @RequestParam(required = false) String telemetryNames,
            @RequestParam(required = false) Double playbackSpeed) {
        try {
            ReplayRequest request = ReplayRequest.of(vehicleId, lap, telemetryNames, playbackSpeed, properties.getReplay());

            SseEmitter emitter = new SseEmitter(properties.getReplay().getEmitterTimeoutMs());
            ReplaySession session = replayScheduler.start(request, new SseReplayEventSink(emitter));
            emitter.onCompletion(session::cancel);
            emitter.onTimeout(session::cancel);
            emitter.onError(e -> session.cancel());

            return ResponseEntity.ok()
                    .header("Cache-Control", "no-cache")
                    .header("X-Accel-Buffering", "no")
                    .body(emitter);

        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("error", e.getMessage()));
        } catch (RaceDataException e) {
            log.warn("Replay for {} refused: {}", vehicleId, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("error", e.getMessage(), "code", e.getCode().name()));
        }
    }

    // ── Status ────────────────────────────────────────────────────────────────

    @GetMapping("/api/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "race-data");
        body.put("version", "1.0.0");
        body.put("schemaVersion", schemaManager.schemaVersion());
        body.put("activeReplaySessions", replayScheduler.activeSessions());
        return ResponseEntity.ok(body);
    }
}
