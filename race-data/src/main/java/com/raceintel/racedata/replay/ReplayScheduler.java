package com.raceintel.racedata.replay;

import com.raceintel.racedata.config.RaceDataProperties;
import com.raceintel.racedata.exception.ErrorCode;
import com.raceintel.racedata.exception.RaceDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starts replay sessions on the bounded replay pool. Sessions share nothing but the pool;
 * each owns its cursor, state and cancellation token.
 */
@Component
@Slf4j
public class ReplayScheduler {

    private final TaskExecutor executor;
    private final TelemetryPageReader reader;
    private final RaceDataProperties properties;
    private final Set<ReplaySession> active = ConcurrentHashMap.newKeySet();

    public ReplayScheduler(@Qualifier("replayExecutor") TaskExecutor executor,
                           TelemetryPageReader reader,
                           RaceDataProperties properties) {
        this.executor = executor;
        this.reader = reader;
        this.properties = properties;
    }

    /**
     * @throws RaceDataException with {@link ErrorCode#STREAM_ERROR} when every replay slot is busy
     */
    public ReplaySession start(ReplayRequest request, ReplayEventSink sink) {
        RaceDataProperties.Replay config = properties.getReplay();
        ReplaySession session = new ReplaySession(request, sink, reader,
                config.getPageSize(), Duration.ofMillis(config.getMinDelayMs()));

        active.add(session);
        try {
            executor.execute(() -> {
                try {
                    session.run();
                } finally {
                    active.remove(session);
                }
            });
        } catch (TaskRejectedException e) {
            active.remove(session);
            throw new RaceDataException(ErrorCode.STREAM_ERROR,
                    "Too many concurrent replay sessions (max " + config.getMaxConcurrentSessions() + ")", e);
        }

        log.info("Replay {} started: vehicle {}, lap {}, channels {}, {}x",
                session.sessionId(), request.vehicleId(), request.lap() == null ? "all" : request.lap(),
                request.telemetryNames().isEmpty() ? "all" : request.telemetryNames(), request.playbackSpeed());
        return session;
    }

    public int activeSessions() {
        return active.size();
    }
}
