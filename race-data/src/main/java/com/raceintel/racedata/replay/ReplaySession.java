package com.raceintel.racedata.replay;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One subscriber's replay: a connected event, every matching telemetry row in
 * chronological order, then a complete event.
 *
 * Before each row the session waits the gap to the previous row's timestamp divided
 * by the playback speed, when that exceeds the minimum delay. The wait is on the
 * cancellation token, so {@link #cancel()} takes effect immediately and no event is sent
 * after it. A read failure ends the session with a single error event.
 */
@Slf4j
public class ReplaySession implements Runnable {

    private final String sessionId = UUID.randomUUID().toString();
    private final ReplayRequest request;
    private final ReplayEventSink sink;
    private final CancellationToken token = new CancellationToken();
    private final TelemetryCursor cursor;
    private final Duration minDelay;

    private final AtomicReference<ReplayState> state = new AtomicReference<>(ReplayState.IDLE);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile long eventsSent;

    public ReplaySession(ReplayRequest request, ReplayEventSink sink, TelemetryPageReader reader,
                         int pageSize, Duration minDelay) {
        this.request = request;
        this.sink = sink;
        this.cursor = new TelemetryCursor(reader, request, pageSize, token);
        this.minDelay = minDelay;
    }

    @Override
    public void run() {
        if (token.isCancelled() || !state.compareAndSet(ReplayState.IDLE, ReplayState.CONNECTED)) {
            finish(ReplayState.ABORTED);
            return;
        }
        log.debug("Replay {} started for {} at {}x", sessionId, request.vehicleId(), request.playbackSpeed());

        try {
            send(ReplayEvent.connected(request));
            state.compareAndSet(ReplayState.CONNECTED, ReplayState.STREAMING);

            Instant previous = null;
            while (!token.isCancelled() && cursor.hasNext()) {
                TelemetryPoint point = cursor.next();
                Instant current = point.instant();

                if (previous != null && waitFor(previous, current)) {
                    break;
                }
                if (token.isCancelled()) break;

                send(ReplayEvent.telemetry(point));
                previous = current;
            }

            if (token.isCancelled()) {
                finish(ReplayState.ABORTED);
            } else {
                send(ReplayEvent.complete());
                finish(ReplayState.COMPLETED);
            }

        } catch (IOException e) {
            log.debug("Replay {} subscriber went away: {}", sessionId, e.getMessage());
            token.cancel();
            finish(ReplayState.ABORTED);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            finish(ReplayState.ABORTED);
        } catch (RuntimeException e) {
            log.error("Replay {} for {} failed: {}", sessionId, request.vehicleId(), e.getMessage());
            sendError(e.getMessage());
            finish(ReplayState.ERRORED);
        }
    }

    /** Idempotent. No further event is started once this returns. */
    public void cancel() {
        token.cancel();
        state.compareAndSet(ReplayState.IDLE, ReplayState.ABORTED);
    }

    /**
     * @return true if the session reached a terminal state within the timeout
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    public ReplayState state() {
        return state.get();
    }

    public String sessionId() {
        return sessionId;
    }

    public ReplayRequest request() {
        return request;
    }

    public long eventsSent() {
        return eventsSent;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /**
     * @return true if cancelled while waiting
     */
    private boolean waitFor(Instant previous, Instant current) throws InterruptedException {
        long gapNanos = Duration.between(previous, current).toNanos();
        long scaledNanos = (long) (gapNanos / request.playbackSpeed());
        if (scaledNanos <= minDelay.toNanos()) {
            return token.isCancelled();
        }
        return token.await(Duration.ofNanos(scaledNanos));
    }

    private void send(ReplayEvent event) throws IOException {
        sink.send(event);
        eventsSent++;
    }

    private void sendError(String message) {
        if (token.isCancelled()) return;
        try {
            send(ReplayEvent.error(message));
        } catch (IOException e) {
            log.debug("Replay {} could not deliver error event: {}", sessionId, e.getMessage());
        }
    }

    private void finish(ReplayState terminal) {
        ReplayState current = state.get();
        if (!current.isTerminal()) {
            state.set(terminal);
        }
        try {
            sink.complete();
        } catch (RuntimeException e) {
            log.debug("Replay {} sink did not close cleanly: {}", sessionId, e.getMessage());
        }
        log.debug("Replay {} for {} ended {} after {} events", sessionId, request.vehicleId(), state.get(), eventsSent);
        terminated.countDown();
    }
}
