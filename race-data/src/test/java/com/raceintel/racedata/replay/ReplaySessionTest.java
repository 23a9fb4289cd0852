package com.raceintel.racedata.replay;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Replay session behaviour with an in-memory reader.
 *
 * Tests cover:
 * 1. Connected, every row in order across pages, complete
 * 2. Playback speed scales the waits
 * 3. Cancel wakes a pending wait and stops the stream
 * 4. Read failure produces exactly one error event
 * 5. A failing sink ends the session as aborted
 * 6. Cancelled before start: nothing is sent
 * 7. Empty replay still connects and completes
 */
class ReplaySessionTest {

    private static final String CAR = "GR86-004-78";
    private static final Duration MIN_DELAY = Duration.ofMillis(1);

    private ReplaySession session(InMemoryPageReader reader, RecordingSink sink, double speed, int pageSize) {
        return new ReplaySession(new ReplayRequest(CAR, null, null, speed), sink, reader, pageSize, MIN_DELAY);
    }

    /**
     * Test 1: M rows produce M + 2 events, telemetry in chronological order
     */
    @Test
    void testAllRowsInOrderAcrossPages() {
        // offsets out of order; ids follow the offsets array
        InMemoryPageReader reader = InMemoryPageReader.spaced(CAR, 0, 0, 1, 0, 1);
        RecordingSink sink = new RecordingSink();

        ReplaySession session = session(reader, sink, 10.0, 2);
        session.run();

        assertEquals(ReplayState.COMPLETED, session.state());
        assertEquals(7, sink.events.size());
        assertEquals(ReplayEventType.CONNECTED, sink.types().get(0));
        assertEquals(ReplayEventType.COMPLETE, sink.types().get(6));
        assertEquals(5, sink.count(ReplayEventType.TELEMETRY));

        List<Long> ids = sink.events.stream()
                .filter(e -> e.type() == ReplayEventType.TELEMETRY)
                .map(e -> ((TelemetryPoint) e.data()).id())
                .toList();
        assertEquals(List.of(1L, 2L, 4L, 3L, 5L), ids);

        @SuppressWarnings("unchecked")
        Map<String, Object> connected = (Map<String, Object>) sink.events.get(0).data();
        assertEquals(CAR, connected.get("vehicleId"));
        assertEquals(10.0, connected.get("playbackSpeed"));
        assertTrue(sink.completed);
    }

    /**
     * Test 2: 400 ms of recorded gaps at 4x take about 100 ms
     */
    @Test
    void testPlaybackSpeedScalesDelay() {
        InMemoryPageReader reader = InMemoryPageReader.spaced(CAR, 0, 200, 400);
        RecordingSink sink = new RecordingSink();

        long start = System.nanoTime();
        session(reader, sink, 4.0, 100).run();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(5, sink.events.size());
        assertTrue(elapsedMs >= 90, "waited only " + elapsedMs + " ms");
        assertTrue(elapsedMs < 380, "waited " + elapsedMs + " ms, speed not applied");
    }

    /**
     * Test 3: cancel during a 10 s gap ends the session promptly with no further events
     */
    @Test
    void testCancelWakesPendingWait() throws InterruptedException {
        InMemoryPageReader reader = InMemoryPageReader.spaced(CAR, 0, 10_000, 20_000);
        RecordingSink sink = new RecordingSink();
        ReplaySession session = session(reader, sink, 1.0, 100);

        Thread worker = new Thread(session, "replay-test");
        worker.start();
        assertTrue(sink.firstTelemetry.await(2, TimeUnit.SECONDS));

        session.cancel();
        session.cancel();

        assertTrue(session.awaitTermination(2, TimeUnit.SECONDS));
        assertEquals(ReplayState.ABORTED, session.state());
        assertEquals(List.of(ReplayEventType.CONNECTED, ReplayEventType.TELEMETRY), sink.types());
        assertEquals(0, sink.count(ReplayEventType.COMPLETE));
        worker.join(2000);
    }

    /**
     * Test 4: the second page read fails; rows from the first page were delivered
     */
    @Test
    void testReadFailureEmitsSingleError() {
        InMemoryPageReader reader = InMemoryPageReader.spaced(CAR, 0, 0, 0, 0).failOnRead(2);
        RecordingSink sink = new RecordingSink();

        ReplaySession session = session(reader, sink, 1.0, 2);
        session.run();

        assertEquals(ReplayState.ERRORED, session.state());
        assertEquals(List.of(ReplayEventType.CONNECTED, ReplayEventType.TELEMETRY,
                ReplayEventType.TELEMETRY, ReplayEventType.ERROR), sink.types());

        @SuppressWarnings("unchecked")
        Map<String, Object> error = (Map<String, Object>) sink.events.get(3).data();
        assertTrue(error.get("error").toString().contains("disk I/O error"));
    }

    /**
     * Test 5: the client goes away on the second telemetry event
     */
    @Test
    void testSinkFailureAborts() {
        InMemoryPageReader reader = InMemoryPageReader.spaced(CAR, 0, 0, 0, 0, 0);
        RecordingSink sink = new RecordingSink().failOnSend(3);

        ReplaySession session = session(reader, sink, 1.0, 2);
        session.run();

        assertEquals(ReplayState.ABORTED, session.state());
        assertEquals(2, sink.events.size());
        assertEquals(0, sink.count(ReplayEventType.ERROR));
        // nothing is read past the page that was being delivered
        assertEquals(1, reader.reads());
    }

    /**
     * Test 6: cancelled before the worker picked it up
     */
    @Test
    void testCancelledBeforeStart() {
        InMemoryPageReader reader = InMemoryPageReader.spaced(CAR, 0, 10);
        RecordingSink sink = new RecordingSink();
        ReplaySession session = session(reader, sink, 1.0, 100);

        session.cancel();
        session.run();

        assertEquals(ReplayState.ABORTED, session.state());
        assertTrue(sink.events.isEmpty());
        assertEquals(0, reader.reads());
    }

    /**
     * Test 7: no rows for the vehicle
     */
    @Test
    void testEmptyReplay() {
        RecordingSink sink = new RecordingSink();
        ReplaySession session = session(InMemoryPageReader.spaced("GR86-004-1", 0), sink, 1.0, 100);
        session.run();

        assertEquals(ReplayState.COMPLETED, session.state());
        assertEquals(List.of(ReplayEventType.CONNECTED, ReplayEventType.COMPLETE), sink.types());
    }
}
