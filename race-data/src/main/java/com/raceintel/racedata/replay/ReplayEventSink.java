package com.raceintel.racedata.replay;

import java.io.IOException;

/**
 * Where a replay session delivers its events. An {@link IOException} from {@link #send}
 * means the subscriber has gone away; the session treats it as a cancellation.
 */
public interface ReplayEventSink {

    void send(ReplayEvent event) throws IOException;

    /** Called once when the session reaches a terminal state. */
    default void complete() {
    }
}
