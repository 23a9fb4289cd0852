package com.raceintel.racedata.replay;

/**
 * Lifecycle of one replay session. COMPLETED, ABORTED and ERRORED are terminal.
 */
public enum ReplayState {
    IDLE,
    CONNECTED,
    STREAMING,
    COMPLETED,
    ABORTED,
    ERRORED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED || this == ERRORED;
    }
}
