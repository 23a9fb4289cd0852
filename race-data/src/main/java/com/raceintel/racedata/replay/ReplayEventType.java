package com.raceintel.racedata.replay;

/**
 * Named server-sent events of the replay protocol.
 */
public enum ReplayEventType {
    CONNECTED("connected"),
    TELEMETRY("telemetry"),
    COMPLETE("complete"),
    ERROR("error");

    private final String eventName;

    ReplayEventType(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }
}
