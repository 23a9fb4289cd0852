package com.raceintel.racedata.replay;

import java.util.List;

/**
 * Reads one page of a vehicle's telemetry in (timestamp, id) order.
 */
public interface TelemetryPageReader {

    /**
     * @param after last point of the previous page, or null for the first page
     * @param limit maximum rows to return
     * @return the next rows strictly after {@code after}; empty when exhausted
     */
    List<TelemetryPoint> readPage(ReplayRequest request, TelemetryPoint after, int limit);
}
