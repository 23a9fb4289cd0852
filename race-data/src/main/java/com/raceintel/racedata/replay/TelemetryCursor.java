package com.raceintel.racedata.replay;

import com.raceintel.racedata.exception.StreamException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Pull-based iterator over a replay's telemetry, fetching a page at a time.
 *
 * The cancellation token is checked before every page fetch, so a cancelled session
 * never issues another query. Read failures surface as {@link StreamException}.
 */
public class TelemetryCursor implements Iterator<TelemetryPoint> {

    private final TelemetryPageReader reader;
    private final ReplayRequest request;
    private final int pageSize;
    private final CancellationToken token;

    private final Deque<TelemetryPoint> buffer = new ArrayDeque<>();
    private TelemetryPoint last;
    private boolean exhausted;
    private int pagesRead;

    public TelemetryCursor(TelemetryPageReader reader, ReplayRequest request, int pageSize, CancellationToken token) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        this.reader = reader;
        this.request = request;
        this.pageSize = pageSize;
        this.token = token;
    }

    @Override
    public boolean hasNext() {
        if (!buffer.isEmpty()) return true;
        if (exhausted || token.isCancelled()) return false;

        List<TelemetryPoint> page;
        try {
            page = reader.readPage(request, last, pageSize);
        } catch (RuntimeException e) {
            throw new StreamException("Failed reading telemetry for " + request.vehicleId() + ": " + e.getMessage(), e);
        }
        pagesRead++;

        if (page.size() < pageSize) {
            exhausted = true;
        }
        if (page.isEmpty()) return false;

        buffer.addAll(page);
        last = page.get(page.size() - 1);
        return true;
    }

    @Override
    public TelemetryPoint next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return buffer.poll();
    }

    public int pagesRead() {
        return pagesRead;
    }
}
