package com.raceintel.racedata.replay;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation flag that can also be waited on, so a cancel wakes a
 * session sleeping between events instead of letting it finish the delay.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    /** Idempotent. */
    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Sleep for up to {@code delay}, returning early on cancellation.
     *
     * @return true if the token was cancelled before or during the wait
     */
    public boolean await(Duration delay) throws InterruptedException {
        return cancelled.await(delay.toNanos(), TimeUnit.NANOSECONDS);
    }
}
