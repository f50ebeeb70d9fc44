package org.loesak.sqlque.examples.fleet.schedule;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Signals a running loop to stop at its next yield point. Cancelling wakes up any thread currently
 * waiting in {@link #sleep(Duration)}.
 */
public class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        this.cancelled.countDown();
    }

    public boolean isCancelled() {
        return this.cancelled.getCount() == 0;
    }

    /**
     * Waits for the given duration or until cancelled, whichever comes first.
     *
     * @return {@code true} when the token was cancelled
     */
    public boolean sleep(final Duration duration) throws InterruptedException {
        return this.cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }
}
