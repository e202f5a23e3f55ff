package com.example.sheetconsolidator.service;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for one run. {@link #cancel()} may be called from any thread; the run
 * polls {@link #isCancelled()} between sheets and calls {@link #settle()} once it has stopped.
 */
public class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CountDownLatch settled = new CountDownLatch(1);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void settle() {
        settled.countDown();
    }

    public boolean isSettled() {
        return settled.getCount() == 0;
    }

    /**
     * Wait until the run has stopped.
     *
     * @param timeout upper bound for the wait
     * @return {@code true} if the run settled within the timeout
     */
    public boolean awaitSettled(Duration timeout) throws InterruptedException {
        return settled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
