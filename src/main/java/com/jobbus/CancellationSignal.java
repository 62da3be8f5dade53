package com.jobbus;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cooperative cancellation flag shared between a caller and the loops it starts.
 */
public final class CancellationSignal {

    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<CancellationSignal> parents;

    public CancellationSignal() {
        this.parents = List.of();
    }

    private CancellationSignal(List<CancellationSignal> parents) {
        this.parents = parents;
    }

    /**
     * Returns a signal that reports cancellation as soon as any of {@code signals} (or itself) is cancelled.
     */
    public static CancellationSignal linked(CancellationSignal... signals) {
        return new CancellationSignal(List.of(signals));
    }

    public void cancel() {
        latch.countDown();
    }

    public boolean isCancellationRequested() {
        if (latch.getCount() == 0) {
            return true;
        }
        for (CancellationSignal parent : parents) {
            if (parent.isCancellationRequested()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Waits until {@link #cancel()} is called on this signal.
     *
     * @return {@code true} if cancelled before the timeout elapsed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
