package de.bsommerfeld.xivpatch.core.concurrent;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal shared between the caller and a running
 * update. Work checks the token at its own safe points; nothing is
 * interrupted forcibly.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    /** Requests cancellation. Idempotent. */
    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancellationRequested() {
        return cancelled.getCount() == 0;
    }

    /**
     * @throws CancellationException if cancellation was requested
     */
    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("Operation cancelled");
        }
    }

    /**
     * Waits for {@code millis} unless cancellation is requested first.
     *
     * @throws CancellationException if cancelled before or during the wait,
     *                               or if the waiting thread is interrupted
     */
    public void sleep(long millis) {
        try {
            if (cancelled.await(millis, TimeUnit.MILLISECONDS)) {
                throw new CancellationException("Operation cancelled");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting");
        }
    }
}
