package com.example.autocheckin.service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation signal passed explicitly from the orchestrator down to
 * schedules, executors and workers.
 * <p>
 * Cancelling is idempotent; callbacks run once, on the cancelling thread.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            latch.countDown();
            for (var callback : callbacks) {
                // whoever removes the callback runs it
                if (callbacks.remove(callback)) {
                    callback.run();
                }
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Block until cancelled
     */
    public void await() throws InterruptedException {
        latch.await();
    }

    /**
     * @return true if cancelled within the timeout
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Run the callback on cancellation, or right away if already cancelled
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled() && callbacks.remove(callback)) {
            callback.run();
        }
    }
}
