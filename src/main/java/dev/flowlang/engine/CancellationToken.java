package dev.flowlang.engine;

import dev.flowlang.error.CancelledException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation for one execution. The scheduler checks it before every step dispatch
 * and while waiting between retry attempts; listeners registered with {@link #onCancel} run once,
 * most recent first.
 */
public final class CancellationToken {

    /** Handle returned by {@link #onCancel}; closing it deregisters the listener. */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> listeners = new ArrayList<>();
    private volatile String reason;

    /**
     * Request cancellation. Returns false when the token was already cancelled.
     */
    public boolean cancel(String reason) {
        List<Runnable> toRun;
        synchronized (listeners) {
            if (this.reason != null) {
                return false;
            }
            this.reason = reason == null || reason.isBlank() ? "Flow execution cancelled" : reason;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        cancelled.countDown();
        for (int i = toRun.size() - 1; i >= 0; i--) {
            toRun.get(i).run();
        }
        return true;
    }

    public boolean isCancelled() {
        return reason != null;
    }

    public String reason() {
        return reason;
    }

    /**
     * @throws CancelledException when cancellation was requested
     */
    public void checkCancelled() {
        String r = reason;
        if (r != null) {
            throw new CancelledException(r);
        }
    }

    /**
     * Runs {@code listener} on cancellation, or right away when the token is already cancelled.
     */
    public Registration onCancel(Runnable listener) {
        synchronized (listeners) {
            if (reason == null) {
                listeners.add(listener);
                return () -> {
                    synchronized (listeners) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        listener.run();
        return () -> {};
    }

    /**
     * Waits up to {@code millis}, returning early when cancelled.
     *
     * @throws CancelledException when cancellation was requested before or during the wait
     */
    public void sleep(long millis) {
        checkCancelled();
        if (millis <= 0) {
            return;
        }
        try {
            cancelled.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException(reason != null ? reason : "Interrupted while waiting to retry");
        }
        checkCancelled();
    }
}
