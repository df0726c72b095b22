package io.statsheets.budget;

import java.util.ArrayDeque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Non-blocking counting semaphore. {@link #acquire()} returns a stage that completes when a permit is free,
 * so callers queue up without parking a thread. Bounds the number of outstanding operations, not their rate.
 */
public class AsyncPermits {
    private final int limit;
    private final ArrayDeque<CompletableFuture<Void>> waiters = new ArrayDeque<>();
    private int available;

    public AsyncPermits(int limit) {
        if (limit <= 0) throw new IllegalArgumentException("permit limit must be positive: " + limit);
        this.limit = limit;
        this.available = limit;
    }

    public CompletionStage<Void> acquire() {
        synchronized (this) {
            if (available > 0) {
                available--;
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            return waiter;
        }
    }

    public void release() {
        CompletableFuture<Void> next;
        synchronized (this) {
            next = waiters.pollFirst();
            if (next == null) {
                if (available >= limit) throw new IllegalStateException("release without acquire");
                available++;
                return;
            }
        }
        // hand the permit straight to the next waiter, outside the lock
        next.complete(null);
    }

    /** Runs {@code op} once a permit is held and gives the permit back when its stage settles. */
    public <T> CompletableFuture<T> withPermit(Supplier<? extends CompletionStage<T>> op) {
        CompletableFuture<T> result = new CompletableFuture<>();
        acquire().thenRun(() -> {
            CompletionStage<T> stage;
            try {
                stage = op.get();
            } catch (RuntimeException e) {
                release();
                result.completeExceptionally(e);
                return;
            }
            stage.whenComplete((v, ex) -> {
                release();
                if (ex != null) result.completeExceptionally(ex);
                else result.complete(v);
            });
        });
        return result;
    }

    public synchronized int available() { return available; }

    public synchronized int waiting() { return waiters.size(); }
}
