package io.statsheets.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Structured fan-out/fan-in over {@link CompletableFuture}s.
 *
 * <p>Every task forked into a scope is awaited by {@link #join()}, so no work outlives the scope that launched it.
 * The first failing task cancels the scope and every scope below it: tasks forked with {@link #fork} after that
 * point are refused with a {@link CancellationException}, while tasks forked with {@link #forkAlways} still run.
 * {@link #join()} reports the first failure by completion order, with later failures attached as suppressed.
 */
public final class TaskScope {
    private final String name;
    private final TaskScope parent;
    private final List<CompletableFuture<?>> children = new ArrayList<>();
    private final ConcurrentLinkedQueue<Throwable> failures = new ConcurrentLinkedQueue<>();
    private volatile boolean cancelled;

    private TaskScope(String name, TaskScope parent) {
        this.name = Objects.requireNonNull(name, "name");
        this.parent = parent;
    }

    public static TaskScope open(String name) {
        return new TaskScope(name, null);
    }

    /** Nested scope; cancelling this scope (or any ancestor) cancels the child too. */
    public TaskScope child(String childName) {
        return new TaskScope(name + "/" + childName, this);
    }

    public String name() { return name; }

    public boolean isCancelled() {
        return cancelled || (parent != null && parent.isCancelled());
    }

    public Optional<Throwable> firstFailure() {
        return Optional.ofNullable(failures.peek());
    }

    /** Starts a task unless the scope is already cancelled. */
    public <T> CompletableFuture<T> fork(Supplier<? extends CompletionStage<T>> task) {
        if (isCancelled()) {
            return track(CompletableFuture.failedFuture(new CancellationException("scope " + name + " is cancelled")));
        }
        return track(start(task));
    }

    /** Starts a task even if the scope is cancelled; used for work whose inputs are already in hand. */
    public <T> CompletableFuture<T> forkAlways(Supplier<? extends CompletionStage<T>> task) {
        return track(start(task));
    }

    /**
     * Completes once every forked task has settled, including tasks forked while waiting.
     * Fails with the first recorded failure, or with a {@link CancellationException} when the scope was cancelled
     * from above without failing itself.
     */
    public CompletableFuture<Void> join() {
        CompletableFuture<?>[] pending;
        synchronized (children) {
            pending = children.toArray(new CompletableFuture<?>[0]);
        }
        return CompletableFuture.allOf(pending)
                .handle((v, ex) -> pending.length)
                .thenCompose(seen -> {
                    synchronized (children) {
                        if (children.size() > seen) return join();
                    }
                    return settle();
                });
    }

    private CompletableFuture<Void> settle() {
        Throwable first = failures.peek();
        if (first == null) {
            if (isCancelled()) return CompletableFuture.failedFuture(new CancellationException("scope " + name + " is cancelled"));
            return CompletableFuture.completedFuture(null);
        }
        for (Throwable other : failures) {
            if (other == first) continue;
            if (Arrays.asList(first.getSuppressed()).contains(other)) continue;
            first.addSuppressed(other);
        }
        return CompletableFuture.failedFuture(first);
    }

    private static <T> CompletableFuture<T> start(Supplier<? extends CompletionStage<T>> task) {
        try {
            CompletionStage<T> stage = task.get();
            if (stage == null) return CompletableFuture.failedFuture(new NullPointerException("task returned no stage"));
            return stage.toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> CompletableFuture<T> track(CompletableFuture<T> future) {
        CompletableFuture<T> tracked = future.whenComplete((v, ex) -> {
            if (ex != null) fail(ex);
        });
        synchronized (children) {
            children.add(tracked);
        }
        return tracked;
    }

    private void fail(Throwable ex) {
        Throwable cause = unwrap(ex);
        // refusals caused by an earlier failure are not failures of their own
        if (cause instanceof CancellationException && isCancelled()) return;
        if (!failures.contains(cause)) failures.add(cause);
        cancelled = true;
    }

    /** Strips the {@link CompletionException} / {@link ExecutionException} layers futures wrap around a cause. */
    public static Throwable unwrap(Throwable ex) {
        Throwable t = ex;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    @Override
    public String toString() {
        return "TaskScope{" + name + (isCancelled() ? ", cancelled" : "") + '}';
    }
}
