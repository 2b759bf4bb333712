package com.saga.engine.timing;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Timers belonging to one step execution or retry delay.
 * Closing the scope cancels every timer it created that has not fired yet.
 *
 * <pre>
 * try (TimerScope scope = timers.openScope(sagaId + "/" + step)) {
 *     scope.schedule(timeout, () -> outcome.completeExceptionally(new StepTimeoutException(step, timeout)));
 *     return scope.await(outcome);
 * }
 * </pre>
 */
public final class TimerScope implements AutoCloseable {

    private final SagaTimers timers;
    private final String owner;
    private final List<ScheduledFuture<?>> scheduled = new CopyOnWriteArrayList<>();
    private final CompletableFuture<Void> aborted = new CompletableFuture<>();

    TimerScope(SagaTimers timers, String owner) {
        this.timers = timers;
        this.owner = owner;
    }

    public String owner() {
        return owner;
    }

    /**
     * Run an action once the delay elapses, unless the scope closes first.
     *
     * @throws CancellationException if the scope was aborted by shutdown
     */
    public ScheduledFuture<?> schedule(Duration delay, Runnable action) {
        if (aborted.isDone()) {
            throw new CancellationException("Timer scope " + owner + " aborted");
        }
        try {
            ScheduledFuture<?> future = timers.schedule(delay, action);
            scheduled.add(future);
            return future;
        } catch (RejectedExecutionException e) {
            throw new CancellationException("Timer scope " + owner + " aborted");
        }
    }

    /**
     * Run an action every period, first after one period, until the scope closes.
     * The action must not throw: a failing run suppresses the ones after it.
     *
     * @throws CancellationException if the scope was aborted by shutdown
     */
    public ScheduledFuture<?> scheduleRepeating(Duration period, Runnable action) {
        if (aborted.isDone()) {
            throw new CancellationException("Timer scope " + owner + " aborted");
        }
        try {
            ScheduledFuture<?> future = timers.scheduleRepeating(period, action);
            scheduled.add(future);
            return future;
        } catch (RejectedExecutionException e) {
            throw new CancellationException("Timer scope " + owner + " aborted");
        }
    }

    /**
     * Block until the future completes or the scope is aborted.
     *
     * @return The future's value
     * @throws ExecutionException if the future completed exceptionally
     * @throws InterruptedException if the waiting thread was interrupted
     * @throws CancellationException if the scope was aborted by shutdown
     */
    public <T> T await(CompletableFuture<T> future) throws ExecutionException, InterruptedException {
        CompletableFuture.anyOf(future, aborted).exceptionally(e -> null).get();
        if (!future.isDone()) {
            throw new CancellationException("Timer scope " + owner + " aborted");
        }
        return future.get();
    }

    /**
     * Wait for the delay on a scoped timer.
     *
     * @throws InterruptedException if the waiting thread was interrupted
     * @throws CancellationException if the scope was aborted by shutdown
     */
    public void sleep(Duration delay) throws InterruptedException {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        CompletableFuture<Void> wake = new CompletableFuture<>();
        schedule(delay, () -> wake.complete(null));
        try {
            await(wake);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Delay timer failed", e.getCause());
        }
    }

    /**
     * Number of timers created by this scope that are still pending.
     */
    public int pendingTimers() {
        return (int) scheduled.stream().filter(f -> !f.isDone()).count();
    }

    public boolean isAborted() {
        return aborted.isDone();
    }

    void abort() {
        aborted.complete(null);
        cancelTimers();
    }

    @Override
    public void close() {
        cancelTimers();
        timers.closed(this);
    }

    private void cancelTimers() {
        scheduled.forEach(f -> f.cancel(false));
    }
}
