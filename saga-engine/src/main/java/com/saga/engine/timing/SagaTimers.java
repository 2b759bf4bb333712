package com.saga.engine.timing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Owner of every deadline, retry-delay and lease renewal timer used by the orchestrator.
 *
 * Timers are only created through a {@link TimerScope}, which cancels them when it closes.
 * {@link #shutdown()} aborts all open scopes, so nothing fires after the engine stops.
 */
public class SagaTimers {

    private static final Logger log = LoggerFactory.getLogger(SagaTimers.class);

    private final ScheduledThreadPoolExecutor scheduler;
    private final Set<TimerScope> openScopes = ConcurrentHashMap.newKeySet();
    private volatile boolean shutdown = false;

    public SagaTimers() {
        this.scheduler = new ScheduledThreadPoolExecutor(1, new NamedThreadFactory("saga-timer"));
        this.scheduler.setRemoveOnCancelPolicy(true);
    }

    /**
     * Open a scope owning the timers of one step execution or retry delay.
     *
     * @param owner Label used in log messages (e.g. {@code sagaId/stepName})
     * @throws CancellationException if the timers were shut down
     */
    public TimerScope openScope(String owner) {
        if (shutdown) {
            throw new CancellationException("Saga timers shut down, cannot open scope for " + owner);
        }
        TimerScope scope = new TimerScope(this, owner);
        openScopes.add(scope);
        // Close the race with a concurrent shutdown
        if (shutdown) {
            scope.abort();
        }
        return scope;
    }

    /**
     * Number of timers scheduled and not yet fired or cancelled, across all scopes.
     */
    public int outstandingTimers() {
        return openScopes.stream().mapToInt(TimerScope::pendingTimers).sum();
    }

    public int openScopes() {
        return openScopes.size();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Cancel every outstanding timer and abort every open scope.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        List<TimerScope> scopes = List.copyOf(openScopes);
        scopes.forEach(TimerScope::abort);
        List<Runnable> dropped = scheduler.shutdownNow();
        log.info("Saga timers stopped, aborted {} scopes and dropped {} pending timers",
            scopes.size(), dropped.size());
    }

    ScheduledFuture<?> schedule(Duration delay, Runnable action) {
        return scheduler.schedule(action, Math.max(0, delay.toNanos()), TimeUnit.NANOSECONDS);
    }

    ScheduledFuture<?> scheduleRepeating(Duration period, Runnable action) {
        long nanos = Math.max(1, period.toNanos());
        return scheduler.scheduleAtFixedRate(action, nanos, nanos, TimeUnit.NANOSECONDS);
    }

    void closed(TimerScope scope) {
        openScopes.remove(scope);
    }
}
