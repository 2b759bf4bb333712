package com.saga.engine.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.saga.core.exception.InvalidSagaStateException;
import com.saga.core.exception.SagaAlreadyRunningException;
import com.saga.core.exception.SagaInterruptedException;
import com.saga.core.exception.SagaLeaseLostException;
import com.saga.core.exception.SagaNotFoundException;
import com.saga.core.exception.SagaRejectedException;
import com.saga.core.handler.SagaContext;
import com.saga.core.handler.StepException;
import com.saga.core.handler.StepTimeoutException;
import com.saga.core.json.SagaJson;
import com.saga.core.model.SagaDefinition;
import com.saga.core.model.SagaExecutionResult;
import com.saga.core.model.SagaLease;
import com.saga.core.model.SagaOptions;
import com.saga.core.model.SagaRegistration;
import com.saga.core.model.SagaStatus;
import com.saga.core.model.StepDefinition;
import com.saga.core.model.StepRecord;
import com.saga.core.model.StepStatus;
import com.saga.core.store.SagaLeaseStore;
import com.saga.core.store.SagaStore;
import com.saga.engine.logging.SagaLoggingContext;
import com.saga.engine.metrics.SagaMetrics;
import com.saga.engine.persistence.InMemorySagaLeaseStore;
import com.saga.engine.persistence.InMemorySagaStore;
import com.saga.engine.registry.SagaRegistry;
import com.saga.engine.timing.NamedThreadFactory;
import com.saga.engine.timing.SagaTimers;
import com.saga.engine.timing.TimerScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Drives sagas: runs their steps in order, retries failed steps within the saga's budget
 * and compensates completed steps in reverse order when a step fails for good.
 *
 * Every state change is written through the {@link SagaStore} before the run proceeds
 * (unless the saga type opted out of persistence). Handler failures and timeouts never
 * escape {@link #execute}; store failures, lease loss and shutdown do.
 *
 * A persisted run holds the lease {@code saga:<sagaId>} from start to finish and keeps it
 * renewed in the background, so one saga is never driven by two runs at once.
 */
public class SagaOrchestrator implements SagaService, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SagaOrchestrator.class);

    private final SagaRegistry registry;
    private final SagaStore store;
    private final SagaLeaseStore leaseStore;
    private final SagaTimers timers;
    private final SagaMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final SagaOptions defaults;
    private final Duration leaseDuration;
    private final ExecutorService stepExecutor;
    private final ExecutorService sagaExecutor;
    private final UUID holderId = UUID.randomUUID();
    private final String holderAddress;

    private final Set<String> activeSagas = ConcurrentHashMap.newKeySet();
    private final Set<CompletableFuture<SagaExecutionResult>> pendingAsync = ConcurrentHashMap.newKeySet();
    private final Object drainMonitor = new Object();
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile boolean accepting = true;

    private SagaOrchestrator(Builder builder) {
        this.registry = builder.registry;
        this.store = builder.store;
        this.leaseStore = builder.leaseStore;
        this.timers = builder.timers;
        this.metrics = builder.metrics;
        this.objectMapper = builder.objectMapper;
        this.clock = builder.clock;
        this.defaults = builder.defaults.withDefaults(SagaOptions.DEFAULTS);
        this.leaseDuration = builder.leaseDuration;
        this.holderAddress = builder.holderAddress != null
            ? builder.holderAddress
            : "orchestrator-" + holderId.toString().substring(0, 8);
        // Grows past stepThreads: a timed-out handler that ignores the interrupt keeps its thread
        this.stepExecutor = new ThreadPoolExecutor(builder.stepThreads, Integer.MAX_VALUE,
            60L, TimeUnit.SECONDS, new SynchronousQueue<>(), new NamedThreadFactory("saga-step"));
        this.sagaExecutor = Executors.newFixedThreadPool(builder.sagaThreads, new NamedThreadFactory("saga-run"));
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Registration ==========

    @Override
    public void registerSaga(SagaRegistration registration) {
        registry.register(registration);
    }

    public SagaRegistry registry() {
        return registry;
    }

    // ========== Execution ==========

    @Override
    public SagaExecutionResult execute(String sagaType, JsonNode payload, Map<String, Object> metadata) {
        ensureAccepting(sagaType);
        SagaRegistration registration = registry.require(sagaType);
        return run(registration, payload, metadata, null);
    }

    @Override
    public CompletableFuture<SagaExecutionResult> executeAsync(String sagaType, JsonNode payload,
                                                               Map<String, Object> metadata) {
        ensureAccepting(sagaType);
        SagaRegistration registration = registry.require(sagaType);
        CompletableFuture<SagaExecutionResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> run(registration, payload, metadata, null), sagaExecutor);
        } catch (RejectedExecutionException e) {
            throw new SagaRejectedException(sagaType);
        }
        pendingAsync.add(future);
        future.whenComplete((result, error) -> {
            synchronized (drainMonitor) {
                pendingAsync.remove(future);
                drainMonitor.notifyAll();
            }
        });
        return future;
    }

    @Override
    public SagaExecutionResult retrySaga(String sagaId) {
        SagaDefinition original = store.findById(sagaId)
            .orElseThrow(() -> new SagaNotFoundException("Saga", sagaId));
        requireFailed(original);
        ensureAccepting(original.sagaType());
        SagaRegistration registration = registry.require(original.sagaType());

        // Held for the whole retry so the same failure is retried once
        SagaLease lease = acquireLease(sagaId);
        try (TimerScope keeper = keepAlive(lease, () ->
                log.warn("Lease on saga {} lapsed while it was being retried", sagaId))) {
            SagaDefinition current = store.findById(sagaId)
                .orElseThrow(() -> new SagaNotFoundException("Saga", sagaId));
            requireFailed(current);
            store.updateRetryCount(sagaId, current.retryCount() + 1);

            log.info("Retrying failed saga {} ({}) as a new instance, retry #{}",
                sagaId, current.sagaType(), current.retryCount() + 1);
            return run(registration, current.payload(), Map.of(), sagaId);
        } finally {
            leaseStore.release(lease.leaseKey(), holderId);
        }
    }

    // ========== Queries ==========

    @Override
    public Optional<SagaDefinition> getSagaStatus(String sagaId) {
        return store.findById(sagaId);
    }

    @Override
    public List<SagaDefinition> getFailedSagas() {
        return store.findByStatus(SagaStatus.FAILED);
    }

    /**
     * Ids of the sagas this orchestrator is currently driving.
     */
    public Set<String> activeSagaIds() {
        return Collections.unmodifiableSet(activeSagas);
    }

    public UUID holderId() {
        return holderId;
    }

    public boolean isAccepting() {
        return accepting;
    }

    // ========== Saga Run ==========

    private SagaExecutionResult run(SagaRegistration registration, JsonNode payload,
                                    Map<String, Object> metadata, String retriedFrom) {
        SagaOptions options = registration.options().withDefaults(defaults);
        Instant now = clock.instant();

        List<StepRecord> records = registration.steps().stream()
            .map(step -> StepRecord.pending(step.name(), step.service(), now))
            .collect(Collectors.toList());
        SagaDefinition saga = SagaDefinition.create(
            registration.sagaType(), records, payload, options.maxRetries(), retriedFrom, now);
        SagaRun run = new SagaRun(registration, options, saga, metadata);

        try (var ctx = SagaLoggingContext.forSaga(saga.sagaId(), saga.sagaType())) {
            log.info("Starting saga {} ({} steps{})", saga.sagaType(), records.size(),
                retriedFrom != null ? ", retry of " + retriedFrom : "");

            if (run.persist) {
                store.save(saga);
                run.lease = acquireLease(saga.sagaId());
            }
            activeSagas.add(saga.sagaId());
            metrics.sagaStarted(saga.sagaType());
            try {
                if (run.lease != null) {
                    run.keeper = keepAlive(run.lease, () -> run.leaseLost = true);
                }
                return drive(run);
            } catch (RuntimeException e) {
                log.error("Saga {} aborted, record left in {}: {}",
                    saga.sagaId(), run.saga.status(), e.getMessage());
                throw e;
            } finally {
                finish(run);
            }
        }
    }

    private SagaExecutionResult drive(SagaRun run) {
        run.markSaga(SagaStatus.RUNNING, null);

        List<StepDefinition> steps = run.registration.steps();
        Map<String, JsonNode> results = new LinkedHashMap<>();
        List<Integer> completed = new ArrayList<>();

        int index = 0;
        while (index < steps.size()) {
            StepDefinition step = steps.get(index);
            run.renewLease();

            StepOutcome outcome = executeStep(run, step, results);
            if (outcome.succeeded()) {
                run.markStep(step.name(), StepStatus.COMPLETED, outcome.result(), null);
                results.put(step.name(), outcome.result());
                completed.add(index);
                index++;
                continue;
            }

            run.markStep(step.name(), StepStatus.FAILED, null, outcome.error());

            if (shouldRetry(run, step, outcome)) {
                int retryCount = run.saga.retryCount() + 1;
                run.markRetryCount(retryCount);
                Duration delay = run.options.computeBackoff(retryCount);
                metrics.stepRetried(run.saga.sagaType(), step.name());
                log.warn("Step {} failed, retry {}/{} in {} ms: {}",
                    step.name(), retryCount, step.effectiveMaxRetries(run.options),
                    delay.toMillis(), outcome.error());
                waitBeforeRetry(run, step, delay);
                continue;
            }

            List<String> compensated = compensate(run, step, completed, results);
            run.markSaga(SagaStatus.FAILED, outcome.error());

            Duration duration = run.elapsed();
            metrics.sagaFailed(run.saga.sagaType(), step.name(), duration);
            log.error("Saga failed at step {} after {} ms, compensated {}/{} steps: {}",
                step.name(), duration.toMillis(), compensated.size(), completed.size(), outcome.error());

            return SagaExecutionResult.failed(
                run.saga.sagaId(),
                run.saga.sagaType(),
                outcome.error(),
                namesOf(steps, completed),
                step.name(),
                compensated,
                duration
            );
        }

        run.complete(results);
        Duration duration = run.elapsed();
        metrics.sagaCompleted(run.saga.sagaType(), duration);
        log.info("Saga completed in {} ms", duration.toMillis());

        return SagaExecutionResult.completed(
            run.saga.sagaId(),
            run.saga.sagaType(),
            results,
            namesOf(steps, completed),
            duration
        );
    }

    private StepOutcome executeStep(SagaRun run, StepDefinition step, Map<String, JsonNode> results) {
        run.markStep(step.name(), StepStatus.RUNNING, null, null);
        int attempt = run.saga.steps().stream()
            .filter(r -> r.name().equals(step.name()) && r.status() == StepStatus.RUNNING)
            .findFirst()
            .map(StepRecord::attempts)
            .orElse(1);

        SagaContext context = new SagaContext(
            run.saga.sagaId(),
            run.saga.sagaType(),
            step.name(),
            attempt,
            results,
            run.metadata,
            objectMapper
        );
        JsonNode payload = run.saga.payload();
        Duration timeout = step.effectiveTimeout(run.options);

        try (var ctx = SagaLoggingContext.forStep(step.name(), attempt)) {
            log.debug("Executing step {} (attempt {}, timeout {} ms)", step.name(), attempt, timeout.toMillis());
            long started = System.nanoTime();
            try {
                JsonNode result = invokeWithDeadline(run, step.name(), timeout,
                    () -> step.handler().execute(payload, context));
                Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
                metrics.stepCompleted(run.saga.sagaType(), step.name(), elapsed);
                log.debug("Step {} completed in {} ms", step.name(), elapsed.toMillis());
                return StepOutcome.success(result != null ? result : NullNode.getInstance());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
                if (cause instanceof StepTimeoutException) {
                    metrics.stepTimedOut(run.saga.sagaType(), step.name());
                }
                metrics.stepFailed(run.saga.sagaType(), step.name(), cause.getClass().getSimpleName(), elapsed);
                log.error("Step {} failed on attempt {}: {}", step.name(), attempt, messageOf(cause));
                return StepOutcome.failure(cause);
            }
        }
    }

    private boolean shouldRetry(SagaRun run, StepDefinition step, StepOutcome outcome) {
        if (!step.retryable()) {
            return false;
        }
        if (outcome.cause() instanceof StepException stepException && !stepException.isRetryable()) {
            log.info("Step {} reported a permanent failure ({}), skipping retries",
                step.name(), stepException.getErrorCode());
            return false;
        }
        return run.saga.retryCount() < step.effectiveMaxRetries(run.options);
    }

    private void waitBeforeRetry(SagaRun run, StepDefinition step, Duration delay) {
        try (TimerScope scope = timers.openScope(run.saga.sagaId() + "/" + step.name() + "/retry")) {
            scope.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SagaInterruptedException(run.saga.sagaId(), e);
        } catch (CancellationException e) {
            throw new SagaInterruptedException(run.saga.sagaId(), e);
        }
    }

    // ========== Compensation ==========

    /**
     * Undo completed steps in reverse completion order. Best-effort: a failed compensation
     * is logged, left COMPENSATING with its error, and does not stop the others.
     *
     * @return names of the steps whose compensation succeeded, in compensation order
     */
    private List<String> compensate(SagaRun run, StepDefinition failedStep, List<Integer> completed,
                                    Map<String, JsonNode> results) {
        List<String> compensated = new ArrayList<>();
        if (completed.isEmpty()) {
            return compensated;
        }
        log.warn("Compensating {} completed steps", completed.size());

        SagaContext failureContext = new SagaContext(
            run.saga.sagaId(),
            run.saga.sagaType(),
            failedStep.name(),
            run.saga.step(failedStep.name()).map(StepRecord::attempts).orElse(1),
            results,
            run.metadata,
            objectMapper
        );
        JsonNode payload = run.saga.payload();

        for (int i = completed.size() - 1; i >= 0; i--) {
            StepDefinition step = run.registration.steps().get(completed.get(i));
            run.renewLease();
            run.markStep(step.name(), StepStatus.COMPENSATING, null, null);
            SagaContext context = failureContext.forStep(step.name());

            try (var ctx = SagaLoggingContext.forStep(step.name(), context.getAttempt())) {
                try {
                    invokeWithDeadline(run, step.name() + "/compensate", step.effectiveTimeout(run.options), () -> {
                        step.handler().compensate(payload, context);
                        return null;
                    });
                    run.markStep(step.name(), StepStatus.COMPENSATED, null, null);
                    compensated.add(step.name());
                    metrics.compensationCompleted(run.saga.sagaType(), step.name());
                    log.info("Compensated step {}", step.name());
                } catch (ExecutionException e) {
                    String error = messageOf(e.getCause());
                    run.markStep(step.name(), StepStatus.COMPENSATING, null, error);
                    metrics.compensationFailed(run.saga.sagaType(), step.name());
                    log.error("Compensation of step {} failed, manual cleanup required: {}",
                        step.name(), error, e.getCause());
                }
            }
        }
        return compensated;
    }

    // ========== Handler Invocation ==========

    /**
     * Run handler code on the step pool and race it against a deadline timer.
     * On expiry the handler thread is interrupted and abandoned.
     *
     * @throws ExecutionException wrapping the handler failure or a {@link StepTimeoutException}
     */
    private JsonNode invokeWithDeadline(SagaRun run, String label, Duration timeout,
                                        Callable<JsonNode> handlerCall) throws ExecutionException {
        String sagaId = run.saga.sagaId();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        CompletableFuture<JsonNode> outcome = new CompletableFuture<>();

        try (TimerScope scope = timers.openScope(sagaId + "/" + label)) {
            Future<?> task = stepExecutor.submit(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    outcome.complete(handlerCall.call());
                } catch (Throwable t) {
                    outcome.completeExceptionally(t);
                } finally {
                    MDC.clear();
                }
            });
            scope.schedule(timeout, () -> {
                if (outcome.completeExceptionally(new StepTimeoutException(label, timeout))) {
                    task.cancel(true);
                }
            });
            return scope.await(outcome);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SagaInterruptedException(sagaId, e);
        } catch (CancellationException | RejectedExecutionException e) {
            throw new SagaInterruptedException(sagaId, e);
        }
    }

    // ========== Leases ==========

    private SagaLease acquireLease(String sagaId) {
        String leaseKey = SagaLease.leaseKeyFor(sagaId);
        SagaLease lease = SagaLease.create(
            sagaId, holderId, holderAddress, leaseDuration, leaseStore.getFenceToken(leaseKey), clock.instant());

        boolean acquired = leaseStore.tryAcquire(lease);
        metrics.leaseAcquired(acquired);
        if (!acquired) {
            throw new SagaAlreadyRunningException(sagaId);
        }
        return lease;
    }

    /**
     * Renew the lease every third of its duration until the returned scope closes,
     * so a long step or retry delay cannot let it expire under a live run.
     *
     * @param onLost Called on the timer thread when a renewal finds the lease gone
     */
    private TimerScope keepAlive(SagaLease lease, Runnable onLost) {
        String sagaId = SagaLease.sagaIdOf(lease.leaseKey());
        TimerScope scope;
        try {
            scope = timers.openScope(lease.leaseKey() + "/keepalive");
        } catch (CancellationException e) {
            throw new SagaInterruptedException(sagaId, e);
        }
        Duration period = leaseDuration.dividedBy(3);
        try {
            scope.scheduleRepeating(period.isZero() ? Duration.ofMillis(1) : period, () -> {
                try {
                    if (!leaseStore.renew(lease.leaseKey(), holderId, clock.instant().plus(leaseDuration))) {
                        log.warn("Background renewal found lease {} no longer held", lease.leaseKey());
                        onLost.run();
                    }
                } catch (RuntimeException e) {
                    // Next renewal or the check before the next step decides
                    log.warn("Background renewal of lease {} failed: {}", lease.leaseKey(), e.getMessage());
                }
            });
        } catch (CancellationException e) {
            scope.close();
            throw new SagaInterruptedException(sagaId, e);
        }
        return scope;
    }

    // ========== Shutdown ==========

    /**
     * Stop accepting sagas, wait for active ones to finish, then cancel all timers,
     * stop the pools and release any lease still held.
     *
     * @param timeout Maximum time to wait for active sagas
     * @return true if every active saga finished within the timeout
     */
    public boolean shutdown(Duration timeout) {
        if (!stopped.compareAndSet(false, true)) {
            return activeSagas.isEmpty();
        }
        accepting = false;
        log.info("Shutting down saga orchestrator, {} sagas in flight", activeSagas.size());

        boolean drained = awaitDrain(timeout);
        if (!drained) {
            log.warn("{} sagas still running after {} ms, aborting them: {}",
                activeSagas.size(), timeout.toMillis(), activeSagas);
        }

        timers.shutdown();
        sagaExecutor.shutdownNow();
        stepExecutor.shutdownNow();
        try {
            sagaExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        // Async sagas still queued never started
        pendingAsync.forEach(f -> f.completeExceptionally(new SagaRejectedException("queued before shutdown")));

        List<SagaLease> held = leaseStore.findByHolder(holderId);
        held.forEach(lease -> leaseStore.release(lease.leaseKey(), holderId));
        if (!held.isEmpty()) {
            log.info("Released {} saga leases", held.size());
        }
        log.info("Saga orchestrator stopped");
        return drained;
    }

    @Override
    public void close() {
        shutdown(Duration.ofSeconds(30));
    }

    private boolean awaitDrain(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (drainMonitor) {
            while (!activeSagas.isEmpty() || !pendingAsync.isEmpty()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                try {
                    TimeUnit.NANOSECONDS.timedWait(drainMonitor, remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return activeSagas.isEmpty() && pendingAsync.isEmpty();
                }
            }
            return true;
        }
    }

    private void finish(SagaRun run) {
        if (run.keeper != null) {
            run.keeper.close();
        }
        if (run.lease != null) {
            leaseStore.release(run.lease.leaseKey(), holderId);
        }
        metrics.sagaFinished();
        synchronized (drainMonitor) {
            activeSagas.remove(run.saga.sagaId());
            drainMonitor.notifyAll();
        }
    }

    private void ensureAccepting(String sagaType) {
        if (!accepting) {
            throw new SagaRejectedException(sagaType);
        }
    }

    private static void requireFailed(SagaDefinition saga) {
        if (saga.status() != SagaStatus.FAILED) {
            throw new InvalidSagaStateException(String.format(
                "Saga %s is %s, only FAILED sagas can be retried", saga.sagaId(), saga.status()));
        }
    }

    private static List<String> namesOf(List<StepDefinition> steps, List<Integer> indexes) {
        return indexes.stream().map(i -> steps.get(i).name()).collect(Collectors.toList());
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    /**
     * Mutable state of one saga run, confined to the thread driving it.
     * Writes go through the store when the saga type persists state.
     */
    private final class SagaRun {
        final SagaRegistration registration;
        final SagaOptions options;
        final Map<String, Object> metadata;
        final boolean persist;
        final Instant startedAt;
        SagaDefinition saga;
        SagaLease lease;
        TimerScope keeper;
        volatile boolean leaseLost;

        SagaRun(SagaRegistration registration, SagaOptions options, SagaDefinition saga,
                Map<String, Object> metadata) {
            this.registration = registration;
            this.options = options;
            this.saga = saga;
            this.metadata = metadata != null ? metadata : Map.of();
            this.persist = options.shouldPersist();
            this.startedAt = clock.instant();
        }

        void markSaga(SagaStatus status, String error) {
            saga = persist
                ? store.updateStatus(saga.sagaId(), status, error)
                : saga.withStatus(status, error, clock.instant());
        }

        void markStep(String stepName, StepStatus status, JsonNode result, String error) {
            saga = persist
                ? store.updateStepStatus(saga.sagaId(), stepName, status, result, error)
                : saga.withStepStatus(stepName, status, result, error, clock.instant());
        }

        void markRetryCount(int retryCount) {
            saga = persist
                ? store.updateRetryCount(saga.sagaId(), retryCount)
                : saga.withRetryCount(retryCount, clock.instant());
        }

        void complete(Map<String, JsonNode> results) {
            saga = persist
                ? store.complete(saga.sagaId(), results)
                : saga.withCompleted(results, clock.instant());
        }

        void renewLease() {
            if (lease == null) {
                return;
            }
            if (leaseLost || !leaseStore.renew(lease.leaseKey(), holderId, clock.instant().plus(leaseDuration))) {
                throw new SagaLeaseLostException(saga.sagaId(), lease.fenceToken());
            }
        }

        Duration elapsed() {
            return Duration.between(startedAt, clock.instant());
        }
    }

    private record StepOutcome(JsonNode result, Throwable cause) {

        static StepOutcome success(JsonNode result) {
            return new StepOutcome(result, null);
        }

        static StepOutcome failure(Throwable cause) {
            return new StepOutcome(null, cause);
        }

        boolean succeeded() {
            return cause == null;
        }

        String error() {
            return cause == null ? null : messageOf(cause);
        }
    }

    public static class Builder {
        private SagaRegistry registry = new SagaRegistry();
        private SagaStore store;
        private SagaLeaseStore leaseStore;
        private SagaTimers timers;
        private SagaMetrics metrics;
        private ObjectMapper objectMapper;
        private Clock clock = Clock.systemUTC();
        private SagaOptions defaults = SagaOptions.DEFAULTS;
        private Duration leaseDuration = SagaLease.DEFAULT_LEASE_DURATION;
        private int stepThreads = 16;
        private int sagaThreads = 8;
        private String holderAddress;

        public Builder registry(SagaRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder store(SagaStore store) {
            this.store = store;
            return this;
        }

        public Builder leaseStore(SagaLeaseStore leaseStore) {
            this.leaseStore = leaseStore;
            return this;
        }

        public Builder timers(SagaTimers timers) {
            this.timers = timers;
            return this;
        }

        public Builder metrics(SagaMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Engine-wide options; per-saga options override them component by component.
         */
        public Builder defaults(SagaOptions defaults) {
            this.defaults = defaults;
            return this;
        }

        public Builder leaseDuration(Duration leaseDuration) {
            this.leaseDuration = leaseDuration;
            return this;
        }

        public Builder stepThreads(int stepThreads) {
            this.stepThreads = stepThreads;
            return this;
        }

        public Builder sagaThreads(int sagaThreads) {
            this.sagaThreads = sagaThreads;
            return this;
        }

        public Builder holderAddress(String holderAddress) {
            this.holderAddress = holderAddress;
            return this;
        }

        public SagaOrchestrator build() {
            if (store == null) {
                store = new InMemorySagaStore(clock);
            }
            if (leaseStore == null) {
                leaseStore = new InMemorySagaLeaseStore(clock);
            }
            if (timers == null) {
                timers = new SagaTimers();
            }
            if (metrics == null) {
                metrics = SagaMetrics.standalone();
            }
            if (objectMapper == null) {
                objectMapper = SagaJson.defaultMapper();
            }
            return new SagaOrchestrator(this);
        }
    }
}
