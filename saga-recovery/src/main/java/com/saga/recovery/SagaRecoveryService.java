package com.saga.recovery;

import com.saga.core.model.SagaDefinition;
import com.saga.core.model.SagaLease;
import com.saga.core.model.SagaStatus;
import com.saga.core.model.StepRecord;
import com.saga.core.model.StepStatus;
import com.saga.core.store.SagaLeaseStore;
import com.saga.core.store.SagaStore;
import com.saga.engine.logging.SagaLoggingContext;
import com.saga.engine.metrics.SagaMetrics;
import com.saga.engine.timing.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Recovery service for sagas abandoned by a crashed or stopped orchestrator.
 *
 * Responsibilities:
 * - Detect RUNNING sagas that stopped making progress and whose lease is gone
 * - Fail them so they become eligible for a manual retry
 * - Detach expired leases
 * - Delete finished sagas past their retention
 *
 * Abandoned sagas are never resumed: the outcome of the step that was running is unknown.
 */
public class SagaRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(SagaRecoveryService.class);

    static final String OUTCOME_UNKNOWN = "Outcome unknown: orchestrator stopped while the step was running";

    private final SagaStore store;
    private final SagaLeaseStore leaseStore;
    private final SagaMetrics metrics;
    private final SagaRecoveryProperties properties;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public SagaRecoveryService(
            SagaStore store,
            SagaLeaseStore leaseStore,
            SagaMetrics metrics,
            SagaRecoveryProperties properties,
            Clock clock) {
        this.store = store;
        this.leaseStore = leaseStore;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("saga-recovery"));
    }

    /**
     * Start the periodic recovery scan.
     */
    public void start() {
        if (running) {
            log.warn("Saga recovery already running");
            return;
        }

        running = true;
        long interval = properties.getScanInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::runCycle, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Saga recovery started (scan every {} ms, stale after {} ms, retention {})",
            interval, properties.getStaleAfter().toMillis(),
            properties.getRetention() != null ? properties.getRetention() : "unlimited");
    }

    /**
     * Stop the recovery scan.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Saga recovery stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void runCycle() {
        if (!running) return;

        try {
            recoverAbandonedSagas();
        } catch (Exception e) {
            log.error("Error in abandoned saga recovery", e);
        }
        try {
            cleanUp();
        } catch (Exception e) {
            log.error("Error in saga cleanup", e);
        }
    }

    /**
     * Fail every RUNNING saga that has not been updated within the stale window
     * and is no longer protected by a valid lease.
     *
     * @return Number of sagas failed by this pass
     */
    public int recoverAbandonedSagas() {
        Instant now = clock.instant();
        List<SagaDefinition> stale = store.findStaleRunning(
            now.minus(properties.getStaleAfter()), properties.getBatchSize());
        if (stale.isEmpty()) {
            return 0;
        }

        log.info("Found {} stale running sagas", stale.size());
        int recovered = 0;
        for (SagaDefinition saga : stale) {
            try (var ctx = SagaLoggingContext.forSaga(saga.sagaId(), saga.sagaType())) {
                if (recover(saga, now)) {
                    recovered++;
                }
            } catch (Exception e) {
                log.error("Failed to recover saga {}", saga.sagaId(), e);
            }
        }
        return recovered;
    }

    private boolean recover(SagaDefinition saga, Instant now) {
        String leaseKey = SagaLease.leaseKeyFor(saga.sagaId());
        Optional<SagaLease> lease = leaseStore.findByKey(leaseKey);
        if (lease.isPresent() && lease.get().isValidAt(now)) {
            log.debug("Saga {} is stale but its lease is held by {} until {}, skipping",
                saga.sagaId(), lease.get().holderAddress(), lease.get().expiresAt());
            return false;
        }

        // A zombie holder fails its next renewal
        long fenceToken = leaseStore.forceRelease(leaseKey);
        log.warn("Recovering abandoned saga {} (last update {}, fence token now {})",
            saga.sagaId(), saga.updatedAt(), fenceToken);

        for (StepRecord step : saga.steps()) {
            if (step.status() == StepStatus.RUNNING) {
                store.updateStepStatus(saga.sagaId(), step.name(), StepStatus.FAILED, null, OUTCOME_UNKNOWN);
            }
        }
        Duration idle = Duration.between(saga.updatedAt(), now);
        store.updateStatus(saga.sagaId(), SagaStatus.FAILED,
            "Saga abandoned while RUNNING, failed by recovery after " + idle.toSeconds() + "s without progress");

        metrics.sagaRecovered(saga.sagaType());
        return true;
    }

    /**
     * Detach leases expired for longer than the stale window and delete
     * finished sagas older than the retention, if one is configured.
     *
     * @return Number of sagas deleted
     */
    public int cleanUp() {
        Instant now = clock.instant();

        int detached = leaseStore.deleteExpiredBefore(now.minus(properties.getStaleAfter()));
        if (detached > 0) {
            log.info("Cleaned up {} expired saga leases", detached);
        }

        Duration retention = properties.getRetention();
        if (retention == null) {
            return 0;
        }
        return store.deleteFinishedBefore(now.minus(retention));
    }
}
