package com.saga.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the saga orchestrator.
 *
 * Metrics exposed:
 * - Saga starts and outcomes by saga type
 * - Step latency, failures, retries and timeouts
 * - Compensation outcomes
 * - Lease acquisitions and recoveries
 * - Number of sagas currently being driven by this orchestrator
 */
public class SagaMetrics implements MeterBinder {

    public static final String SAGAS_STARTED = "saga.started";
    public static final String SAGAS_COMPLETED = "saga.completed";
    public static final String SAGAS_FAILED = "saga.failed";
    public static final String SAGA_DURATION = "saga.duration";
    public static final String SAGAS_ACTIVE = "saga.active";

    public static final String STEP_DURATION = "saga.step.duration";
    public static final String STEP_FAILURES = "saga.step.failures";
    public static final String STEP_RETRIES = "saga.step.retries";
    public static final String STEP_TIMEOUTS = "saga.step.timeouts";

    public static final String COMPENSATIONS = "saga.compensations";
    public static final String LEASE_ACQUISITIONS = "saga.lease.acquisitions";
    public static final String RECOVERIES = "saga.recoveries";

    private final MeterRegistry registry;
    private final AtomicInteger activeSagas = new AtomicInteger(0);

    public SagaMetrics(MeterRegistry registry) {
        this.registry = registry;
        bindTo(registry);
    }

    /**
     * Metrics kept in a private registry, for orchestrators built without Micrometer wiring.
     */
    public static SagaMetrics standalone() {
        return new SagaMetrics(new SimpleMeterRegistry());
    }

    @Override
    public void bindTo(MeterRegistry meterRegistry) {
        Gauge.builder(SAGAS_ACTIVE, activeSagas, AtomicInteger::get)
            .description("Sagas currently driven by this orchestrator")
            .register(meterRegistry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public int activeSagas() {
        return activeSagas.get();
    }

    // ========== Saga Metrics ==========

    public void sagaStarted(String sagaType) {
        Counter.builder(SAGAS_STARTED)
            .tag("saga", sagaType)
            .description("Total sagas started")
            .register(registry)
            .increment();
        activeSagas.incrementAndGet();
    }

    public void sagaCompleted(String sagaType, Duration duration) {
        Counter.builder(SAGAS_COMPLETED)
            .tag("saga", sagaType)
            .description("Total sagas completed successfully")
            .register(registry)
            .increment();
        recordSagaDuration(sagaType, "success", duration);
    }

    public void sagaFailed(String sagaType, String failedStep, Duration duration) {
        Counter.builder(SAGAS_FAILED)
            .tag("saga", sagaType)
            .tag("step", failedStep != null ? failedStep : "none")
            .description("Total sagas failed")
            .register(registry)
            .increment();
        recordSagaDuration(sagaType, "failure", duration);
    }

    /**
     * Called once per run, whatever the outcome, when the orchestrator stops driving a saga.
     */
    public void sagaFinished() {
        activeSagas.decrementAndGet();
    }

    // ========== Step Metrics ==========

    public void stepCompleted(String sagaType, String stepName, Duration duration) {
        recordStepDuration(sagaType, stepName, "success", duration);
    }

    public void stepFailed(String sagaType, String stepName, String errorType, Duration duration) {
        Counter.builder(STEP_FAILURES)
            .tag("saga", sagaType)
            .tag("step", stepName)
            .tag("error_type", errorType)
            .description("Total step failures")
            .register(registry)
            .increment();
        recordStepDuration(sagaType, stepName, "failure", duration);
    }

    public void stepRetried(String sagaType, String stepName) {
        Counter.builder(STEP_RETRIES)
            .tag("saga", sagaType)
            .tag("step", stepName)
            .description("Total step retries")
            .register(registry)
            .increment();
    }

    public void stepTimedOut(String sagaType, String stepName) {
        Counter.builder(STEP_TIMEOUTS)
            .tag("saga", sagaType)
            .tag("step", stepName)
            .description("Total step timeouts")
            .register(registry)
            .increment();
    }

    // ========== Compensation Metrics ==========

    public void compensationCompleted(String sagaType, String stepName) {
        compensation(sagaType, stepName, "success");
    }

    public void compensationFailed(String sagaType, String stepName) {
        compensation(sagaType, stepName, "failure");
    }

    // ========== Lease and Recovery Metrics ==========

    public void leaseAcquired(boolean success) {
        Counter.builder(LEASE_ACQUISITIONS)
            .tag("success", String.valueOf(success))
            .description("Saga lease acquisition attempts")
            .register(registry)
            .increment();
    }

    public void sagaRecovered(String sagaType) {
        Counter.builder(RECOVERIES)
            .tag("saga", sagaType)
            .description("Abandoned sagas failed by recovery")
            .register(registry)
            .increment();
    }

    private void compensation(String sagaType, String stepName, String outcome) {
        Counter.builder(COMPENSATIONS)
            .tag("saga", sagaType)
            .tag("step", stepName)
            .tag("outcome", outcome)
            .description("Step compensations by outcome")
            .register(registry)
            .increment();
    }

    private void recordSagaDuration(String sagaType, String outcome, Duration duration) {
        Timer.builder(SAGA_DURATION)
            .tag("saga", sagaType)
            .tag("outcome", outcome)
            .description("Saga execution duration")
            .register(registry)
            .record(duration);
    }

    private void recordStepDuration(String sagaType, String stepName, String outcome, Duration duration) {
        Timer.builder(STEP_DURATION)
            .tag("saga", sagaType)
            .tag("step", stepName)
            .tag("outcome", outcome)
            .description("Step execution duration")
            .register(registry)
            .record(duration);
    }
}
