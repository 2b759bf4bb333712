package com.saga.engine.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.saga.core.model.SagaDefinition;
import com.saga.core.model.SagaExecutionResult;
import com.saga.core.model.SagaOptions;
import com.saga.core.model.SagaRegistration;
import com.saga.core.model.StepDefinition;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Registration, execution and query API of the saga orchestrator.
 */
public interface SagaService {

    /**
     * Register or replace a saga type.
     *
     * @param registration The saga type, its ordered steps and options
     * @throws com.saga.core.exception.SagaValidationException if the registration is invalid
     */
    void registerSaga(SagaRegistration registration);

    /**
     * Register or replace a saga type.
     *
     * @param sagaType The saga type
     * @param steps Ordered step definitions
     * @param options Saga options; unset components fall back to engine defaults
     */
    default void registerSaga(String sagaType, List<StepDefinition> steps, SagaOptions options) {
        registerSaga(new SagaRegistration(sagaType, steps, options));
    }

    /**
     * Run a new saga instance to completion or compensation.
     * Step failures and timeouts are reported in the result, never thrown.
     *
     * @param sagaType A registered saga type
     * @param payload Input passed to every step
     * @param metadata Caller data exposed to handlers through the context
     * @return The outcome of the run
     * @throws com.saga.core.exception.UnregisteredSagaTypeException if the type is unknown
     * @throws com.saga.core.exception.SagaRejectedException if the orchestrator is shutting down
     * @throws com.saga.core.exception.SagaStoreException if saga state could not be recorded
     */
    SagaExecutionResult execute(String sagaType, JsonNode payload, Map<String, Object> metadata);

    default SagaExecutionResult execute(String sagaType, JsonNode payload) {
        return execute(sagaType, payload, Map.of());
    }

    /**
     * Run a new saga instance on the orchestrator's saga pool.
     * Caller errors are thrown immediately; the future only fails on engine errors.
     */
    CompletableFuture<SagaExecutionResult> executeAsync(String sagaType, JsonNode payload,
                                                        Map<String, Object> metadata);

    /**
     * Get the stored record of a saga.
     *
     * @return The saga, empty if unknown or never persisted
     */
    Optional<SagaDefinition> getSagaStatus(String sagaId);

    /**
     * Get every saga in FAILED status.
     */
    List<SagaDefinition> getFailedSagas();

    /**
     * Start a new instance of a failed saga with its original type and payload.
     * The new instance restarts from the first step; the original record is kept.
     *
     * @param sagaId A saga in FAILED status
     * @return The outcome of the new instance
     * @throws com.saga.core.exception.SagaNotFoundException if the saga is unknown
     * @throws com.saga.core.exception.InvalidSagaStateException if the saga is not FAILED
     */
    SagaExecutionResult retrySaga(String sagaId);
}
