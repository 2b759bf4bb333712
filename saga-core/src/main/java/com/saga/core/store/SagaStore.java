package com.saga.core.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.saga.core.model.SagaDefinition;
import com.saga.core.model.SagaStatus;
import com.saga.core.model.StepStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable record of saga and step state, one document per saga keyed by sagaId.
 * Every mutation is atomic per saga record, refreshes updatedAt and increments the version.
 *
 * <p>Implementations wrap backend failures in {@link com.saga.core.exception.SagaStoreException}.</p>
 */
public interface SagaStore {

    /**
     * Insert or replace a saga record.
     *
     * @param saga The saga to save
     */
    void save(SagaDefinition saga);

    /**
     * Move a saga to a new status.
     *
     * @param sagaId The saga ID
     * @param status The target status
     * @return The updated saga
     * @throws com.saga.core.exception.SagaNotFoundException if the saga does not exist
     * @throws com.saga.core.exception.InvalidSagaStateException if the transition is not allowed
     */
    default SagaDefinition updateStatus(String sagaId, SagaStatus status) {
        return updateStatus(sagaId, status, null);
    }

    /**
     * Move a saga to a new status and attach an error message.
     *
     * @param sagaId The saga ID
     * @param status The target status
     * @param error The error message, or null to keep the current one
     * @return The updated saga
     */
    SagaDefinition updateStatus(String sagaId, SagaStatus status, String error);

    /**
     * Move one step of a saga to a new status.
     * With duplicate step names the first record that accepts the new status is updated.
     *
     * @param sagaId The saga ID
     * @param stepName The step name
     * @param status The target step status
     * @param result The step output (kept only for COMPLETED)
     * @param error The step error, or null
     * @return The updated saga
     */
    SagaDefinition updateStepStatus(String sagaId, String stepName, StepStatus status,
                                    JsonNode result, String error);

    /**
     * Mark a saga COMPLETED and store the merged step outputs.
     *
     * @param sagaId The saga ID
     * @param result Step name to step output
     * @return The updated saga
     */
    SagaDefinition complete(String sagaId, Map<String, JsonNode> result);

    /**
     * Overwrite the retry counter of a saga.
     *
     * @param sagaId The saga ID
     * @param retryCount The new counter value
     * @return The updated saga
     */
    SagaDefinition updateRetryCount(String sagaId, int retryCount);

    /**
     * Find a saga by ID.
     *
     * @param sagaId The saga ID
     * @return The saga if found
     */
    Optional<SagaDefinition> findById(String sagaId);

    /**
     * Find every saga in a status, oldest first.
     *
     * @param status The saga status
     * @return Matching sagas
     */
    List<SagaDefinition> findByStatus(SagaStatus status);

    /**
     * Find sagas in a status, oldest first.
     *
     * @param status The saga status
     * @param limit Maximum number of results
     * @return Matching sagas
     */
    List<SagaDefinition> findByStatus(SagaStatus status, int limit);

    /**
     * Find RUNNING sagas whose record has not changed since the given time.
     *
     * @param updatedBefore Sagas not updated since this time
     * @param limit Maximum number of results
     * @return Potentially abandoned sagas
     */
    List<SagaDefinition> findStaleRunning(Instant updatedBefore, int limit);

    /**
     * Count sagas per status. Statuses without sagas map to zero.
     *
     * @return Count per status
     */
    Map<SagaStatus, Long> countByStatus();

    /**
     * Delete COMPLETED and FAILED sagas last updated before the given time.
     *
     * @param finishedBefore Retention cutoff
     * @return Number of deleted sagas
     */
    int deleteFinishedBefore(Instant finishedBefore);
}
