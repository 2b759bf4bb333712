package com.saga.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.saga.core.exception.InvalidSagaStateException;
import com.saga.core.exception.SagaNotFoundException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * A single execution of a registered saga type.
 * Primary source of truth for saga state; stored as one document keyed by sagaId.
 *
 * Invariants:
 * - sagaId, sagaType and payload never change after creation
 * - step order and step count never change after creation
 * - status transitions follow {@link SagaStatus#canTransitionTo(SagaStatus)}
 * - version is incremented on every mutation (optimistic locking)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SagaDefinition(
    // Identity
    String sagaId,
    String sagaType,

    // State
    SagaStatus status,
    List<StepRecord> steps,

    // Data
    JsonNode payload,
    Map<String, JsonNode> result,
    String error,

    // Retry tracking
    int retryCount,
    int maxRetries,
    String retriedFrom,

    // Timing
    Instant createdAt,
    Instant updatedAt,

    // Versioning (optimistic locking)
    long version
) {
    public SagaDefinition {
        steps = List.copyOf(steps);
        result = result == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }

    /**
     * Create a new saga instance in PENDING status with one PENDING record per step.
     *
     * @param steps ordered (name, service) pairs mirroring the registered definition
     */
    public static SagaDefinition create(
            String sagaType,
            List<StepRecord> steps,
            JsonNode payload,
            int maxRetries,
            String retriedFrom,
            Instant now) {
        return new SagaDefinition(
            UUID.randomUUID().toString(),
            sagaType,
            SagaStatus.PENDING,
            steps,
            payload,
            null,
            null,
            0,
            maxRetries,
            retriedFrom,
            now,
            now,
            0L
        );
    }

    /**
     * Look up a step record by name. With duplicate names the first match wins.
     */
    public Optional<StepRecord> step(String stepName) {
        return steps.stream().filter(s -> s.name().equals(stepName)).findFirst();
    }

    /**
     * Names of steps currently in COMPLETED status, in step order.
     */
    public List<String> completedStepNames() {
        return steps.stream()
            .filter(s -> s.status() == StepStatus.COMPLETED)
            .map(StepRecord::name)
            .toList();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Create a copy with a new saga status.
     *
     * @throws InvalidSagaStateException if the transition is not allowed
     */
    public SagaDefinition withStatus(SagaStatus newStatus, String newError, Instant now) {
        if (!status.canTransitionTo(newStatus)) {
            throw new InvalidSagaStateException(status, newStatus);
        }
        return new SagaDefinition(
            sagaId, sagaType, newStatus, steps, payload, result,
            newError != null ? newError : error,
            retryCount, maxRetries, retriedFrom, createdAt, now, version + 1
        );
    }

    /**
     * Create a copy marked COMPLETED with the merged step results.
     */
    public SagaDefinition withCompleted(Map<String, JsonNode> stepResults, Instant now) {
        if (!status.canTransitionTo(SagaStatus.COMPLETED)) {
            throw new InvalidSagaStateException(status, SagaStatus.COMPLETED);
        }
        return new SagaDefinition(
            sagaId, sagaType, SagaStatus.COMPLETED, steps, payload, stepResults, null,
            retryCount, maxRetries, retriedFrom, createdAt, now, version + 1
        );
    }

    /**
     * Create a copy with one step moved to a new status.
     *
     * @throws InvalidSagaStateException if the transition is not allowed
     * @throws SagaNotFoundException if no step has that name
     */
    public SagaDefinition withStepStatus(String stepName, StepStatus newStatus,
                                         JsonNode stepResult, String stepError, Instant now) {
        List<StepRecord> newSteps = new ArrayList<>(steps);
        int index = indexOf(stepName, newStatus);
        newSteps.set(index, steps.get(index).transitionTo(newStatus, stepResult, stepError, now));
        return new SagaDefinition(
            sagaId, sagaType, status, newSteps, payload, result, error,
            retryCount, maxRetries, retriedFrom, createdAt, now, version + 1
        );
    }

    /**
     * Create a copy with an updated retry counter.
     */
    public SagaDefinition withRetryCount(int newRetryCount, Instant now) {
        return new SagaDefinition(
            sagaId, sagaType, status, steps, payload, result, error,
            newRetryCount, maxRetries, retriedFrom, createdAt, now, version + 1
        );
    }

    /**
     * With duplicate step names, picks the first record that can move to the target status,
     * then the first record already in it. Falls back to the first record with that name,
     * whose transition then fails.
     */
    private int indexOf(String stepName, StepStatus target) {
        int firstMatch = -1;
        int sameStatus = -1;
        for (int i = 0; i < steps.size(); i++) {
            StepRecord step = steps.get(i);
            if (!step.name().equals(stepName)) {
                continue;
            }
            if (step.status().canTransitionTo(target)) {
                return i;
            }
            if (sameStatus < 0 && step.status() == target) {
                sameStatus = i;
            }
            if (firstMatch < 0) {
                firstMatch = i;
            }
        }
        if (firstMatch < 0) {
            throw new SagaNotFoundException("Step", sagaId + "/" + stepName);
        }
        return sameStatus >= 0 ? sameStatus : firstMatch;
    }
}
