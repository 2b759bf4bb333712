package com.saga.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.saga.core.exception.InvalidSagaStateException;

import java.time.Instant;

/**
 * Persisted state of one step within a saga.
 * Owned by its parent {@link SagaDefinition}; only ever replaced, never mutated.
 *
 * Invariants:
 * - name and service never change
 * - result is set only when the step reached COMPLETED
 * - attempts counts forward invocations within the owning saga run
 */
public record StepRecord(
    String name,
    String service,
    StepStatus status,
    JsonNode result,
    String error,
    int attempts,
    Instant updatedAt
) {
    /**
     * Create a step record in PENDING status.
     */
    public static StepRecord pending(String name, String service, Instant now) {
        return new StepRecord(name, service, StepStatus.PENDING, null, null, 0, now);
    }

    /**
     * Create a copy moved to the given status.
     * Re-applying the current status is allowed so an error can be attached without a transition.
     *
     * @throws InvalidSagaStateException if the transition is not allowed
     */
    public StepRecord transitionTo(StepStatus target, JsonNode newResult, String newError, Instant now) {
        if (status != target && !status.canTransitionTo(target)) {
            throw new InvalidSagaStateException("step " + name, status.name(), target.name());
        }
        int newAttempts = target == StepStatus.RUNNING ? attempts + 1 : attempts;
        JsonNode keptResult = switch (target) {
            case COMPLETED -> newResult;
            case RUNNING, FAILED, PENDING -> null;
            case COMPENSATING, COMPENSATED -> result;
        };
        return new StepRecord(name, service, target, keptResult, newError, newAttempts, now);
    }
}
