package com.saga.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one saga run, returned to the caller of execute.
 *
 * @param result           step name to step output; only set when COMPLETED
 * @param error            message of the triggering failure; only set when FAILED
 * @param completedSteps   steps that completed, in completion order
 * @param failedStep       step whose failure ended the run; only set when FAILED
 * @param compensatedSteps steps whose compensation succeeded, in compensation order
 */
public record SagaExecutionResult(
    String sagaId,
    String sagaType,
    SagaStatus status,
    Map<String, JsonNode> result,
    String error,
    List<String> completedSteps,
    String failedStep,
    List<String> compensatedSteps,
    Duration duration
) {
    public SagaExecutionResult {
        completedSteps = List.copyOf(completedSteps);
        compensatedSteps = List.copyOf(compensatedSteps);
        result = result == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }

    public static SagaExecutionResult completed(String sagaId, String sagaType,
                                                Map<String, JsonNode> result,
                                                List<String> completedSteps, Duration duration) {
        return new SagaExecutionResult(sagaId, sagaType, SagaStatus.COMPLETED, result, null,
            completedSteps, null, List.of(), duration);
    }

    public static SagaExecutionResult failed(String sagaId, String sagaType, String error,
                                             List<String> completedSteps, String failedStep,
                                             List<String> compensatedSteps, Duration duration) {
        return new SagaExecutionResult(sagaId, sagaType, SagaStatus.FAILED, null, error,
            completedSteps, failedStep, compensatedSteps, duration);
    }

    public boolean isCompleted() {
        return status == SagaStatus.COMPLETED;
    }

    /**
     * Check if every completed step was compensated.
     * A false value on a failed saga means manual cleanup is required.
     */
    public boolean isFullyCompensated() {
        return compensatedSteps.size() == completedSteps.size()
            && compensatedSteps.containsAll(completedSteps);
    }
}
