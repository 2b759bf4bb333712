package com.saga.core.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Context provided to step handlers during execution and compensation.
 * Created fresh for every invocation and never persisted.
 */
public final class SagaContext {

    private final String sagaId;
    private final String sagaType;
    private final String currentStep;
    private final int attempt;
    private final Map<String, JsonNode> previousResults;
    private final Map<String, Object> metadata;
    private final ObjectMapper objectMapper;

    public SagaContext(
            String sagaId,
            String sagaType,
            String currentStep,
            int attempt,
            Map<String, JsonNode> previousResults,
            Map<String, Object> metadata,
            ObjectMapper objectMapper) {
        this.sagaId = sagaId;
        this.sagaType = sagaType;
        this.currentStep = currentStep;
        this.attempt = attempt;
        this.previousResults = Collections.unmodifiableMap(new LinkedHashMap<>(previousResults));
        this.metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.objectMapper = objectMapper;
    }

    public String getSagaId() {
        return sagaId;
    }

    public String getSagaType() {
        return sagaType;
    }

    /**
     * Get the step being executed or compensated.
     */
    public String getCurrentStep() {
        return currentStep;
    }

    /**
     * Get the 1-indexed attempt number of the current step within this saga run.
     */
    public int getAttempt() {
        return attempt;
    }

    /**
     * Get the outputs of the steps before the current one, keyed by step name.
     */
    public Map<String, JsonNode> getPreviousResults() {
        return previousResults;
    }

    /**
     * Get the output of an earlier step.
     */
    public Optional<JsonNode> getPreviousResult(String stepName) {
        return Optional.ofNullable(previousResults.get(stepName));
    }

    /**
     * Get the output of an earlier step as a specific type.
     */
    public <T> Optional<T> getPreviousResult(String stepName, Class<T> type) {
        return getPreviousResult(stepName).map(node -> objectMapper.convertValue(node, type));
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Convert the saga payload to a specific type.
     */
    public <T> T convert(JsonNode payload, Class<T> type) {
        return objectMapper.convertValue(payload, type);
    }

    /**
     * Convert a result object to JsonNode.
     */
    public JsonNode toJsonNode(Object result) {
        return objectMapper.valueToTree(result);
    }

    /**
     * Idempotency key for the current step of this saga.
     * Use this when making external calls so retries are deduplicated downstream.
     */
    public String getIdempotencyKey() {
        return sagaId + ":" + currentStep;
    }

    /**
     * Create a copy bound to another step, keeping the same results and metadata.
     */
    public SagaContext forStep(String stepName) {
        return new SagaContext(sagaId, sagaType, stepName, attempt, previousResults, metadata, objectMapper);
    }
}
