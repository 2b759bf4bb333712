package com.saga.core.handler;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Forward and compensating action of one saga step.
 * Implementations call into other services; the orchestrator treats them as opaque.
 *
 * <p>Handlers must be idempotent or cancel their own work when interrupted: a handler that
 * exceeds its timeout is abandoned by the orchestrator and only receives a thread interrupt.</p>
 */
public interface StepHandler {

    /**
     * Execute the forward action.
     *
     * @param payload the saga payload
     * @param context identity, prior step results and caller metadata
     * @return the step output, recorded under the step name (may be null)
     * @throws Exception any failure; {@link StepException} may mark it non-retryable
     */
    JsonNode execute(JsonNode payload, SagaContext context) throws Exception;

    /**
     * Undo the forward action. Invoked at most once per completed step, in reverse order.
     *
     * @param payload the saga payload
     * @param context rebound to the step being compensated
     * @throws Exception if compensation failed; logged and reported, never retried
     */
    void compensate(JsonNode payload, SagaContext context) throws Exception;
}
