package com.saga.core.handler;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Factory methods for building {@link StepHandler}s from lambdas.
 */
public final class StepHandlers {

    private StepHandlers() {
    }

    /**
     * Forward action of a step.
     */
    @FunctionalInterface
    public interface Action {
        JsonNode apply(JsonNode payload, SagaContext context) throws Exception;
    }

    /**
     * Compensating action of a step.
     */
    @FunctionalInterface
    public interface Compensation {
        void apply(JsonNode payload, SagaContext context) throws Exception;
    }

    /**
     * Combine a forward action and its compensation into a handler.
     */
    public static StepHandler of(Action action, Compensation compensation) {
        return new StepHandler() {
            @Override
            public JsonNode execute(JsonNode payload, SagaContext context) throws Exception {
                return action.apply(payload, context);
            }

            @Override
            public void compensate(JsonNode payload, SagaContext context) throws Exception {
                compensation.apply(payload, context);
            }
        };
    }

    /**
     * A handler whose forward action has nothing to undo (reads, notifications).
     */
    public static StepHandler withoutCompensation(Action action) {
        return of(action, (payload, context) -> { });
    }
}
