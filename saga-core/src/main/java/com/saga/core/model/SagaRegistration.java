package com.saga.core.model;

import com.saga.core.handler.StepHandler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * A saga type as registered with the orchestrator: ordered steps plus saga-level options.
 */
public record SagaRegistration(
    String sagaType,
    List<StepDefinition> steps,
    SagaOptions options
) {
    public SagaRegistration {
        steps = steps == null ? List.of() : List.copyOf(steps);
        options = options == null ? SagaOptions.unset() : options;
    }

    /**
     * Start a fluent registration for the given saga type.
     *
     * <pre>
     * SagaRegistration registration = SagaRegistration.builder("order-fulfillment")
     *     .step("reserve-inventory", "inventory-service", inventoryHandler)
     *     .step(StepDefinition.builder("charge-payment", paymentHandler).maxRetries(2).build())
     *     .withTimeout(Duration.ofSeconds(10))
     *     .build();
     * </pre>
     */
    public static Builder builder(String sagaType) {
        return new Builder(sagaType);
    }

    public static class Builder {
        private final String sagaType;
        private final List<StepDefinition> steps = new ArrayList<>();
        private final SagaOptions.Builder options = SagaOptions.builder();

        private Builder(String sagaType) {
            this.sagaType = sagaType;
        }

        public Builder step(StepDefinition step) {
            steps.add(step);
            return this;
        }

        public Builder step(String name, String service, StepHandler handler) {
            return step(StepDefinition.builder(name, handler).service(service).build());
        }

        public Builder withRetries(int maxRetries) {
            options.maxRetries(maxRetries);
            return this;
        }

        public Builder withRetryDelay(Duration retryDelay) {
            options.retryDelay(retryDelay);
            return this;
        }

        public Builder withTimeout(Duration timeout) {
            options.timeout(timeout);
            return this;
        }

        public Builder persistState(boolean persistState) {
            options.persistState(persistState);
            return this;
        }

        public SagaRegistration build() {
            return new SagaRegistration(sagaType, steps, options.build());
        }
    }
}
