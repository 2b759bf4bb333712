package com.saga.core.model;

import com.saga.core.handler.StepHandler;

import java.time.Duration;

/**
 * Definition of a step within a saga type.
 * Describes what to execute, not instance-specific data.
 *
 * Invariants:
 * - name is non-empty (uniqueness within the saga is recommended, not enforced)
 * - handler is non-null
 * - timeout, if set, > 0
 */
public record StepDefinition(
    // Identity
    String name,
    String service,

    // Execution
    StepHandler handler,
    Duration timeout,

    // Retry
    boolean retryable,
    Integer maxRetries
) {
    /**
     * Get the effective timeout (step-specific or saga default).
     */
    public Duration effectiveTimeout(SagaOptions sagaOptions) {
        return timeout != null ? timeout : sagaOptions.timeout();
    }

    /**
     * Get the effective retry budget (step-specific or saga default).
     */
    public int effectiveMaxRetries(SagaOptions sagaOptions) {
        return maxRetries != null ? maxRetries : sagaOptions.maxRetries();
    }

    public static Builder builder(String name, StepHandler handler) {
        return new Builder().name(name).handler(handler);
    }

    public static class Builder {
        private String name;
        private String service;
        private StepHandler handler;
        private Duration timeout;
        private boolean retryable;
        private Integer maxRetries;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder handler(StepHandler handler) {
            this.handler = handler;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder retryable(boolean retryable) {
            this.retryable = retryable;
            return this;
        }

        /**
         * Mark the step retryable with its own retry budget.
         */
        public Builder maxRetries(int maxRetries) {
            this.retryable = true;
            this.maxRetries = maxRetries;
            return this;
        }

        public StepDefinition build() {
            return new StepDefinition(name, service, handler, timeout, retryable, maxRetries);
        }
    }
}
