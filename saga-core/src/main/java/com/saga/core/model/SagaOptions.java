package com.saga.core.model;

import java.time.Duration;

/**
 * Saga-level execution options.
 * Any component may be null in a registration, meaning "use the engine default".
 *
 * Invariants (after {@link #withDefaults(SagaOptions)}):
 * - maxRetries >= 0
 * - retryDelay >= 0
 * - timeout > 0
 */
public record SagaOptions(
    Integer maxRetries,
    Duration retryDelay,
    Duration timeout,
    Boolean persistState
) {
    /**
     * Engine defaults: 3 retries, 1s linear retry delay, 30s step timeout, state persisted.
     */
    public static final SagaOptions DEFAULTS = new SagaOptions(
        3,
        Duration.ofSeconds(1),
        Duration.ofSeconds(30),
        true
    );

    /**
     * Options with every component unset.
     */
    public static SagaOptions unset() {
        return new SagaOptions(null, null, null, null);
    }

    /**
     * Fill unset components from the given defaults.
     */
    public SagaOptions withDefaults(SagaOptions defaults) {
        return new SagaOptions(
            maxRetries != null ? maxRetries : defaults.maxRetries(),
            retryDelay != null ? retryDelay : defaults.retryDelay(),
            timeout != null ? timeout : defaults.timeout(),
            persistState != null ? persistState : defaults.persistState()
        );
    }

    /**
     * Compute the wait before the next attempt.
     * Backoff is linear: retryDelay * retryCount.
     *
     * @param retryCount saga retry counter after it was incremented (1-indexed)
     */
    public Duration computeBackoff(int retryCount) {
        if (retryCount < 1) {
            throw new IllegalArgumentException("Retry count must be >= 1");
        }
        return retryDelay.multipliedBy(retryCount);
    }

    public boolean shouldPersist() {
        return persistState == null || persistState;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Integer maxRetries;
        private Duration retryDelay;
        private Duration timeout;
        private Boolean persistState;

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder persistState(boolean persistState) {
            this.persistState = persistState;
            return this;
        }

        public SagaOptions build() {
            return new SagaOptions(maxRetries, retryDelay, timeout, persistState);
        }
    }
}
