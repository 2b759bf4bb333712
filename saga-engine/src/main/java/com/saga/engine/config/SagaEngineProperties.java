package com.saga.engine.config;

import com.saga.core.model.SagaLease;
import com.saga.core.model.SagaOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;

/**
 * Configuration properties for the saga engine.
 *
 * Example configuration:
 * <pre>
 * saga.engine.defaults.max-retries=3
 * saga.engine.defaults.retry-delay=1s
 * saga.engine.defaults.timeout=30s
 * saga.engine.store.type=jdbc
 * saga.engine.lease.duration=5m
 * saga.engine.executor.step-threads=16
 * saga.engine.shutdown.timeout=30s
 * </pre>
 */
@ConfigurationProperties(prefix = "saga.engine")
public class SagaEngineProperties {

    /**
     * Options applied to every saga type that does not set its own.
     */
    @NestedConfigurationProperty
    private Defaults defaults = new Defaults();

    @NestedConfigurationProperty
    private Store store = new Store();

    @NestedConfigurationProperty
    private Lease lease = new Lease();

    @NestedConfigurationProperty
    private Executor executor = new Executor();

    @NestedConfigurationProperty
    private Shutdown shutdown = new Shutdown();

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Lease getLease() {
        return lease;
    }

    public void setLease(Lease lease) {
        this.lease = lease;
    }

    public Executor getExecutor() {
        return executor;
    }

    public void setExecutor(Executor executor) {
        this.executor = executor;
    }

    public Shutdown getShutdown() {
        return shutdown;
    }

    public void setShutdown(Shutdown shutdown) {
        this.shutdown = shutdown;
    }

    public static class Defaults {
        private int maxRetries = SagaOptions.DEFAULTS.maxRetries();
        private Duration retryDelay = SagaOptions.DEFAULTS.retryDelay();
        private Duration timeout = SagaOptions.DEFAULTS.timeout();
        private boolean persistState = true;

        public SagaOptions toOptions() {
            return new SagaOptions(maxRetries, retryDelay, timeout, persistState);
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public boolean isPersistState() {
            return persistState;
        }

        public void setPersistState(boolean persistState) {
            this.persistState = persistState;
        }
    }

    public static class Store {
        /**
         * Saga store backend: memory or jdbc.
         */
        private String type = "memory";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }

    public static class Lease {
        private Duration duration = SagaLease.DEFAULT_LEASE_DURATION;

        public Duration getDuration() {
            return duration;
        }

        public void setDuration(Duration duration) {
            this.duration = duration;
        }
    }

    public static class Executor {
        /**
         * Step handler threads kept alive when idle. The pool adds threads beyond this
         * while all are busy, so handlers stuck after a timeout do not block other steps.
         */
        private int stepThreads = 16;

        /**
         * Threads running sagas submitted through executeAsync.
         */
        private int sagaThreads = 8;

        public int getStepThreads() {
            return stepThreads;
        }

        public void setStepThreads(int stepThreads) {
            this.stepThreads = stepThreads;
        }

        public int getSagaThreads() {
            return sagaThreads;
        }

        public void setSagaThreads(int sagaThreads) {
            this.sagaThreads = sagaThreads;
        }
    }

    public static class Shutdown {
        private Duration timeout = Duration.ofSeconds(30);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
