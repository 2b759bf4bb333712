package com.saga.recovery;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for the background recovery of abandoned sagas.
 */
@ConfigurationProperties(prefix = "saga.recovery")
public class SagaRecoveryProperties {

    private boolean enabled = false;

    private Duration scanInterval = Duration.ofSeconds(30);

    /**
     * RUNNING sagas not updated for this long are candidates for recovery.
     * Keep it above the longest step timeout plus retry delay.
     */
    private Duration staleAfter = Duration.ofMinutes(10);

    private int batchSize = 100;

    /**
     * How long finished sagas are kept. Unset keeps them forever.
     */
    private Duration retention;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getScanInterval() {
        return scanInterval;
    }

    public void setScanInterval(Duration scanInterval) {
        this.scanInterval = scanInterval;
    }

    public Duration getStaleAfter() {
        return staleAfter;
    }

    public void setStaleAfter(Duration staleAfter) {
        this.staleAfter = staleAfter;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getRetention() {
        return retention;
    }

    public void setRetention(Duration retention) {
        this.retention = retention;
    }
}
