package com.saga.recovery;

import com.saga.core.store.SagaLeaseStore;
import com.saga.core.store.SagaStore;
import com.saga.engine.metrics.SagaMetrics;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Enables the recovery scan when {@code saga.recovery.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(prefix = "saga.recovery", name = "enabled", havingValue = "true")
@EnableConfigurationProperties(SagaRecoveryProperties.class)
public class SagaRecoveryConfiguration {

    @Bean(initMethod = "start", destroyMethod = "stop")
    public SagaRecoveryService sagaRecoveryService(
            SagaStore sagaStore,
            SagaLeaseStore sagaLeaseStore,
            SagaMetrics sagaMetrics,
            SagaRecoveryProperties properties,
            Clock sagaClock) {
        return new SagaRecoveryService(sagaStore, sagaLeaseStore, sagaMetrics, properties, sagaClock);
    }
}
