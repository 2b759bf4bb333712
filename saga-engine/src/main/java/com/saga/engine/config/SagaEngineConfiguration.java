package com.saga.engine.config;

import com.saga.core.json.SagaJson;
import com.saga.core.store.SagaLeaseStore;
import com.saga.core.store.SagaStore;
import com.saga.engine.lifecycle.GracefulShutdownHandler;
import com.saga.engine.metrics.SagaMetrics;
import com.saga.engine.orchestrator.SagaOrchestrator;
import com.saga.engine.persistence.InMemorySagaLeaseStore;
import com.saga.engine.persistence.InMemorySagaStore;
import com.saga.engine.persistence.jdbc.JdbcSagaLeaseStore;
import com.saga.engine.persistence.jdbc.JdbcSagaStore;
import com.saga.engine.registry.SagaRegistry;
import com.saga.engine.timing.SagaTimers;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * Spring wiring for the saga engine.
 * The store backend is chosen by {@code saga.engine.store.type}.
 */
@Configuration
@EnableConfigurationProperties(SagaEngineProperties.class)
public class SagaEngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SagaEngineConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock sagaClock() {
        return Clock.systemUTC();
    }

    @Bean
    public SagaRegistry sagaRegistry() {
        return new SagaRegistry();
    }

    @Bean
    public SagaTimers sagaTimers() {
        return new SagaTimers();
    }

    @Bean
    public SagaMetrics sagaMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new SagaMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    public SagaOrchestrator sagaOrchestrator(
            SagaEngineProperties properties,
            SagaRegistry sagaRegistry,
            SagaStore sagaStore,
            SagaLeaseStore sagaLeaseStore,
            SagaTimers sagaTimers,
            SagaMetrics sagaMetrics,
            Clock sagaClock) {
        log.info("Creating saga orchestrator (store={}, defaults={})",
            properties.getStore().getType(), properties.getDefaults().toOptions());
        return SagaOrchestrator.builder()
            .registry(sagaRegistry)
            .store(sagaStore)
            .leaseStore(sagaLeaseStore)
            .timers(sagaTimers)
            .metrics(sagaMetrics)
            .clock(sagaClock)
            .defaults(properties.getDefaults().toOptions())
            .leaseDuration(properties.getLease().getDuration())
            .stepThreads(properties.getExecutor().getStepThreads())
            .sagaThreads(properties.getExecutor().getSagaThreads())
            .build();
    }

    @Bean
    public GracefulShutdownHandler sagaShutdownHandler(SagaOrchestrator sagaOrchestrator,
                                                       SagaEngineProperties properties) {
        return new GracefulShutdownHandler(sagaOrchestrator, properties.getShutdown().getTimeout());
    }

    @Configuration
    @ConditionalOnProperty(prefix = "saga.engine.store", name = "type", havingValue = "memory", matchIfMissing = true)
    static class InMemoryStoreConfiguration {

        @Bean
        public SagaStore sagaStore(Clock sagaClock) {
            return new InMemorySagaStore(sagaClock);
        }

        @Bean
        public SagaLeaseStore sagaLeaseStore(Clock sagaClock) {
            return new InMemorySagaLeaseStore(sagaClock);
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "saga.engine.store", name = "type", havingValue = "jdbc")
    static class JdbcStoreConfiguration {

        @Bean
        public SagaStore sagaStore(JdbcTemplate jdbcTemplate, Clock sagaClock) {
            return new JdbcSagaStore(jdbcTemplate, SagaJson.defaultMapper(), sagaClock);
        }

        @Bean
        public SagaLeaseStore sagaLeaseStore(JdbcTemplate jdbcTemplate) {
            return new JdbcSagaLeaseStore(jdbcTemplate);
        }
    }
}
