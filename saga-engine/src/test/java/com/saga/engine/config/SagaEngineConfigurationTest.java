package com.saga.engine.config;

import com.saga.core.model.SagaOptions;
import com.saga.core.store.SagaLeaseStore;
import com.saga.core.store.SagaStore;
import com.saga.engine.lifecycle.GracefulShutdownHandler;
import com.saga.engine.metrics.SagaMetrics;
import com.saga.engine.orchestrator.SagaOrchestrator;
import com.saga.engine.persistence.InMemorySagaLeaseStore;
import com.saga.engine.persistence.InMemorySagaStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class SagaEngineConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withUserConfiguration(SagaEngineConfiguration.class);

    @Test
    @DisplayName("Defaults to the in-memory stores")
    void inMemoryByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(SagaOrchestrator.class);
            assertThat(context).hasSingleBean(GracefulShutdownHandler.class);
            assertThat(context.getBean(SagaStore.class)).isInstanceOf(InMemorySagaStore.class);
            assertThat(context.getBean(SagaLeaseStore.class)).isInstanceOf(InMemorySagaLeaseStore.class);
        });
    }

    @Test
    @DisplayName("Binds engine defaults from saga.engine properties")
    void bindsProperties() {
        contextRunner
            .withPropertyValues(
                "saga.engine.defaults.max-retries=5",
                "saga.engine.defaults.retry-delay=250ms",
                "saga.engine.defaults.timeout=10s",
                "saga.engine.lease.duration=2m",
                "saga.engine.shutdown.timeout=15s")
            .run(context -> {
                SagaEngineProperties properties = context.getBean(SagaEngineProperties.class);
                SagaOptions options = properties.getDefaults().toOptions();

                assertThat(options.maxRetries()).isEqualTo(5);
                assertThat(options.retryDelay()).isEqualTo(Duration.ofMillis(250));
                assertThat(options.timeout()).isEqualTo(Duration.ofSeconds(10));
                assertThat(properties.getLease().getDuration()).isEqualTo(Duration.ofMinutes(2));
                assertThat(properties.getShutdown().getTimeout()).isEqualTo(Duration.ofSeconds(15));
            });
    }

    @Test
    @DisplayName("Uses the application's MeterRegistry when one exists")
    void usesMeterRegistry() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        contextRunner
            .withBean(SimpleMeterRegistry.class, () -> meterRegistry)
            .run(context -> {
                assertThat(context.getBean(SagaMetrics.class).registry()).isSameAs(meterRegistry);
                assertThat(meterRegistry.find("saga.active").gauge()).isNotNull();
            });
    }
}
