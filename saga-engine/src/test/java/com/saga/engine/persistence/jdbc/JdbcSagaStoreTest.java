package com.saga.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.saga.core.exception.ConcurrentSagaModificationException;
import com.saga.core.exception.SagaNotFoundException;
import com.saga.core.json.SagaJson;
import com.saga.core.model.SagaDefinition;
import com.saga.core.model.SagaStatus;
import com.saga.core.model.StepRecord;
import com.saga.core.model.StepStatus;
import com.saga.core.test.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * JdbcSagaStore against a real PostgreSQL.
 */
@Testcontainers(disabledWithoutDocker = true)
class JdbcSagaStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = JdbcStoreTestSupport.newContainer();

    private static final JsonNode PAYLOAD = JsonNodeFactory.instance.objectNode()
        .put("orderId", "o-1")
        .put("amount", 99.5);

    private TimeController time;
    private JdbcTemplate jdbcTemplate;
    private JdbcSagaStore store;

    @BeforeEach
    void setUp() {
        // TIMESTAMPTZ keeps microseconds only
        time = TimeController.frozenAt(Instant.now().truncatedTo(ChronoUnit.MILLIS));
        jdbcTemplate = JdbcStoreTestSupport.freshDatabase(postgres);
        store = new JdbcSagaStore(jdbcTemplate, SagaJson.defaultMapper(), time);
    }

    private SagaDefinition saved(String retriedFrom) {
        SagaDefinition saga = SagaDefinition.create("order-fulfillment",
            List.of(StepRecord.pending("reserve-inventory", "inventory", time.instant()),
                StepRecord.pending("charge-payment", "payment", time.instant())),
            PAYLOAD, 3, retriedFrom, time.instant());
        store.save(saga);
        return saga;
    }

    @Test
    @DisplayName("Saved sagas load back unchanged")
    void saveAndLoad() {
        SagaDefinition saga = saved("previous-saga");

        SagaDefinition loaded = store.findById(saga.sagaId()).orElseThrow();

        assertThat(loaded).isEqualTo(saga);
        assertThat(loaded.payload().get("amount").asDouble()).isEqualTo(99.5);
        assertThat(store.findById("missing")).isEmpty();
    }

    @Test
    @DisplayName("Step and saga updates are persisted with their results")
    void lifecycle() {
        SagaDefinition saga = saved(null);
        time.advanceSeconds(1);

        store.updateStatus(saga.sagaId(), SagaStatus.RUNNING);
        store.updateStepStatus(saga.sagaId(), "reserve-inventory", StepStatus.RUNNING, null, null);
        JsonNode reservation = JsonNodeFactory.instance.objectNode().put("reservationId", "r-1");
        store.updateStepStatus(saga.sagaId(), "reserve-inventory", StepStatus.COMPLETED, reservation, null);
        store.updateRetryCount(saga.sagaId(), 1);
        SagaDefinition done = store.complete(saga.sagaId(), Map.of("reserve-inventory", reservation));

        SagaDefinition loaded = store.findById(saga.sagaId()).orElseThrow();
        assertThat(loaded).isEqualTo(done);
        assertThat(loaded.status()).isEqualTo(SagaStatus.COMPLETED);
        assertThat(loaded.version()).isEqualTo(5);
        assertThat(loaded.retryCount()).isEqualTo(1);
        assertThat(loaded.step("reserve-inventory").orElseThrow().result()).isEqualTo(reservation);
        assertThat(loaded.result()).containsEntry("reserve-inventory", reservation);
    }

    @Test
    @DisplayName("A stale version is rejected")
    void optimisticLocking() {
        SagaDefinition saga = saved(null);
        jdbcTemplate.update("UPDATE sagas SET version = version + 1 WHERE saga_id = ?", saga.sagaId());

        assertThatThrownBy(() -> store.updateStatus(saga.sagaId(), SagaStatus.RUNNING))
            .isInstanceOf(ConcurrentSagaModificationException.class);
    }

    @Test
    @DisplayName("Updating an unknown saga fails with not found")
    void unknownSaga() {
        assertThatThrownBy(() -> store.updateStatus("missing", SagaStatus.RUNNING))
            .isInstanceOf(SagaNotFoundException.class);
    }

    @Test
    @DisplayName("Queries filter by status and staleness")
    void queries() {
        SagaDefinition stale = saved(null);
        store.updateStatus(stale.sagaId(), SagaStatus.RUNNING);
        time.advanceMinutes(10);
        SagaDefinition fresh = saved(null);
        store.updateStatus(fresh.sagaId(), SagaStatus.RUNNING);
        SagaDefinition failed = saved(null);
        store.updateStatus(failed.sagaId(), SagaStatus.RUNNING);
        store.updateStatus(failed.sagaId(), SagaStatus.FAILED, "carrier unavailable");

        assertThat(store.findByStatus(SagaStatus.RUNNING))
            .extracting(SagaDefinition::sagaId)
            .containsExactly(stale.sagaId(), fresh.sagaId());
        assertThat(store.findByStatus(SagaStatus.FAILED, 10))
            .singleElement()
            .satisfies(s -> assertThat(s.error()).isEqualTo("carrier unavailable"));
        assertThat(store.findStaleRunning(time.instant().minus(Duration.ofMinutes(5)), 10))
            .extracting(SagaDefinition::sagaId)
            .containsExactly(stale.sagaId());
        assertThat(store.countByStatus())
            .containsEntry(SagaStatus.RUNNING, 2L)
            .containsEntry(SagaStatus.FAILED, 1L)
            .containsEntry(SagaStatus.COMPLETED, 0L);
    }

    @Test
    @DisplayName("Retention deletes finished sagas only")
    void retention() {
        SagaDefinition failed = saved(null);
        store.updateStatus(failed.sagaId(), SagaStatus.RUNNING);
        store.updateStatus(failed.sagaId(), SagaStatus.FAILED, "boom");
        SagaDefinition pending = saved(null);
        time.advance(Duration.ofDays(8));

        assertThat(store.deleteFinishedBefore(time.instant().minus(Duration.ofDays(7)))).isEqualTo(1);
        assertThat(store.findById(failed.sagaId())).isEmpty();
        assertThat(store.findById(pending.sagaId())).isPresent();
    }
}
