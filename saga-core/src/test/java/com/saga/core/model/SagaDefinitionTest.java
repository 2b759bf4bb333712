package com.saga.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.saga.core.exception.InvalidSagaStateException;
import com.saga.core.exception.SagaNotFoundException;
import com.saga.core.json.SagaJson;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SagaDefinitionTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
    private static final JsonNode PAYLOAD = JsonNodeFactory.instance.objectNode().put("orderId", "o-1");

    private SagaDefinition newSaga() {
        return SagaDefinition.create(
            "order-fulfillment",
            List.of(
                StepRecord.pending("reserve", "inventory", NOW),
                StepRecord.pending("charge", "payment", NOW)
            ),
            PAYLOAD,
            3,
            null,
            NOW
        );
    }

    @Test
    void create_shouldStartPendingWithPendingSteps() {
        SagaDefinition saga = newSaga();

        assertNotNull(saga.sagaId());
        assertEquals(SagaStatus.PENDING, saga.status());
        assertEquals(0, saga.retryCount());
        assertEquals(0L, saga.version());
        assertNull(saga.result());
        assertTrue(saga.steps().stream().allMatch(s -> s.status() == StepStatus.PENDING));
    }

    @Test
    void create_shouldGenerateDistinctIds() {
        assertNotEquals(newSaga().sagaId(), newSaga().sagaId());
    }

    @Test
    void withStatus_shouldIncrementVersionAndRefreshTimestamp() {
        Instant later = NOW.plusSeconds(5);
        SagaDefinition running = newSaga().withStatus(SagaStatus.RUNNING, null, later);

        assertEquals(SagaStatus.RUNNING, running.status());
        assertEquals(1L, running.version());
        assertEquals(later, running.updatedAt());
        assertEquals(NOW, running.createdAt());
    }

    @Test
    void withStatus_shouldRejectSkippingRunning() {
        assertThrows(InvalidSagaStateException.class,
            () -> newSaga().withStatus(SagaStatus.COMPLETED, null, NOW));
    }

    @Test
    void withStepStatus_shouldOnlyTouchNamedStep() {
        SagaDefinition saga = newSaga().withStepStatus("charge", StepStatus.RUNNING, null, null, NOW);

        assertEquals(StepStatus.PENDING, saga.step("reserve").orElseThrow().status());
        assertEquals(StepStatus.RUNNING, saga.step("charge").orElseThrow().status());
    }

    @Test
    void withStepStatus_unknownStep_shouldThrowNotFound() {
        assertThrows(SagaNotFoundException.class,
            () -> newSaga().withStepStatus("ship", StepStatus.RUNNING, null, null, NOW));
    }

    @Test
    void withStepStatus_duplicateNames_shouldAdvanceEachRecordInTurn() {
        SagaDefinition saga = SagaDefinition.create(
            "notifications",
            List.of(StepRecord.pending("notify", null, NOW), StepRecord.pending("notify", null, NOW)),
            PAYLOAD, 0, null, NOW);

        saga = saga.withStepStatus("notify", StepStatus.RUNNING, null, null, NOW)
            .withStepStatus("notify", StepStatus.COMPLETED, JsonNodeFactory.instance.numberNode(1), null, NOW)
            .withStepStatus("notify", StepStatus.RUNNING, null, null, NOW)
            .withStepStatus("notify", StepStatus.COMPLETED, JsonNodeFactory.instance.numberNode(2), null, NOW);

        assertEquals(1, saga.steps().get(0).result().asInt());
        assertEquals(2, saga.steps().get(1).result().asInt());
        assertEquals(List.of("notify", "notify"), saga.completedStepNames());
    }

    @Test
    void withCompleted_shouldStoreResultsAndClearError() {
        var output = JsonNodeFactory.instance.textNode("r-1");
        SagaDefinition saga = newSaga()
            .withStatus(SagaStatus.RUNNING, null, NOW)
            .withCompleted(Map.of("reserve", output), NOW);

        assertEquals(SagaStatus.COMPLETED, saga.status());
        assertEquals(output, saga.result().get("reserve"));
        assertNull(saga.error());
        assertTrue(saga.isTerminal());
    }

    @Test
    void completedStepNames_shouldFollowStepOrder() {
        SagaDefinition saga = newSaga()
            .withStepStatus("reserve", StepStatus.RUNNING, null, null, NOW)
            .withStepStatus("reserve", StepStatus.COMPLETED, null, null, NOW)
            .withStepStatus("charge", StepStatus.RUNNING, null, null, NOW)
            .withStepStatus("charge", StepStatus.COMPLETED, null, null, NOW);

        assertEquals(List.of("reserve", "charge"), saga.completedStepNames());
    }

    @Test
    void json_shouldRoundTripThroughDocumentForm() throws Exception {
        ObjectMapper mapper = SagaJson.defaultMapper();
        SagaDefinition saga = newSaga()
            .withStatus(SagaStatus.RUNNING, null, NOW)
            .withStepStatus("reserve", StepStatus.RUNNING, null, null, NOW);

        String json = mapper.writeValueAsString(saga);
        SagaDefinition restored = mapper.readValue(json, SagaDefinition.class);

        assertEquals(saga, restored);
        assertFalse(json.contains("\"terminal\""));
    }
}
