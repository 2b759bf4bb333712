package com.saga.core.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.saga.core.json.SagaJson;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SagaContextTest {

    record Reservation(String reservationId, int quantity) {
    }

    private final ObjectMapper mapper = SagaJson.defaultMapper();

    @Test
    void previousResults_shouldBeReadOnlySnapshot() {
        Map<String, JsonNode> results = new LinkedHashMap<>();
        results.put("reserve", mapper.valueToTree(new Reservation("r-1", 2)));

        SagaContext context = new SagaContext("s-1", "order", "charge", 1, results, null, mapper);
        results.put("late", mapper.nullNode());

        assertEquals(1, context.getPreviousResults().size());
        assertThrows(UnsupportedOperationException.class,
            () -> context.getPreviousResults().put("x", mapper.nullNode()));
    }

    @Test
    void getPreviousResult_shouldConvertToType() {
        SagaContext context = new SagaContext("s-1", "order", "charge", 1,
            Map.of("reserve", mapper.valueToTree(new Reservation("r-1", 2))), Map.of(), mapper);

        assertEquals(new Reservation("r-1", 2), context.getPreviousResult("reserve", Reservation.class).orElseThrow());
        assertTrue(context.getPreviousResult("ship").isEmpty());
    }

    @Test
    void forStep_shouldRebindCurrentStepOnly() {
        SagaContext context = new SagaContext("s-1", "order", "ship", 1,
            Map.of(), Map.of("tenant", "acme"), mapper);

        SagaContext rebound = context.forStep("reserve");

        assertEquals("reserve", rebound.getCurrentStep());
        assertEquals("s-1", rebound.getSagaId());
        assertEquals("acme", rebound.getMetadata().get("tenant"));
        assertEquals("s-1:reserve", rebound.getIdempotencyKey());
    }

    @Test
    void stepHandlers_of_shouldDelegateBothDirections() throws Exception {
        StringBuilder calls = new StringBuilder();
        StepHandler handler = StepHandlers.of(
            (payload, ctx) -> {
                calls.append("execute;");
                return ctx.toJsonNode(Map.of("ok", true));
            },
            (payload, ctx) -> calls.append("compensate;")
        );
        SagaContext context = new SagaContext("s-1", "order", "reserve", 1, Map.of(), Map.of(), mapper);

        JsonNode result = handler.execute(mapper.createObjectNode(), context);
        handler.compensate(mapper.createObjectNode(), context);

        assertTrue(result.get("ok").asBoolean());
        assertEquals("execute;compensate;", calls.toString());
    }

    @Test
    void stepException_permanent_shouldNotBeRetryable() {
        assertFalse(StepException.permanent("CARD_DECLINED", "declined").isRetryable());
        assertTrue(StepException.transientFailure("GATEWAY_DOWN", "down").isRetryable());
        assertEquals("Step charge timeout",
            new StepTimeoutException("charge", java.time.Duration.ofMillis(50)).getMessage());
    }
}
