package com.saga.examples.order;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.saga.core.json.SagaJson;
import com.saga.core.model.SagaExecutionResult;
import com.saga.engine.orchestrator.SagaService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Demonstration runner for the order fulfillment saga.
 *
 * Shows:
 * 1. Normal successful execution
 * 2. Transient payment failure recovered by a step retry
 * 3. Carrier outage: compensation in reverse order
 * 4. Manual retry of the failed saga once the carrier is back
 */
@Component
@ConditionalOnProperty(prefix = "saga.examples.demo", name = "enabled", havingValue = "true")
public class OrderFulfillmentDemo implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(OrderFulfillmentDemo.class);
    private static final ObjectMapper mapper = SagaJson.defaultMapper();

    private final SagaService sagaService;
    private final OrderFulfillmentHandlers handlers;

    public OrderFulfillmentDemo(SagaService sagaService, OrderFulfillmentHandlers handlers) {
        this.sagaService = sagaService;
        this.handlers = handlers;
    }

    @Override
    public void run(String... args) {
        log.info("SCENARIO 1: Normal successful execution");
        report(sagaService.execute(OrderFulfillmentSaga.SAGA_TYPE, order("ORD-1001"), Map.of("channel", "web")));

        log.info("SCENARIO 2: Payment gateway timeout, retried");
        handlers.simulatePaymentTimeouts(1);
        report(sagaService.execute(OrderFulfillmentSaga.SAGA_TYPE, order("ORD-1002")));

        log.info("SCENARIO 3: Carrier unavailable, completed steps compensated");
        handlers.setCarrierAvailable(false);
        SagaExecutionResult failed = sagaService.execute(OrderFulfillmentSaga.SAGA_TYPE, order("ORD-1003"));
        report(failed);

        log.info("SCENARIO 4: Carrier back, failed saga retried as a new instance");
        handlers.setCarrierAvailable(true);
        report(sagaService.retrySaga(failed.sagaId()));

        log.info("Demo complete: {} failed sagas on record, {} open reservations, {} open charges",
            sagaService.getFailedSagas().size(), handlers.activeReservations(), handlers.activeCharges());
    }

    static JsonNode order(String orderId) {
        OrderRequest request = new OrderRequest(
            orderId,
            "CUST-42",
            List.of(new OrderRequest.Item("SKU-KEYBOARD", 1), new OrderRequest.Item("SKU-MOUSE", 2)),
            new BigDecimal("129.90"),
            "1 Market Street, Springfield"
        );
        return mapper.valueToTree(request);
    }

    private void report(SagaExecutionResult result) {
        if (result.isCompleted()) {
            log.info("Saga {} COMPLETED in {} ms, steps {}",
                result.sagaId(), result.duration().toMillis(), result.completedSteps());
        } else {
            log.info("Saga {} FAILED at {} ({}), compensated {}{}",
                result.sagaId(), result.failedStep(), result.error(), result.compensatedSteps(),
                result.isFullyCompensated() ? "" : ", manual cleanup required");
        }
    }
}
