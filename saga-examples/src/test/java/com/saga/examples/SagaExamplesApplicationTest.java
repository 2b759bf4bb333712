package com.saga.examples;

import com.saga.core.model.SagaDefinition;
import com.saga.core.model.SagaExecutionResult;
import com.saga.core.model.SagaStatus;
import com.saga.core.model.StepStatus;
import com.saga.engine.orchestrator.SagaService;
import com.saga.examples.order.OrderFulfillmentDemo;
import com.saga.examples.order.OrderFulfillmentHandlers;
import com.saga.examples.order.OrderFulfillmentSaga;
import com.saga.examples.order.OrderRequest;
import com.saga.recovery.SagaRecoveryService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * The example application wired end to end with the in-memory store.
 */
@SpringBootTest(properties = {
    "saga.examples.demo.enabled=false",
    "saga.engine.defaults.retry-delay=10ms"
})
class SagaExamplesApplicationTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Autowired
    private ApplicationContext context;

    @Autowired
    private SagaService sagaService;

    @Autowired
    private OrderFulfillmentHandlers handlers;

    @Autowired
    private MeterRegistry meterRegistry;

    @AfterEach
    void resetSimulation() {
        handlers.setCarrierAvailable(true);
        handlers.simulatePaymentTimeouts(0);
    }

    private JsonNode order(String orderId, String amount) {
        return mapper.valueToTree(new OrderRequest(orderId, "CUST-1",
            List.of(new OrderRequest.Item("SKU-1", 2)), new BigDecimal(amount), "221B Baker Street"));
    }

    @Test
    @DisplayName("Context wires the engine, recovery and the order saga")
    void contextLoads() {
        assertThat(context.getBeansOfType(OrderFulfillmentDemo.class)).isEmpty();
        assertThat(context.getBean(SagaRecoveryService.class).isRunning()).isTrue();
        assertThat(meterRegistry.find("saga.active").tag("application", "saga-examples").gauge()).isNotNull();
    }

    @Test
    @DisplayName("An order is reserved, charged and shipped")
    void fulfillsOrder() {
        SagaExecutionResult result = sagaService.execute(OrderFulfillmentSaga.SAGA_TYPE, order("ORD-1", "49.99"));

        assertThat(result.status()).isEqualTo(SagaStatus.COMPLETED);
        assertThat(result.completedSteps()).containsExactly(
            OrderFulfillmentSaga.RESERVE_INVENTORY, OrderFulfillmentSaga.CHARGE_PAYMENT, OrderFulfillmentSaga.SHIP_ORDER);
        assertThat(result.result().get(OrderFulfillmentSaga.SHIP_ORDER).get("trackingNumber").asText())
            .startsWith("TRK-");
        assertThat(result.result().get(OrderFulfillmentSaga.CHARGE_PAYMENT).get("amount").decimalValue())
            .isEqualByComparingTo("49.99");
    }

    @Test
    @DisplayName("A payment gateway timeout is retried")
    void retriesPayment() {
        handlers.simulatePaymentTimeouts(1);

        SagaExecutionResult result = sagaService.execute(OrderFulfillmentSaga.SAGA_TYPE, order("ORD-2", "20.00"));

        assertThat(result.isCompleted()).isTrue();
        SagaDefinition saga = sagaService.getSagaStatus(result.sagaId()).orElseThrow();
        assertThat(saga.retryCount()).isEqualTo(1);
        assertThat(saga.step(OrderFulfillmentSaga.CHARGE_PAYMENT).orElseThrow().attempts()).isEqualTo(2);
    }

    @Test
    @DisplayName("Carrier outage refunds the payment and releases the reservation")
    void compensatesOnCarrierOutage() {
        int reservations = handlers.activeReservations();
        int charges = handlers.activeCharges();
        handlers.setCarrierAvailable(false);

        SagaExecutionResult result = sagaService.execute(OrderFulfillmentSaga.SAGA_TYPE, order("ORD-3", "75.00"));

        assertThat(result.status()).isEqualTo(SagaStatus.FAILED);
        assertThat(result.failedStep()).isEqualTo(OrderFulfillmentSaga.SHIP_ORDER);
        assertThat(result.error()).startsWith("CarrierUnavailable");
        assertThat(result.compensatedSteps()).containsExactly(
            OrderFulfillmentSaga.CHARGE_PAYMENT, OrderFulfillmentSaga.RESERVE_INVENTORY);
        assertThat(handlers.activeReservations()).isEqualTo(reservations);
        assertThat(handlers.activeCharges()).isEqualTo(charges);

        SagaDefinition saga = sagaService.getSagaStatus(result.sagaId()).orElseThrow();
        assertThat(saga.step(OrderFulfillmentSaga.RESERVE_INVENTORY).orElseThrow().status())
            .isEqualTo(StepStatus.COMPENSATED);
        assertThat(sagaService.getFailedSagas()).extracting(SagaDefinition::sagaId).contains(result.sagaId());

        handlers.setCarrierAvailable(true);
        SagaExecutionResult retried = sagaService.retrySaga(result.sagaId());

        assertThat(retried.isCompleted()).isTrue();
        assertThat(sagaService.getSagaStatus(retried.sagaId()).orElseThrow().retriedFrom()).isEqualTo(result.sagaId());
    }

    @Test
    @DisplayName("A declined card is not retried")
    void declinedCard() {
        SagaExecutionResult result = sagaService.execute(OrderFulfillmentSaga.SAGA_TYPE, order("ORD-4", "25000"));

        assertThat(result.status()).isEqualTo(SagaStatus.FAILED);
        assertThat(result.failedStep()).isEqualTo(OrderFulfillmentSaga.CHARGE_PAYMENT);
        assertThat(result.compensatedSteps()).containsExactly(OrderFulfillmentSaga.RESERVE_INVENTORY);
        SagaDefinition saga = sagaService.getSagaStatus(result.sagaId()).orElseThrow();
        assertThat(saga.step(OrderFulfillmentSaga.CHARGE_PAYMENT).orElseThrow().attempts()).isEqualTo(1);
    }
}
