package com.saga.examples.order;

import com.fasterxml.jackson.databind.JsonNode;
import com.saga.core.handler.SagaContext;
import com.saga.core.handler.StepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simulated inventory, payment and shipping services for the order fulfillment saga.
 *
 * Every forward action is keyed by the step's idempotency key, so a retried step
 * returns the reservation or charge it already made instead of making another one.
 * Failures can be switched on to show retries and compensation.
 */
@Component
public class OrderFulfillmentHandlers {

    private static final Logger log = LoggerFactory.getLogger(OrderFulfillmentHandlers.class);

    static final BigDecimal CARD_LIMIT = new BigDecimal("10000");

    private final Map<String, String> reservations = new ConcurrentHashMap<>();
    private final Map<String, String> charges = new ConcurrentHashMap<>();
    private final Map<String, String> shipments = new ConcurrentHashMap<>();

    private final AtomicInteger paymentTimeoutsToSimulate = new AtomicInteger(0);
    private volatile boolean carrierAvailable = true;

    // ========== reserve-inventory ==========

    public JsonNode reserveInventory(JsonNode payload, SagaContext context) {
        OrderRequest order = context.convert(payload, OrderRequest.class);
        if (order.items() == null || order.items().isEmpty()) {
            throw new IllegalArgumentException("Order " + order.orderId() + " has no items");
        }

        String reservationId = reservations.computeIfAbsent(context.getIdempotencyKey(),
            key -> "RES-" + UUID.randomUUID().toString().substring(0, 12));
        log.info("Reserved {} items for order {} as {}", order.items().size(), order.orderId(), reservationId);

        return context.toJsonNode(Map.of(
            "reservationId", reservationId,
            "itemCount", order.items().size()));
    }

    public void releaseInventory(JsonNode payload, SagaContext context) {
        String reservationId = context.getPreviousResult(OrderFulfillmentSaga.RESERVE_INVENTORY)
            .map(r -> r.get("reservationId").asText())
            .orElseThrow(() -> new IllegalStateException("No reservation to release"));

        reservations.values().remove(reservationId);
        log.info("Released inventory reservation {}", reservationId);
    }

    // ========== charge-payment ==========

    public JsonNode chargePayment(JsonNode payload, SagaContext context) throws StepException {
        OrderRequest order = context.convert(payload, OrderRequest.class);

        if (order.amount().compareTo(CARD_LIMIT) > 0) {
            throw StepException.permanent("CARD_DECLINED",
                "Card declined for order " + order.orderId() + ": amount over limit");
        }
        if (paymentTimeoutsToSimulate.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            log.warn("SIMULATED FAILURE: payment gateway timeout (attempt {})", context.getAttempt());
            throw StepException.transientFailure("PAYMENT_GATEWAY_TIMEOUT", "Payment gateway timeout");
        }

        String chargeId = charges.computeIfAbsent(context.getIdempotencyKey(),
            key -> "CHG-" + UUID.randomUUID().toString().substring(0, 12));
        log.info("Charged {} to customer {} as {}", order.amount(), order.customerId(), chargeId);

        return context.toJsonNode(Map.of(
            "chargeId", chargeId,
            "amount", order.amount()));
    }

    public void refundPayment(JsonNode payload, SagaContext context) {
        String chargeId = context.getPreviousResult(OrderFulfillmentSaga.CHARGE_PAYMENT)
            .map(r -> r.get("chargeId").asText())
            .orElseThrow(() -> new IllegalStateException("No charge to refund"));

        charges.values().remove(chargeId);
        log.info("Refunded charge {}", chargeId);
    }

    // ========== ship-order ==========

    public JsonNode shipOrder(JsonNode payload, SagaContext context) throws StepException {
        OrderRequest order = context.convert(payload, OrderRequest.class);
        if (!carrierAvailable) {
            throw StepException.transientFailure("CARRIER_UNAVAILABLE",
                "CarrierUnavailable: no carrier accepted order " + order.orderId());
        }

        String trackingNumber = shipments.computeIfAbsent(context.getIdempotencyKey(),
            key -> "TRK-" + UUID.randomUUID().toString().substring(0, 10).toUpperCase());
        log.info("Shipped order {} to {} with tracking {}", order.orderId(), order.shippingAddress(), trackingNumber);

        return context.toJsonNode(Map.of("trackingNumber", trackingNumber));
    }

    // ========== Failure simulation ==========

    public void setCarrierAvailable(boolean carrierAvailable) {
        this.carrierAvailable = carrierAvailable;
    }

    public void simulatePaymentTimeouts(int count) {
        paymentTimeoutsToSimulate.set(count);
    }

    public int activeReservations() {
        return reservations.size();
    }

    public int activeCharges() {
        return charges.size();
    }
}
