package com.saga.examples.order;

import com.saga.core.handler.StepHandlers;
import com.saga.core.model.SagaRegistration;
import com.saga.core.model.StepDefinition;
import com.saga.engine.orchestrator.SagaService;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Order fulfillment: reserve stock, take payment, hand the parcel to a carrier.
 *
 * If shipping fails for good the payment is refunded and the reservation released,
 * in that order.
 */
@Component
public class OrderFulfillmentSaga implements InitializingBean {

    public static final String SAGA_TYPE = "order-fulfillment";

    public static final String RESERVE_INVENTORY = "reserve-inventory";
    public static final String CHARGE_PAYMENT = "charge-payment";
    public static final String SHIP_ORDER = "ship-order";

    private final SagaService sagaService;
    private final OrderFulfillmentHandlers handlers;

    public OrderFulfillmentSaga(SagaService sagaService, OrderFulfillmentHandlers handlers) {
        this.sagaService = sagaService;
        this.handlers = handlers;
    }

    @Override
    public void afterPropertiesSet() {
        sagaService.registerSaga(registration(handlers));
    }

    public static SagaRegistration registration(OrderFulfillmentHandlers handlers) {
        return SagaRegistration.builder(SAGA_TYPE)
            .step(StepDefinition.builder(RESERVE_INVENTORY,
                    StepHandlers.of(handlers::reserveInventory, handlers::releaseInventory))
                .service("inventory-service")
                .timeout(Duration.ofSeconds(5))
                .build())
            .step(StepDefinition.builder(CHARGE_PAYMENT,
                    StepHandlers.of(handlers::chargePayment, handlers::refundPayment))
                .service("payment-service")
                .maxRetries(2)
                .build())
            .step(StepDefinition.builder(SHIP_ORDER,
                    StepHandlers.withoutCompensation(handlers::shipOrder))
                .service("shipping-service")
                .maxRetries(1)
                .build())
            .withTimeout(Duration.ofSeconds(10))
            .build();
    }
}
