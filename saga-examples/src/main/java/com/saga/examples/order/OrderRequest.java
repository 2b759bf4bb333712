package com.saga.examples.order;

import java.math.BigDecimal;
import java.util.List;

/**
 * Payload of the order fulfillment saga.
 */
public record OrderRequest(
    String orderId,
    String customerId,
    List<Item> items,
    BigDecimal amount,
    String shippingAddress
) {
    public record Item(String sku, int quantity) {
    }
}
