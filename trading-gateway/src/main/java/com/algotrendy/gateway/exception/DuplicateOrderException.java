package com.algotrendy.gateway.exception;

import com.algotrendy.gateway.order.Order;

/**
 * An order with the same client order id is already persisted.
 *
 * <p>Callers treat this as success-equivalent: the intended order exists and
 * {@link #getExistingOrder()} is that single persisted row. It must not be retried
 * with a new id.
 */
public class DuplicateOrderException extends GatewayException {

    private final transient Order existingOrder;

    public DuplicateOrderException(Order existingOrder) {
        super("Order with client order id " + existingOrder.clientOrderId()
            + " already exists as " + existingOrder.orderId());
        this.existingOrder = existingOrder;
    }

    public Order getExistingOrder() {
        return existingOrder;
    }

    public String getClientOrderId() {
        return existingOrder.clientOrderId();
    }
}
