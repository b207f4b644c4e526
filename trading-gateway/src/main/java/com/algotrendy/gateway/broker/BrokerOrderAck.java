package com.algotrendy.gateway.broker;

import com.algotrendy.gateway.order.OrderStatus;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Exchange acknowledgment or status report for one order.
 *
 * @param filledQuantity   null when the venue did not report fills
 * @param averageFillPrice null when unknown
 */
public record BrokerOrderAck(
    String clientOrderId,
    String exchangeOrderId,
    OrderStatus status,
    BigDecimal filledQuantity,
    BigDecimal averageFillPrice,
    Instant acknowledgedAt
) {

    public static BrokerOrderAck accepted(String clientOrderId, String exchangeOrderId, OrderStatus status) {
        return new BrokerOrderAck(clientOrderId, exchangeOrderId, status, null, null, Instant.now());
    }
}
