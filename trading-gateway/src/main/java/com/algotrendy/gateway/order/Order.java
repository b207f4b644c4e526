package com.algotrendy.gateway.order;

import com.algotrendy.gateway.broker.BrokerOrderAck;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * An order as persisted by the gateway.
 *
 * Transitions produce a new instance; the order id, client order id and creation time
 * never change. {@code filledQuantity} stays within {@code [0, quantity]}.
 */
public record Order(
    String orderId,
    String clientOrderId,
    String exchangeOrderId,
    String symbol,
    String exchange,
    OrderSide side,
    OrderType type,
    OrderStatus status,
    BigDecimal quantity,
    BigDecimal filledQuantity,
    BigDecimal price,
    BigDecimal stopPrice,
    BigDecimal averageFillPrice,
    String strategyId,
    Instant createdAt,
    Instant updatedAt,
    Instant submittedAt,
    Instant closedAt,
    String metadata
) {

    public Order {
        Objects.requireNonNull(orderId, "orderId");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(exchange, "exchange");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(quantity, "quantity");
        Objects.requireNonNull(createdAt, "createdAt");
        if (filledQuantity == null) {
            filledQuantity = BigDecimal.ZERO;
        }
        if (quantity.signum() <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
        if (filledQuantity.signum() < 0 || filledQuantity.compareTo(quantity) > 0) {
            throw new IllegalArgumentException(
                "Filled quantity " + filledQuantity + " outside [0, " + quantity + "]");
        }
    }

    public boolean hasClientOrderId() {
        return clientOrderId != null && !clientOrderId.isBlank();
    }

    public boolean isActive() {
        return !status.isTerminal();
    }

    public BigDecimal remainingQuantity() {
        return quantity.subtract(filledQuantity);
    }

    public Order withClientOrderId(String newClientOrderId) {
        return new Order(orderId, newClientOrderId, exchangeOrderId, symbol, exchange, side, type, status,
            quantity, filledQuantity, price, stopPrice, averageFillPrice, strategyId,
            createdAt, updatedAt, submittedAt, closedAt, metadata);
    }

    public Order withStatus(OrderStatus newStatus, Instant now) {
        return new Order(orderId, clientOrderId, exchangeOrderId, symbol, exchange, side, type, newStatus,
            quantity, filledQuantity, price, stopPrice, averageFillPrice, strategyId,
            createdAt, now, submittedAt, newStatus.isTerminal() ? now : closedAt, metadata);
    }

    /**
     * Fold a broker acknowledgment or status report into this order.
     */
    public Order withAcknowledgment(BrokerOrderAck ack, Instant now) {
        String newExchangeId = ack.exchangeOrderId() != null ? ack.exchangeOrderId() : exchangeOrderId;
        BigDecimal newFilled = ack.filledQuantity() != null ? ack.filledQuantity() : filledQuantity;
        BigDecimal newAvg = ack.averageFillPrice() != null ? ack.averageFillPrice() : averageFillPrice;
        Instant newSubmitted = submittedAt != null ? submittedAt : now;
        Instant newClosed = ack.status().isTerminal() ? now : closedAt;
        return new Order(orderId, clientOrderId, newExchangeId, symbol, exchange, side, type, ack.status(),
            quantity, newFilled, price, stopPrice, newAvg, strategyId,
            createdAt, now, newSubmitted, newClosed, metadata);
    }
}
