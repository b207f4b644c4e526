package com.algotrendy.gateway.order;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * Caller's intent to trade. {@code clientOrderId} may be null, in which case one is generated;
 * resubmitting the same request with the same id is safe.
 */
public record OrderRequest(
    String clientOrderId,
    @NotBlank(message = "Symbol is required") String symbol,
    @NotBlank(message = "Exchange is required") String exchange,
    @NotNull(message = "Side is required") OrderSide side,
    @NotNull(message = "Order type is required") OrderType type,
    @NotNull(message = "Quantity is required") @Positive(message = "Quantity must be positive") BigDecimal quantity,
    @Positive(message = "Price must be positive") BigDecimal price,
    @Positive(message = "Stop price must be positive") BigDecimal stopPrice,
    String strategyId,
    String metadata
) {

    public static OrderRequest market(String symbol, String exchange, OrderSide side, BigDecimal quantity) {
        return new OrderRequest(null, symbol, exchange, side, OrderType.MARKET, quantity, null, null, null, null);
    }

    public static OrderRequest limit(String symbol, String exchange, OrderSide side,
                                     BigDecimal quantity, BigDecimal price) {
        return new OrderRequest(null, symbol, exchange, side, OrderType.LIMIT, quantity, price, null, null, null);
    }

    public OrderRequest withClientOrderId(String id) {
        return new OrderRequest(id, symbol, exchange, side, type, quantity, price, stopPrice, strategyId, metadata);
    }

    public OrderRequest withStrategy(String strategy) {
        return new OrderRequest(clientOrderId, symbol, exchange, side, type, quantity, price, stopPrice, strategy, metadata);
    }

    @AssertTrue(message = "Limit orders require a price")
    public boolean isPricePresentWhenRequired() {
        return type == null || !type.requiresPrice() || price != null;
    }

    @AssertTrue(message = "Stop orders require a stop price")
    public boolean isStopPricePresentWhenRequired() {
        return type == null || !type.requiresStopPrice() || stopPrice != null;
    }
}
