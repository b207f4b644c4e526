package com.algotrendy.gateway.support;

import com.algotrendy.gateway.order.Order;
import com.algotrendy.gateway.order.OrderSide;
import com.algotrendy.gateway.order.OrderStatus;
import com.algotrendy.gateway.order.OrderType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Order fixtures.
 */
public final class TestOrders {

    private TestOrders() {
    }

    public static Order pending(String clientOrderId, String symbol, String exchange,
                                OrderSide side, OrderType type, String quantity, String price) {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        return new Order(UUID.randomUUID().toString(), clientOrderId, null, symbol, exchange, side, type,
            OrderStatus.PENDING, new BigDecimal(quantity), BigDecimal.ZERO,
            price == null ? null : new BigDecimal(price), null, null, "test-strategy",
            now, now, null, null, null);
    }

    public static Order market(String clientOrderId, String symbol, String exchange, OrderSide side, String quantity) {
        return pending(clientOrderId, symbol, exchange, side, OrderType.MARKET, quantity, null);
    }

    public static Order limit(String clientOrderId, String symbol, String exchange, OrderSide side,
                              String quantity, String price) {
        return pending(clientOrderId, symbol, exchange, side, OrderType.LIMIT, quantity, price);
    }
}
