package com.algotrendy.gateway.broker;

import com.algotrendy.gateway.order.Order;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Uniform async interface over one exchange's trading API.
 *
 * Every network-bound operation validates the session first ({@code NotConnectedException},
 * thrown synchronously) and passes through the broker's {@link RateLimitedConnector}.
 * Transport failures complete the future with {@code BrokerUnavailableException};
 * the gateway never retries.
 */
public interface BrokerGateway {

    String brokerName();

    ConnectionState state();

    /**
     * Open the session. Completes with true when connected; a failed attempt returns
     * the gateway to DISCONNECTED and completes with false.
     */
    CompletableFuture<Boolean> connect();

    void disconnect();

    /**
     * Submit an order that already carries a client order id.
     *
     * @throws IllegalArgumentException if the client order id is missing
     */
    CompletableFuture<BrokerOrderAck> placeOrder(Order order);

    CompletableFuture<BrokerOrderAck> cancelOrder(String exchangeOrderId, String symbol);

    CompletableFuture<BrokerOrderAck> getOrderStatus(String exchangeOrderId, String symbol);

    CompletableFuture<BigDecimal> getBalance(String currency);

    CompletableFuture<List<Position>> getPositions();

    CompletableFuture<BigDecimal> getMarketPrice(String symbol);

    default boolean isConnected() {
        return state() == ConnectionState.CONNECTED;
    }
}
