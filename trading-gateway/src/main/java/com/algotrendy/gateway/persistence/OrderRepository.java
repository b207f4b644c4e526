package com.algotrendy.gateway.persistence;

import com.algotrendy.gateway.order.Order;
import com.algotrendy.gateway.order.OrderStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable order store. Orders are never deleted.
 */
public interface OrderRepository extends AutoCloseable {

    /**
     * Insert a new order. The client order id is unique across every writer of the store.
     *
     * @throws com.algotrendy.gateway.exception.DuplicateOrderException carrying the persisted row
     *         when the client order id already exists
     */
    Order insert(Order order);

    /**
     * Overwrite the mutable fields of an existing order.
     *
     * @throws IllegalArgumentException if the order does not exist
     */
    Order update(Order order);

    Optional<Order> findById(String orderId);

    Optional<Order> findByClientOrderId(String clientOrderId);

    Optional<Order> findByExchangeOrderId(String exchangeOrderId);

    List<Order> findBySymbol(String symbol, int limit);

    /**
     * Orders in PENDING, OPEN or PARTIALLY_FILLED, oldest first.
     */
    List<Order> findActive();

    List<Order> findByStatus(OrderStatus status, int limit);

    /**
     * Orders created in {@code [from, to)}, oldest first.
     */
    List<Order> findByTimeRange(Instant from, Instant to);

    List<Order> findByStrategy(String strategyId, int limit);

    @Override
    void close();
}
