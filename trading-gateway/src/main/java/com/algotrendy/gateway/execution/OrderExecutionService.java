package com.algotrendy.gateway.execution;

import com.algotrendy.gateway.broker.BrokerGateway;
import com.algotrendy.gateway.broker.BrokerOrderAck;
import com.algotrendy.gateway.broker.BrokerRouter;
import com.algotrendy.gateway.exception.BrokerUnavailableException;
import com.algotrendy.gateway.exception.DuplicateOrderException;
import com.algotrendy.gateway.exception.OrderRejectedException;
import com.algotrendy.gateway.metrics.MetricsService;
import com.algotrendy.gateway.order.Order;
import com.algotrendy.gateway.order.OrderIdempotencyService;
import com.algotrendy.gateway.order.OrderRequest;
import com.algotrendy.gateway.order.OrderStatus;
import com.algotrendy.gateway.persistence.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs trading intents through idempotent creation and the matching broker.
 *
 * Features:
 * - A resubmitted client order id returns the stored order, the broker is not called again
 * - Unless the stored order never reached the broker: then it is sent again under the same id
 * - Venue rejections are persisted as REJECTED and returned
 * - Broker outages leave the order PENDING and propagate; retry with the same client order id
 * - Terminal orders are never transitioned again
 */
public class OrderExecutionService {
    private static final Logger logger = LoggerFactory.getLogger(OrderExecutionService.class);

    private final OrderIdempotencyService idempotencyService;
    private final OrderRepository repository;
    private final BrokerRouter router;
    private final MetricsService metrics;

    public OrderExecutionService(OrderIdempotencyService idempotencyService, OrderRepository repository,
                                 BrokerRouter router, MetricsService metrics) {
        this.idempotencyService = idempotencyService;
        this.repository = repository;
        this.router = router;
        this.metrics = metrics;
    }

    /**
     * Create the order and send it to its exchange.
     *
     * @return the persisted order after the broker's answer, or the already stored order
     *         for a duplicate client order id
     * @throws BrokerUnavailableException if the broker could not be reached; the order stays PENDING
     * @throws IllegalArgumentException for an exchange without a gateway, before anything is stored
     */
    public Order submit(OrderRequest request) {
        BrokerGateway gateway = router.route(request.exchange());

        Order order;
        try {
            order = idempotencyService.createOrder(request);
        } catch (DuplicateOrderException e) {
            Order existing = e.getExistingOrder();
            if (!isUnsent(existing)) {
                metrics.incrementDuplicateOrders(request.exchange());
                logger.info("🔁 Duplicate submission of {}, returning stored order {} ({})",
                    e.getClientOrderId(), existing.orderId(), existing.status());
                return existing;
            }
            // The venue dedupes on the client order id, so resending cannot fill twice
            logger.info("🔁 Resending {} to {}, never acknowledged", existing.clientOrderId(), existing.exchange());
            order = existing;
            gateway = router.route(existing.exchange());
        }

        try {
            BrokerOrderAck ack = await(gateway.placeOrder(order));
            Order acknowledged = repository.update(order.withAcknowledgment(ack, now()));
            metrics.incrementOrdersSubmitted(order.exchange(), order.side().name().toLowerCase(Locale.ROOT));
            logger.atInfo()
                .addKeyValue("clientOrderId", acknowledged.clientOrderId())
                .addKeyValue("exchangeOrderId", acknowledged.exchangeOrderId())
                .addKeyValue("status", acknowledged.status())
                .log("📤 Order submitted to {}: {} {} {}", order.exchange(), order.side(),
                    order.quantity().toPlainString(), order.symbol());
            return acknowledged;
        } catch (OrderRejectedException e) {
            metrics.incrementOrdersRejected(order.exchange(), order.type().name());
            logger.warn("❌ Order {} rejected by {}: {}", order.clientOrderId(), order.exchange(), e.getReason());
            return repository.update(order.withStatus(OrderStatus.REJECTED, now()));
        } catch (BrokerUnavailableException e) {
            logger.error("Order {} not submitted, {} unavailable: {}", order.clientOrderId(), order.exchange(),
                e.getMessage());
            throw e;
        }
    }

    private static boolean isUnsent(Order order) {
        return order.status() == OrderStatus.PENDING && order.exchangeOrderId() == null;
    }

    public Order cancel(String orderId) {
        return transition(orderId, "cancel",
            (gateway, order) -> gateway.cancelOrder(order.exchangeOrderId(), order.symbol()));
    }

    public Order refreshStatus(String orderId) {
        return transition(orderId, "status refresh",
            (gateway, order) -> gateway.getOrderStatus(order.exchangeOrderId(), order.symbol()));
    }

    private Order transition(String orderId, String action, BrokerCall call) {
        Order order = repository.findById(orderId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown order: " + orderId));
        if (order.status().isTerminal()) {
            logger.info("Order {} already {}, skipping {}", orderId, order.status(), action);
            return order;
        }
        if (order.exchangeOrderId() == null) {
            throw new IllegalStateException("Order " + orderId + " was never acknowledged by " + order.exchange());
        }

        BrokerOrderAck ack = await(call.apply(router.route(order.exchange()), order));
        Order updated = repository.update(clampFill(order, ack));
        logger.info("Order {} {}: {} -> {}", orderId, action, order.status(), updated.status());
        return updated;
    }

    private static Order clampFill(Order order, BrokerOrderAck ack) {
        if (ack.filledQuantity() != null && ack.filledQuantity().compareTo(order.quantity()) > 0) {
            logger.warn("Broker reported fill {} above quantity {} for {}, capping",
                ack.filledQuantity(), order.quantity(), order.orderId());
            ack = new BrokerOrderAck(ack.clientOrderId(), ack.exchangeOrderId(), ack.status(),
                order.quantity(), ack.averageFillPrice(), ack.acknowledgedAt());
        }
        return order.withAcknowledgment(ack, now());
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    @FunctionalInterface
    private interface BrokerCall {
        CompletableFuture<BrokerOrderAck> apply(BrokerGateway gateway, Order order);
    }
}
