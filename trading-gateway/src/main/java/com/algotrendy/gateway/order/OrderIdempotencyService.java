package com.algotrendy.gateway.order;

import com.algotrendy.gateway.exception.DuplicateOrderException;
import com.algotrendy.gateway.exception.InvalidConfigurationException;
import com.algotrendy.gateway.persistence.OrderRepository;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * ORDER IDEMPOTENCY
 *
 * Every order gets a client order id before it reaches a broker, and at most one row
 * exists per id.
 *
 * Features:
 * - Ids of the form {@code {prefix}_{13-digit millis}_{32 hex}}
 * - Uniqueness enforced by the repository's unique index, so it holds across threads,
 *   repository instances and processes
 * - A resubmitted id yields {@link DuplicateOrderException} carrying the stored order
 */
public class OrderIdempotencyService {
    private static final Logger logger = LoggerFactory.getLogger(OrderIdempotencyService.class);

    private static final Pattern PREFIX_PATTERN = Pattern.compile("[A-Za-z0-9]+");
    private static final Pattern ID_SUFFIX_PATTERN = Pattern.compile("_\\d{13}_[0-9a-f]{32}");

    private final OrderRepository repository;
    private final String prefix;
    private final Validator validator;

    public OrderIdempotencyService(OrderRepository repository, String prefix, Validator validator) {
        if (prefix == null || !PREFIX_PATTERN.matcher(prefix).matches()) {
            throw new InvalidConfigurationException("Client order id prefix must be alphanumeric: " + prefix);
        }
        this.repository = repository;
        this.prefix = prefix;
        this.validator = validator;
    }

    // ==================== CLIENT ORDER IDS ====================

    public String generateClientOrderId() {
        String random = UUID.randomUUID().toString().replace("-", "");
        return prefix + "_" + System.currentTimeMillis() + "_" + random;
    }

    /**
     * True for ids this service could have generated with its prefix.
     */
    public boolean isValidClientOrderId(String clientOrderId) {
        if (clientOrderId == null || !clientOrderId.startsWith(prefix)) {
            return false;
        }
        return ID_SUFFIX_PATTERN.matcher(clientOrderId.substring(prefix.length())).matches();
    }

    /**
     * Same order if it already has an id, otherwise a copy with a fresh one.
     */
    public Order ensureClientOrderId(Order order) {
        if (order.hasClientOrderId()) {
            return order;
        }
        return order.withClientOrderId(generateClientOrderId());
    }

    // ==================== ORDER CREATION ====================

    /**
     * Validate the request and persist it as a PENDING order.
     *
     * @throws IllegalArgumentException if the request is invalid
     * @throws DuplicateOrderException  if an order with the request's client order id exists
     */
    public Order createOrder(OrderRequest request) {
        Set<ConstraintViolation<OrderRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String errors = violations.stream()
                .map(ConstraintViolation::getMessage)
                .sorted()
                .collect(Collectors.joining(", "));
            throw new IllegalArgumentException("Invalid order request: " + errors);
        }

        String clientOrderId = request.clientOrderId() != null && !request.clientOrderId().isBlank()
            ? request.clientOrderId()
            : generateClientOrderId();
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);

        Order order = new Order(
            UUID.randomUUID().toString(),
            clientOrderId,
            null,
            request.symbol(),
            request.exchange(),
            request.side(),
            request.type(),
            OrderStatus.PENDING,
            request.quantity(),
            BigDecimal.ZERO,
            request.price(),
            request.stopPrice(),
            null,
            request.strategyId(),
            now,
            now,
            null,
            null,
            request.metadata()
        );

        Order saved = repository.insert(order);
        logger.info("🆕 Order created: {} {} {} {} (client id {})",
            saved.side(), saved.quantity().toPlainString(), saved.symbol(), saved.exchange(), clientOrderId);
        return saved;
    }

    public Optional<Order> findByClientOrderId(String clientOrderId) {
        return repository.findByClientOrderId(clientOrderId);
    }
}
