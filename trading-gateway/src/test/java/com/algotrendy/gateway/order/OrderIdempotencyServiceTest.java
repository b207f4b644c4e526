package com.algotrendy.gateway.order;

import com.algotrendy.gateway.exception.DuplicateOrderException;
import com.algotrendy.gateway.exception.InvalidConfigurationException;
import com.algotrendy.gateway.persistence.SqliteOrderRepository;
import com.algotrendy.gateway.support.TestOrders;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("OrderIdempotencyService Tests")
class OrderIdempotencyServiceTest {

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    @TempDir
    Path tempDir;

    private SqliteOrderRepository repository;
    private OrderIdempotencyService service;

    @BeforeAll
    static void setUpValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @BeforeEach
    void setUp() {
        repository = new SqliteOrderRepository(dbPath());
        service = new OrderIdempotencyService(repository, "AT", validator);
    }

    @AfterEach
    void tearDown() {
        repository.close();
    }

    private String dbPath() {
        return tempDir.resolve("orders.db").toString();
    }

    private static OrderRequest btcMarket() {
        return OrderRequest.market("BTC/USD", "kraken", OrderSide.BUY, new BigDecimal("0.01"));
    }

    @Nested
    @DisplayName("Client Order Ids")
    class ClientOrderIds {

        @Test
        @DisplayName("Should generate prefixed ids with millis and 32 hex chars")
        void shouldGenerateIds() {
            String id = service.generateClientOrderId();

            assertThat(id).matches("AT_\\d{13}_[0-9a-f]{32}");
            assertThat(service.isValidClientOrderId(id)).isTrue();
            assertThat(service.generateClientOrderId()).isNotEqualTo(id);
        }

        @Test
        @DisplayName("Should recognize only ids in the generated format")
        void shouldValidateIds() {
            assertThat(service.isValidClientOrderId(null)).isFalse();
            assertThat(service.isValidClientOrderId("XX_1700000000000_0123456789abcdef0123456789abcdef")).isFalse();
            assertThat(service.isValidClientOrderId("AT_170000000000_0123456789abcdef0123456789abcdef")).isFalse();
            assertThat(service.isValidClientOrderId("AT_1700000000000_0123456789ABCDEF0123456789ABCDEF")).isFalse();
            assertThat(service.isValidClientOrderId("AT_1700000000000_0123456789abcdef0123456789abcdef")).isTrue();
        }

        @Test
        @DisplayName("Should assign an id only when missing")
        void shouldEnsureClientOrderId() {
            Order withId = TestOrders.market("AT_1700000000000_0123456789abcdef0123456789abcdef",
                "BTC/USD", "kraken", OrderSide.BUY, "1");
            Order withoutId = TestOrders.market(null, "BTC/USD", "kraken", OrderSide.BUY, "1");

            assertThat(service.ensureClientOrderId(withId)).isSameAs(withId);
            Order assigned = service.ensureClientOrderId(withoutId);
            assertThat(service.isValidClientOrderId(assigned.clientOrderId())).isTrue();
            assertThat(assigned.orderId()).isEqualTo(withoutId.orderId());
        }

        @Test
        @DisplayName("Should reject a non-alphanumeric prefix")
        void shouldRejectBadPrefix() {
            assertThatThrownBy(() -> new OrderIdempotencyService(repository, "A_T", validator))
                .isInstanceOf(InvalidConfigurationException.class);
            assertThatThrownBy(() -> new OrderIdempotencyService(repository, "", validator))
                .isInstanceOf(InvalidConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Order Creation")
    class OrderCreation {

        @Test
        @DisplayName("Should persist a pending order with a generated id")
        void shouldCreatePendingOrder() {
            Order order = service.createOrder(btcMarket().withStrategy("momentum"));

            assertThat(order.status()).isEqualTo(OrderStatus.PENDING);
            assertThat(order.filledQuantity()).isEqualByComparingTo("0");
            assertThat(order.strategyId()).isEqualTo("momentum");
            assertThat(service.isValidClientOrderId(order.clientOrderId())).isTrue();
            assertThat(service.findByClientOrderId(order.clientOrderId())).contains(order);
        }

        @Test
        @DisplayName("Should keep the caller's client order id")
        void shouldKeepCallerId() {
            Order order = service.createOrder(btcMarket().withClientOrderId("my-order-1"));

            assertThat(order.clientOrderId()).isEqualTo("my-order-1");
        }

        @Test
        @DisplayName("Should return the stored order when an id is resubmitted")
        void shouldDetectResubmission() {
            OrderRequest request = btcMarket().withClientOrderId(service.generateClientOrderId());
            Order first = service.createOrder(request);

            assertThatThrownBy(() -> service.createOrder(request))
                .isInstanceOfSatisfying(DuplicateOrderException.class,
                    e -> assertThat(e.getExistingOrder()).isEqualTo(first));
        }

        @Test
        @DisplayName("Should list every violation of an invalid request")
        void shouldRejectInvalidRequest() {
            OrderRequest invalid = new OrderRequest(null, " ", "kraken", OrderSide.BUY, OrderType.LIMIT,
                new BigDecimal("-1"), null, null, null, null);

            assertThatThrownBy(() -> service.createOrder(invalid))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid order request: ")
                .hasMessageContaining("Limit orders require a price")
                .hasMessageContaining("Quantity must be positive")
                .hasMessageContaining("Symbol is required");
            assertThat(repository.findActive()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("Should persist one order when the same id races from many threads")
        void shouldAllowSingleWinner() throws Exception {
            OrderRequest request = btcMarket().withClientOrderId(service.generateClientOrderId());
            int threads = 10;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Order>> results = new ArrayList<>();
            try {
                for (int i = 0; i < threads; i++) {
                    results.add(pool.submit(() -> {
                        start.await();
                        try {
                            return service.createOrder(request);
                        } catch (DuplicateOrderException e) {
                            return e.getExistingOrder();
                        }
                    }));
                }
                start.countDown();

                List<String> orderIds = new ArrayList<>();
                for (Future<Order> result : results) {
                    orderIds.add(result.get(10, TimeUnit.SECONDS).orderId());
                }
                assertThat(orderIds).hasSize(threads).containsOnly(orderIds.get(0));
                assertThat(repository.findActive()).hasSize(1);
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("Should enforce uniqueness across repository instances on one file")
        void shouldEnforceAcrossInstances() {
            OrderRequest request = btcMarket().withClientOrderId(service.generateClientOrderId());
            Order first = service.createOrder(request);

            try (var otherRepository = new SqliteOrderRepository(dbPath())) {
                var otherService = new OrderIdempotencyService(otherRepository, "AT", validator);
                assertThatThrownBy(() -> otherService.createOrder(request))
                    .isInstanceOfSatisfying(DuplicateOrderException.class,
                        e -> assertThat(e.getExistingOrder().orderId()).isEqualTo(first.orderId()));
            }
        }
    }
}
