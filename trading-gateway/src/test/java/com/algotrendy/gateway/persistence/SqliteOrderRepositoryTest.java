package com.algotrendy.gateway.persistence;

import com.algotrendy.gateway.broker.BrokerOrderAck;
import com.algotrendy.gateway.exception.DuplicateOrderException;
import com.algotrendy.gateway.order.Order;
import com.algotrendy.gateway.order.OrderSide;
import com.algotrendy.gateway.order.OrderStatus;
import com.algotrendy.gateway.support.TestOrders;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SqliteOrderRepository Tests")
class SqliteOrderRepositoryTest {

    @TempDir
    Path tempDir;

    private SqliteOrderRepository repository;

    @BeforeEach
    void setUp() {
        repository = new SqliteOrderRepository(tempDir.resolve("orders.db").toString());
    }

    @AfterEach
    void tearDown() {
        repository.close();
    }

    private static String clientId(int n) {
        return "AT_1700000000000_%032d".formatted(n);
    }

    @Nested
    @DisplayName("Insert")
    class Insert {

        @Test
        @DisplayName("Should read back every field")
        void shouldRoundTripOrder() {
            Order order = TestOrders.limit(clientId(1), "BTC/USD", "kraken", OrderSide.BUY, "0.5", "50000.25");

            repository.insert(order);

            assertThat(repository.findById(order.orderId())).contains(order);
            assertThat(repository.findByClientOrderId(order.clientOrderId())).contains(order);
        }

        @Test
        @DisplayName("Should report the persisted row on a duplicate client order id")
        void shouldRejectDuplicateClientOrderId() {
            Order first = TestOrders.market(clientId(2), "BTC/USD", "kraken", OrderSide.BUY, "1");
            Order second = TestOrders.market(clientId(2), "ETH/USD", "kraken", OrderSide.SELL, "2");
            repository.insert(first);

            assertThatThrownBy(() -> repository.insert(second))
                .isInstanceOfSatisfying(DuplicateOrderException.class,
                    e -> assertThat(e.getExistingOrder()).isEqualTo(first));
            assertThat(repository.findById(second.orderId())).isEmpty();
        }

        @Test
        @DisplayName("Should detect duplicates written through another connection")
        void shouldDetectDuplicatesAcrossConnections() {
            Order first = TestOrders.market(clientId(3), "BTC/USD", "kraken", OrderSide.BUY, "1");
            repository.insert(first);

            try (var other = new SqliteOrderRepository(tempDir.resolve("orders.db").toString())) {
                Order retry = TestOrders.market(clientId(3), "BTC/USD", "kraken", OrderSide.BUY, "1");
                assertThatThrownBy(() -> other.insert(retry))
                    .isInstanceOfSatisfying(DuplicateOrderException.class,
                        e -> assertThat(e.getExistingOrder().orderId()).isEqualTo(first.orderId()));
            }
        }

        @Test
        @DisplayName("Should refuse orders without a client order id")
        void shouldRequireClientOrderId() {
            Order order = TestOrders.market(null, "BTC/USD", "kraken", OrderSide.BUY, "1");

            assertThatThrownBy(() -> repository.insert(order)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Update")
    class Update {

        @Test
        @DisplayName("Should store acknowledgment fields")
        void shouldUpdateOrder() {
            Order order = repository.insert(TestOrders.market(clientId(4), "BTC/USD", "kraken", OrderSide.BUY, "1"));
            Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
            BrokerOrderAck ack = new BrokerOrderAck(order.clientOrderId(), "OABC-123", OrderStatus.FILLED,
                new BigDecimal("1"), new BigDecimal("60000.5"), now);

            Order updated = repository.update(order.withAcknowledgment(ack, now));

            Order stored = repository.findById(order.orderId()).orElseThrow();
            assertThat(stored).isEqualTo(updated);
            assertThat(stored.status()).isEqualTo(OrderStatus.FILLED);
            assertThat(stored.closedAt()).isEqualTo(now);
            assertThat(repository.findByExchangeOrderId("OABC-123")).contains(updated);
        }

        @Test
        @DisplayName("Should fail for an unknown order")
        void shouldRejectUnknownOrder() {
            Order order = TestOrders.market(clientId(5), "BTC/USD", "kraken", OrderSide.BUY, "1");

            assertThatThrownBy(() -> repository.update(order))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown order");
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("Should list active orders only")
        void shouldFindActive() {
            Order open = repository.insert(TestOrders.market(clientId(6), "BTC/USD", "kraken", OrderSide.BUY, "1"));
            Order done = repository.insert(TestOrders.market(clientId(7), "BTC/USD", "kraken", OrderSide.BUY, "1"));
            repository.update(done.withStatus(OrderStatus.CANCELLED, Instant.now().truncatedTo(ChronoUnit.MILLIS)));

            assertThat(repository.findActive()).extracting(Order::orderId).containsExactly(open.orderId());
            assertThat(repository.findByStatus(OrderStatus.CANCELLED, 10)).extracting(Order::orderId)
                .containsExactly(done.orderId());
        }

        @Test
        @DisplayName("Should filter by symbol, strategy and time range")
        void shouldFilter() {
            Order btc = repository.insert(TestOrders.market(clientId(8), "BTC/USD", "kraken", OrderSide.BUY, "1"));
            repository.insert(TestOrders.market(clientId(9), "ETH/USD", "kraken", OrderSide.BUY, "1"));

            assertThat(repository.findBySymbol("BTC/USD", 10)).containsExactly(btc);
            assertThat(repository.findByStrategy("test-strategy", 10)).hasSize(2);
            assertThat(repository.findByStrategy("test-strategy", 1)).hasSize(1);
            assertThat(repository.findByTimeRange(btc.createdAt(), btc.createdAt().plusSeconds(60))).isNotEmpty();
            assertThat(repository.findByTimeRange(btc.createdAt().minusSeconds(60), btc.createdAt().minusSeconds(1)))
                .isEmpty();
        }
    }
}
