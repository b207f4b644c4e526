package com.algotrendy.gateway.persistence;

import com.algotrendy.gateway.exception.DuplicateOrderException;
import com.algotrendy.gateway.exception.PersistenceException;
import com.algotrendy.gateway.order.Order;
import com.algotrendy.gateway.order.OrderSide;
import com.algotrendy.gateway.order.OrderStatus;
import com.algotrendy.gateway.order.OrderType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteErrorCode;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite order store.
 *
 * The UNIQUE index on {@code client_order_id} is what makes order creation idempotent:
 * a second insert with the same id fails inside SQLite, whichever connection or process
 * it comes from, and is reported as {@link DuplicateOrderException} with the winning row.
 */
public final class SqliteOrderRepository extends SqliteDatabase implements OrderRepository {
    private static final Logger logger = LoggerFactory.getLogger(SqliteOrderRepository.class);

    private static final String COLUMNS = """
        order_id, client_order_id, exchange_order_id, symbol, exchange, side, type, status,
        quantity, filled_quantity, price, stop_price, average_fill_price, strategy_id,
        created_at, updated_at, submitted_at, closed_at, metadata
        """;

    public SqliteOrderRepository(String dbPath) {
        super(dbPath);
        logger.info("Order repository initialized: {}", dbPath);
    }

    @Override
    protected void createTables() throws SQLException {
        String createSql = """
            CREATE TABLE IF NOT EXISTS orders (
                order_id TEXT PRIMARY KEY,
                client_order_id TEXT NOT NULL,
                exchange_order_id TEXT,
                symbol TEXT NOT NULL,
                exchange TEXT NOT NULL,
                side TEXT NOT NULL,
                type TEXT NOT NULL,
                status TEXT NOT NULL,
                quantity TEXT NOT NULL CHECK (CAST(quantity AS REAL) > 0),
                filled_quantity TEXT NOT NULL DEFAULT '0'
                    CHECK (CAST(filled_quantity AS REAL) >= 0
                       AND CAST(filled_quantity AS REAL) <= CAST(quantity AS REAL)),
                price TEXT,
                stop_price TEXT,
                average_fill_price TEXT,
                strategy_id TEXT,
                created_at INTEGER NOT NULL,
                updated_at INTEGER,
                submitted_at INTEGER,
                closed_at INTEGER,
                metadata TEXT
            )
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.createStatement()) {
            stmt.execute(createSql);
            stmt.execute("CREATE UNIQUE INDEX IF NOT EXISTS idx_orders_client_order_id ON orders(client_order_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_orders_exchange_order_id ON orders(exchange_order_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_orders_symbol_created ON orders(symbol, created_at)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_orders_status ON orders(status)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_orders_strategy ON orders(strategy_id)");
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    // ==================== WRITES ====================

    @Override
    public Order insert(Order order) {
        if (!order.hasClientOrderId()) {
            throw new IllegalArgumentException("Order " + order.orderId() + " has no client order id");
        }
        String sql = "INSERT INTO orders (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement(sql)) {
            bindAll(stmt, order);
            stmt.executeUpdate();

            logger.atInfo()
                .addKeyValue("orderId", order.orderId())
                .addKeyValue("clientOrderId", order.clientOrderId())
                .addKeyValue("symbol", order.symbol())
                .addKeyValue("exchange", order.exchange())
                .log("Order recorded");
            return order;
        } catch (SQLException e) {
            if (!isClientOrderIdConflict(e)) {
                logger.error("Failed to record order {}", order.clientOrderId(), e);
                throw new PersistenceException("Order insert failed", e);
            }
        } finally {
            lock.unlockWrite(stamp);
        }

        // Lost the race: report the row that won
        Order existing = findByClientOrderId(order.clientOrderId())
            .orElseThrow(() -> new PersistenceException(
                "Client order id " + order.clientOrderId() + " conflicted but no row was found", null));
        logger.warn("⚠️ Duplicate client order id {} (existing order {})", order.clientOrderId(), existing.orderId());
        throw new DuplicateOrderException(existing);
    }

    private static boolean isClientOrderIdConflict(SQLException e) {
        String message = e.getMessage();
        // Extended result codes keep the primary code in the low byte
        return (e.getErrorCode() & 0xFF) == SQLiteErrorCode.SQLITE_CONSTRAINT.code
            && message != null && message.contains("UNIQUE") && message.contains("client_order_id");
    }

    @Override
    public Order update(Order order) {
        String sql = """
            UPDATE orders SET exchange_order_id = ?, status = ?, filled_quantity = ?, average_fill_price = ?,
                updated_at = ?, submitted_at = ?, closed_at = ?, metadata = ?
            WHERE order_id = ?
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, order.exchangeOrderId());
            stmt.setString(2, order.status().name());
            setDecimal(stmt, 3, order.filledQuantity());
            setDecimal(stmt, 4, order.averageFillPrice());
            setInstant(stmt, 5, order.updatedAt());
            setInstant(stmt, 6, order.submittedAt());
            setInstant(stmt, 7, order.closedAt());
            stmt.setString(8, order.metadata());
            stmt.setString(9, order.orderId());
            if (stmt.executeUpdate() == 0) {
                throw new IllegalArgumentException("Unknown order " + order.orderId());
            }
            logger.atDebug()
                .addKeyValue("orderId", order.orderId())
                .addKeyValue("status", order.status())
                .log("Order updated");
            return order;
        } catch (SQLException e) {
            logger.error("Failed to update order {}", order.orderId(), e);
            throw new PersistenceException("Order update failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    // ==================== READS ====================

    @Override
    public Optional<Order> findById(String orderId) {
        return queryOne("SELECT " + COLUMNS + " FROM orders WHERE order_id = ?", orderId);
    }

    @Override
    public Optional<Order> findByClientOrderId(String clientOrderId) {
        return queryOne("SELECT " + COLUMNS + " FROM orders WHERE client_order_id = ?", clientOrderId);
    }

    @Override
    public Optional<Order> findByExchangeOrderId(String exchangeOrderId) {
        return queryOne("SELECT " + COLUMNS + " FROM orders WHERE exchange_order_id = ?", exchangeOrderId);
    }

    @Override
    public List<Order> findBySymbol(String symbol, int limit) {
        return query("SELECT " + COLUMNS + " FROM orders WHERE symbol = ? ORDER BY created_at DESC LIMIT ?",
            symbol, limit);
    }

    @Override
    public List<Order> findActive() {
        return query("SELECT " + COLUMNS + " FROM orders WHERE status IN ('PENDING', 'OPEN', 'PARTIALLY_FILLED')"
            + " ORDER BY created_at ASC");
    }

    @Override
    public List<Order> findByStatus(OrderStatus status, int limit) {
        return query("SELECT " + COLUMNS + " FROM orders WHERE status = ? ORDER BY created_at DESC LIMIT ?",
            status.name(), limit);
    }

    @Override
    public List<Order> findByTimeRange(Instant from, Instant to) {
        return query("SELECT " + COLUMNS + " FROM orders WHERE created_at >= ? AND created_at < ? ORDER BY created_at ASC",
            from.toEpochMilli(), to.toEpochMilli());
    }

    @Override
    public List<Order> findByStrategy(String strategyId, int limit) {
        return query("SELECT " + COLUMNS + " FROM orders WHERE strategy_id = ? ORDER BY created_at DESC LIMIT ?",
            strategyId, limit);
    }

    private Optional<Order> queryOne(String sql, Object param) {
        List<Order> rows = query(sql, param);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private List<Order> query(String sql, Object... params) {
        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            List<Order> orders = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    orders.add(mapRow(rs));
                }
            }
            return orders;
        } catch (SQLException e) {
            logger.error("Order query failed: {}", e.getMessage());
            throw new PersistenceException("Order query failed", e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    // ==================== MAPPING ====================

    private static void bindAll(PreparedStatement stmt, Order order) throws SQLException {
        stmt.setString(1, order.orderId());
        stmt.setString(2, order.clientOrderId());
        stmt.setString(3, order.exchangeOrderId());
        stmt.setString(4, order.symbol());
        stmt.setString(5, order.exchange());
        stmt.setString(6, order.side().name());
        stmt.setString(7, order.type().name());
        stmt.setString(8, order.status().name());
        setDecimal(stmt, 9, order.quantity());
        setDecimal(stmt, 10, order.filledQuantity());
        setDecimal(stmt, 11, order.price());
        setDecimal(stmt, 12, order.stopPrice());
        setDecimal(stmt, 13, order.averageFillPrice());
        stmt.setString(14, order.strategyId());
        setInstant(stmt, 15, order.createdAt());
        setInstant(stmt, 16, order.updatedAt());
        setInstant(stmt, 17, order.submittedAt());
        setInstant(stmt, 18, order.closedAt());
        stmt.setString(19, order.metadata());
    }

    private static Order mapRow(ResultSet rs) throws SQLException {
        return new Order(
            rs.getString("order_id"),
            rs.getString("client_order_id"),
            rs.getString("exchange_order_id"),
            rs.getString("symbol"),
            rs.getString("exchange"),
            OrderSide.valueOf(rs.getString("side")),
            OrderType.valueOf(rs.getString("type")),
            OrderStatus.valueOf(rs.getString("status")),
            getDecimal(rs, "quantity"),
            getDecimal(rs, "filled_quantity"),
            getDecimal(rs, "price"),
            getDecimal(rs, "stop_price"),
            getDecimal(rs, "average_fill_price"),
            rs.getString("strategy_id"),
            getInstant(rs, "created_at"),
            getInstant(rs, "updated_at"),
            getInstant(rs, "submitted_at"),
            getInstant(rs, "closed_at"),
            rs.getString("metadata")
        );
    }
}
