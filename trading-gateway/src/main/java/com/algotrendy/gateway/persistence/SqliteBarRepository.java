package com.algotrendy.gateway.persistence;

import com.algotrendy.gateway.bars.Bar;
import com.algotrendy.gateway.bars.BarType;
import com.algotrendy.gateway.exception.PersistenceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * SQLite bar store ({@code bars}). OHLCV columns are shared by every bar type;
 * whatever else a bar carries is kept as a JSON document in {@code details}.
 */
public final class SqliteBarRepository extends SqliteDatabase implements BarRepository {
    private static final Logger logger = LoggerFactory.getLogger(SqliteBarRepository.class);

    private static final List<String> COMMON_FIELDS = List.of(
        "symbol", "timestamp", "open", "high", "low", "close", "volume", "quoteVolume", "source");

    private static final String UPSERT_SQL = """
        INSERT OR REPLACE INTO bars
            (symbol, bar_type, source, timestamp, open, high, low, close, volume, quote_volume, details)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private final ObjectMapper mapper;

    public SqliteBarRepository(String dbPath) {
        super(dbPath);
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        logger.info("Bar repository initialized: {}", dbPath);
    }

    @Override
    protected void createTables() throws SQLException {
        String createSql = """
            CREATE TABLE IF NOT EXISTS bars (
                symbol TEXT NOT NULL,
                bar_type TEXT NOT NULL,
                source TEXT NOT NULL,
                timestamp INTEGER NOT NULL,
                open TEXT NOT NULL,
                high TEXT NOT NULL,
                low TEXT NOT NULL,
                close TEXT NOT NULL,
                volume TEXT NOT NULL,
                quote_volume TEXT,
                details TEXT,
                PRIMARY KEY (symbol, bar_type, source, timestamp)
            )
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.createStatement()) {
            stmt.execute(createSql);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_bars_symbol_type_time ON bars(symbol, bar_type, timestamp)");
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public int save(List<? extends Bar> bars) {
        if (bars.isEmpty()) {
            return 0;
        }
        long stamp = lock.writeLock();
        try {
            connection.setAutoCommit(false);
            try (var stmt = connection.prepareStatement(UPSERT_SQL)) {
                for (Bar bar : bars) {
                    stmt.setString(1, bar.symbol());
                    stmt.setString(2, bar.barType().name());
                    stmt.setString(3, bar.source());
                    setInstant(stmt, 4, bar.timestamp());
                    setDecimal(stmt, 5, bar.open());
                    setDecimal(stmt, 6, bar.high());
                    setDecimal(stmt, 7, bar.low());
                    setDecimal(stmt, 8, bar.close());
                    setDecimal(stmt, 9, bar.volume());
                    setDecimal(stmt, 10, bar.quoteVolume());
                    stmt.setString(11, details(bar));
                    stmt.addBatch();
                }
                stmt.executeBatch();
                connection.commit();
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
            logger.debug("Saved {} {} bars", bars.size(), bars.get(0).barType());
            return bars.size();
        } catch (SQLException e) {
            logger.error("Failed to save {} bars: {}", bars.size(), e.getMessage());
            throw new PersistenceException("Bar insert failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    private String details(Bar bar) {
        ObjectNode node = mapper.valueToTree(bar);
        node.remove(COMMON_FIELDS);
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Cannot serialize " + bar.barType() + " bar for " + bar.symbol(), e);
        }
    }

    @Override
    public List<StoredBar> findRecent(String symbol, BarType barType, int limit) {
        String sql = "SELECT * FROM bars WHERE symbol = ? AND bar_type = ? ORDER BY timestamp DESC LIMIT ?";
        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, symbol);
            stmt.setString(2, barType.name());
            stmt.setInt(3, limit);
            List<StoredBar> rows = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapRow(rs));
                }
            }
            return rows;
        } catch (SQLException e) {
            logger.error("Bar query failed: {}", e.getMessage());
            throw new PersistenceException("Bar query failed", e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    private StoredBar mapRow(ResultSet rs) throws SQLException {
        String details = rs.getString("details");
        try {
            return new StoredBar(
                rs.getString("symbol"),
                BarType.valueOf(rs.getString("bar_type")),
                rs.getString("source"),
                getInstant(rs, "timestamp"),
                getDecimal(rs, "open"),
                getDecimal(rs, "high"),
                getDecimal(rs, "low"),
                getDecimal(rs, "close"),
                getDecimal(rs, "volume"),
                getDecimal(rs, "quote_volume"),
                details == null ? mapper.createObjectNode() : mapper.readTree(details)
            );
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt bar details for " + rs.getString("symbol"), e);
        }
    }
}
