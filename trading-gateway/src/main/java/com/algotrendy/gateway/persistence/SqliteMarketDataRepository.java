package com.algotrendy.gateway.persistence;

import com.algotrendy.gateway.channel.MarketData;
import com.algotrendy.gateway.exception.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SQLite candle store ({@code market_data_1m}).
 */
public final class SqliteMarketDataRepository extends SqliteDatabase implements MarketDataRepository {
    private static final Logger logger = LoggerFactory.getLogger(SqliteMarketDataRepository.class);

    private static final String UPSERT_SQL = """
        INSERT OR REPLACE INTO market_data_1m
            (symbol, exchange, timestamp, open, high, low, close, volume, quote_volume, trades_count, metadata)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    public SqliteMarketDataRepository(String dbPath) {
        super(dbPath);
        logger.info("Market data repository initialized: {}", dbPath);
    }

    @Override
    protected void createTables() throws SQLException {
        String createSql = """
            CREATE TABLE IF NOT EXISTS market_data_1m (
                symbol TEXT NOT NULL,
                exchange TEXT NOT NULL,
                timestamp INTEGER NOT NULL,
                open TEXT NOT NULL,
                high TEXT NOT NULL,
                low TEXT NOT NULL,
                close TEXT NOT NULL,
                volume TEXT NOT NULL,
                quote_volume TEXT,
                trades_count INTEGER,
                metadata TEXT,
                PRIMARY KEY (symbol, exchange, timestamp)
            )
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.createStatement()) {
            stmt.execute(createSql);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_market_data_symbol_time ON market_data_1m(symbol, timestamp)");
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public void insert(MarketData data) {
        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement(UPSERT_SQL)) {
            bind(stmt, data);
            stmt.executeUpdate();
        } catch (SQLException e) {
            logger.error("Failed to save candle {} {}", data.exchange(), data.symbol(), e);
            throw new PersistenceException("Market data insert failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public int insertBatch(List<MarketData> records) {
        if (records.isEmpty()) {
            return 0;
        }
        long stamp = lock.writeLock();
        try {
            connection.setAutoCommit(false);
            try (var stmt = connection.prepareStatement(UPSERT_SQL)) {
                for (MarketData data : records) {
                    bind(stmt, data);
                    stmt.addBatch();
                }
                stmt.executeBatch();
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
            logger.debug("Saved {} candles", records.size());
            return records.size();
        } catch (SQLException e) {
            logger.error("Failed to save batch of {} candles: {}", records.size(), e.getMessage());
            throw new PersistenceException("Market data batch insert failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public List<MarketData> findBySymbol(String symbol, Instant from, Instant to) {
        return query("SELECT * FROM market_data_1m WHERE symbol = ? AND timestamp >= ? AND timestamp <= ?"
            + " ORDER BY timestamp ASC", symbol, from.toEpochMilli(), to.toEpochMilli());
    }

    @Override
    public Optional<MarketData> findLatest(String symbol, String exchange) {
        List<MarketData> rows = query("SELECT * FROM market_data_1m WHERE symbol = ? AND exchange = ?"
            + " ORDER BY timestamp DESC LIMIT 1", symbol, exchange);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public Map<String, MarketData> findLatestBatch(Collection<String> symbols) {
        Map<String, MarketData> latest = new LinkedHashMap<>();
        for (String symbol : symbols) {
            List<MarketData> rows = query("SELECT * FROM market_data_1m WHERE symbol = ?"
                + " ORDER BY timestamp DESC LIMIT 1", symbol);
            if (!rows.isEmpty()) {
                latest.put(symbol, rows.get(0));
            }
        }
        return latest;
    }

    @Override
    public boolean exists(String symbol, String exchange, Instant timestamp) {
        return !query("SELECT * FROM market_data_1m WHERE symbol = ? AND exchange = ? AND timestamp = ?",
            symbol, exchange, timestamp.toEpochMilli()).isEmpty();
    }

    private List<MarketData> query(String sql, Object... params) {
        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            List<MarketData> rows = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapRow(rs));
                }
            }
            return rows;
        } catch (SQLException e) {
            logger.error("Market data query failed: {}", e.getMessage());
            throw new PersistenceException("Market data query failed", e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    private static void bind(PreparedStatement stmt, MarketData data) throws SQLException {
        stmt.setString(1, data.symbol());
        stmt.setString(2, data.exchange());
        setInstant(stmt, 3, data.timestamp());
        setDecimal(stmt, 4, data.open());
        setDecimal(stmt, 5, data.high());
        setDecimal(stmt, 6, data.low());
        setDecimal(stmt, 7, data.close());
        setDecimal(stmt, 8, data.volume());
        setDecimal(stmt, 9, data.quoteVolume());
        if (data.tradesCount() == null) {
            stmt.setNull(10, Types.INTEGER);
        } else {
            stmt.setLong(10, data.tradesCount());
        }
        stmt.setString(11, data.metadataJson());
    }

    private static MarketData mapRow(ResultSet rs) throws SQLException {
        long trades = rs.getLong("trades_count");
        Long tradesCount = rs.wasNull() ? null : trades;
        return new MarketData(
            rs.getString("symbol"),
            rs.getString("exchange"),
            getInstant(rs, "timestamp"),
            getDecimal(rs, "open"),
            getDecimal(rs, "high"),
            getDecimal(rs, "low"),
            getDecimal(rs, "close"),
            getDecimal(rs, "volume"),
            getDecimal(rs, "quote_volume"),
            tradesCount,
            rs.getString("metadata")
        );
    }
}
