package com.algotrendy.gateway.persistence;

import com.algotrendy.gateway.exception.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.concurrent.locks.StampedLock;

/**
 * Base for the SQLite repositories: one connection per instance guarded by a StampedLock.
 *
 * Connections run in WAL mode with a busy timeout, so separate instances (or processes)
 * on the same file serialize their writes instead of failing with SQLITE_BUSY.
 * Decimals are stored as TEXT and instants as epoch milliseconds.
 */
abstract class SqliteDatabase implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SqliteDatabase.class);

    static final int BUSY_TIMEOUT_MS = 5000;

    protected final Connection connection;
    protected final StampedLock lock = new StampedLock();
    private final String dbPath;

    protected SqliteDatabase(String dbPath) {
        this.dbPath = dbPath;
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            try (var stmt = connection.createStatement()) {
                stmt.execute("PRAGMA busy_timeout = " + BUSY_TIMEOUT_MS);
                stmt.execute("PRAGMA journal_mode = WAL");
            }
            createTables();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to initialize database " + dbPath, e);
        }
    }

    protected abstract void createTables() throws SQLException;

    protected String dbPath() {
        return dbPath;
    }

    @Override
    public void close() {
        long stamp = lock.writeLock();
        try {
            if (!connection.isClosed()) {
                connection.close();
                logger.info("Database connection closed: {}", dbPath);
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to close database " + dbPath, e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    // ==================== COLUMN HELPERS ====================

    static void setDecimal(PreparedStatement stmt, int index, BigDecimal value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.VARCHAR);
        } else {
            stmt.setString(index, value.toPlainString());
        }
    }

    static void setInstant(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setLong(index, value.toEpochMilli());
        }
    }

    static BigDecimal getDecimal(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value == null ? null : new BigDecimal(value);
    }

    static Instant getInstant(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(value);
    }
}
