package com.algotrendy.gateway.persistence;

import com.algotrendy.gateway.channel.MarketData;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Candle store keyed by (symbol, exchange, timestamp). Re-inserting a key replaces the row.
 */
public interface MarketDataRepository extends AutoCloseable {

    void insert(MarketData data);

    /**
     * Upsert all records in one transaction.
     *
     * @return number of records written
     */
    int insertBatch(List<MarketData> records);

    /**
     * Candles for a symbol across exchanges in {@code [from, to]}, oldest first.
     */
    List<MarketData> findBySymbol(String symbol, Instant from, Instant to);

    Optional<MarketData> findLatest(String symbol, String exchange);

    /**
     * Most recent candle per symbol, any exchange. Symbols without data are absent.
     */
    Map<String, MarketData> findLatestBatch(Collection<String> symbols);

    boolean exists(String symbol, String exchange, Instant timestamp);

    @Override
    void close();
}
