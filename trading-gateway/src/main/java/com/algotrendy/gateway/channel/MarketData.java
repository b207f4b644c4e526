package com.algotrendy.gateway.channel;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * One OHLCV candle from an exchange.
 *
 * @param quoteVolume  null when the venue does not report it
 * @param tradesCount  null when the venue does not report it
 * @param metadataJson free-form venue extras, nullable
 */
public record MarketData(
    String symbol,
    String exchange,
    Instant timestamp,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume,
    BigDecimal quoteVolume,
    Long tradesCount,
    String metadataJson
) {

    public MarketData {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(exchange, "exchange");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(open, "open");
        Objects.requireNonNull(high, "high");
        Objects.requireNonNull(low, "low");
        Objects.requireNonNull(close, "close");
        Objects.requireNonNull(volume, "volume");
    }

    public static MarketData of(String symbol, String exchange, Instant timestamp, BigDecimal open,
                                BigDecimal high, BigDecimal low, BigDecimal close, BigDecimal volume) {
        return new MarketData(symbol, exchange, timestamp, open, high, low, close, volume, null, null, null);
    }

    /**
     * {@code low <= open, close <= high}, positive low, non-negative volume.
     */
    public boolean isValid() {
        return low.signum() > 0
            && volume.signum() >= 0
            && low.compareTo(open) <= 0 && open.compareTo(high) <= 0
            && low.compareTo(close) <= 0 && close.compareTo(high) <= 0;
    }
}
