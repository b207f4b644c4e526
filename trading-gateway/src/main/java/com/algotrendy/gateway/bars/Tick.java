package com.algotrendy.gateway.bars;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * One trade print.
 *
 * @param marketBuy true when the aggressor bought
 * @param tradeId   venue trade id, nullable
 */
public record Tick(
    String symbol,
    BigDecimal price,
    BigDecimal quantity,
    BigDecimal quoteVolume,
    Instant timestamp,
    boolean marketBuy,
    String tradeId
) {

    public Tick {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(quantity, "quantity");
        Objects.requireNonNull(timestamp, "timestamp");
        if (quoteVolume == null) {
            quoteVolume = price.multiply(quantity);
        }
    }

    public static Tick of(String symbol, BigDecimal price, BigDecimal quantity, Instant timestamp, boolean marketBuy) {
        return new Tick(symbol, price, quantity, null, timestamp, marketBuy, null);
    }
}
