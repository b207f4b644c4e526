package com.algotrendy.gateway.bars;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A completed aggregated OHLCV unit. Immutable once emitted.
 */
public interface Bar {

    String symbol();

    /**
     * Close time of the bar (time of the last price folded in).
     */
    Instant timestamp();

    BigDecimal open();

    BigDecimal high();

    BigDecimal low();

    BigDecimal close();

    BigDecimal volume();

    BigDecimal quoteVolume();

    /**
     * Venue the prices came from.
     */
    String source();

    BarType barType();
}
