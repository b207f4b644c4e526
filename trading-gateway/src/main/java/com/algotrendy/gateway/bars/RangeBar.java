package com.algotrendy.gateway.bars;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Bar closed once its high-low range reaches the threshold.
 */
public record RangeBar(
    String symbol,
    Instant timestamp,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume,
    BigDecimal quoteVolume,
    String source,
    BigDecimal rangeThreshold,
    int tickCount,
    Duration duration,
    BigDecimal buyVolume,
    BigDecimal sellVolume
) implements Bar {

    @Override
    public BarType barType() {
        return BarType.RANGE;
    }
}
