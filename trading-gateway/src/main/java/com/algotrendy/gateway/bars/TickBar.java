package com.algotrendy.gateway.bars;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Bar closed after a fixed number of ticks.
 *
 * @param tickCount ticks actually folded in; below {@code tickSize} only for a force-completed bar
 */
public record TickBar(
    String symbol,
    Instant openTime,
    Instant timestamp,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume,
    BigDecimal quoteVolume,
    String source,
    int tickSize,
    int tickCount,
    int buyTicks,
    int sellTicks,
    BigDecimal buyVolume,
    BigDecimal sellVolume
) implements Bar {

    @Override
    public BarType barType() {
        return BarType.TICK;
    }

    public BigDecimal deltaVolume() {
        return buyVolume.subtract(sellVolume);
    }
}
