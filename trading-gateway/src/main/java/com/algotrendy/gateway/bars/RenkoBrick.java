package com.algotrendy.gateway.bars;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One Renko brick, exactly {@code brickSize} wide. High and low are the brick ends.
 *
 * @param sourceDataPoints prices folded in since the previous brick; 0 for the later bricks of a jump
 * @param sizingMethod     "Fixed", "ATR(13)", "Percentage(1%)", ...
 */
public record RenkoBrick(
    String symbol,
    Instant timestamp,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume,
    BigDecimal quoteVolume,
    String source,
    BigDecimal brickSize,
    boolean upBrick,
    boolean reversal,
    int sourceDataPoints,
    String sizingMethod
) implements Bar {

    @Override
    public BarType barType() {
        return BarType.RENKO;
    }
}
