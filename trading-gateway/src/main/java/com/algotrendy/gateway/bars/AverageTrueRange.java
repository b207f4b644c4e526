package com.algotrendy.gateway.bars;

import com.algotrendy.gateway.channel.MarketData;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Average True Range over candles given oldest first.
 *
 * TR = max(high - low, |high - previous close|, |low - previous close|);
 * ATR is the plain mean of the last {@code period} true ranges.
 */
public final class AverageTrueRange {

    public static final int DEFAULT_PERIOD = 13;
    private static final int SCALE = 8;

    private AverageTrueRange() {
    }

    /**
     * @throws IllegalArgumentException with fewer than {@code period + 1} candles
     */
    public static BigDecimal calculate(List<MarketData> candles, int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("ATR period must be positive: " + period);
        }
        if (candles.size() < period + 1) {
            throw new IllegalArgumentException(
                "Need at least " + (period + 1) + " candles to calculate ATR(" + period + "), got " + candles.size());
        }

        BigDecimal sum = BigDecimal.ZERO;
        for (int i = candles.size() - period; i < candles.size(); i++) {
            sum = sum.add(trueRange(candles.get(i), candles.get(i - 1)));
        }
        return sum.divide(BigDecimal.valueOf(period), SCALE, RoundingMode.HALF_EVEN);
    }

    static BigDecimal trueRange(MarketData current, MarketData previous) {
        BigDecimal highLow = current.high().subtract(current.low());
        BigDecimal highClose = current.high().subtract(previous.close()).abs();
        BigDecimal lowClose = current.low().subtract(previous.close()).abs();
        return highLow.max(highClose).max(lowClose);
    }
}
