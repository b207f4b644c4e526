package com.algotrendy.gateway.bars;

import com.algotrendy.gateway.channel.MarketData;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a candle into the O, H, L, C price sequence with its volume spread over H, L and C.
 */
final class CandleDecomposition {

    private static final BigDecimal THREE = BigDecimal.valueOf(3);
    private static final int EXTRA_SCALE = 8;

    private CandleDecomposition() {
    }

    static <B extends Bar> List<B> feed(MarketData candle, BarAggregator<B> aggregator) {
        BigDecimal quote = candle.quoteVolume() != null ? candle.quoteVolume() : BigDecimal.ZERO;
        BigDecimal volumeThird = third(candle.volume());
        BigDecimal quoteThird = third(quote);
        BigDecimal volumeRest = candle.volume().subtract(volumeThird).subtract(volumeThird);
        BigDecimal quoteRest = quote.subtract(quoteThird).subtract(quoteThird);

        List<B> bars = new ArrayList<>();
        bars.addAll(aggregator.processPrice(candle.open(), BigDecimal.ZERO, BigDecimal.ZERO, candle.timestamp(), null));
        bars.addAll(aggregator.processPrice(candle.high(), volumeThird, quoteThird, candle.timestamp(), null));
        bars.addAll(aggregator.processPrice(candle.low(), volumeThird, quoteThird, candle.timestamp(), null));
        bars.addAll(aggregator.processPrice(candle.close(), volumeRest, quoteRest, candle.timestamp(), null));
        return bars;
    }

    static BigDecimal third(BigDecimal value) {
        return value.divide(THREE, Math.max(value.scale(), 0) + EXTRA_SCALE, RoundingMode.DOWN);
    }
}
