package com.algotrendy.gateway.bars;

import com.algotrendy.gateway.channel.MarketData;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Streaming builder turning prices into bars for one symbol.
 *
 * Not thread-safe: exactly one thread may feed a builder (see {@link SymbolShardedAggregator}).
 * Volume is conserved: every unit of input volume ends up in exactly one emitted bar,
 * or is still pending in the builder.
 */
public interface BarAggregator<B extends Bar> {

    String symbol();

    /**
     * @param quoteVolume nullable, treated as zero
     * @param isBuy       aggressor side, null when unknown
     * @return bars completed by this price, possibly empty
     */
    List<B> processPrice(BigDecimal price, BigDecimal volume, BigDecimal quoteVolume, Instant timestamp, Boolean isBuy);

    /**
     * Feed a candle as Open, High, Low, Close. Open carries no volume; High, Low and Close
     * each carry a third, the last one absorbing the rounding remainder.
     */
    default List<B> processCandle(MarketData candle) {
        return CandleDecomposition.feed(candle, this);
    }

    /**
     * Emit the partial bar, if the bar type allows one.
     */
    Optional<B> forceComplete();

    void reset();
}
