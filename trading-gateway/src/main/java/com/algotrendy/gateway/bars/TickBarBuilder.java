package com.algotrendy.gateway.bars;

import com.algotrendy.gateway.exception.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Builds tick bars: each bar holds exactly {@code tickSize} ticks (100, 500, 1000, ...).
 *
 * Buy/sell pressure is tracked per bar; a tick with unknown side counts as a sell.
 */
public final class TickBarBuilder implements BarAggregator<TickBar> {
    private static final Logger logger = LoggerFactory.getLogger(TickBarBuilder.class);

    private final String symbol;
    private final int tickSize;
    private final String source;

    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private BigDecimal volume;
    private BigDecimal quoteVolume;
    private int buyTicks;
    private int sellTicks;
    private BigDecimal buyVolume;
    private BigDecimal sellVolume;
    private int tickCount;
    private Instant firstTickTime;
    private Instant lastTickTime;

    public TickBarBuilder(String symbol, int tickSize, String source) {
        if (symbol == null || symbol.isBlank()) {
            throw new InvalidConfigurationException("Symbol cannot be empty");
        }
        if (tickSize <= 0) {
            throw new InvalidConfigurationException("Tick size must be greater than 0: " + tickSize);
        }
        if (source == null || source.isBlank()) {
            throw new InvalidConfigurationException("Source cannot be empty");
        }
        this.symbol = symbol;
        this.tickSize = tickSize;
        this.source = source;
        reset();
    }

    @Override
    public String symbol() {
        return symbol;
    }

    public int tickSize() {
        return tickSize;
    }

    /**
     * Add one trade print. Ticks for another symbol are ignored.
     *
     * @return the completed bar when this was the {@code tickSize}-th tick
     */
    public Optional<TickBar> addTick(Tick tick) {
        if (!symbol.equals(tick.symbol())) {
            logger.warn("Tick symbol {} does not match builder symbol {}", tick.symbol(), symbol);
            return Optional.empty();
        }
        return accumulate(tick.price(), tick.quantity(), tick.quoteVolume(), tick.timestamp(), tick.marketBuy());
    }

    @Override
    public List<TickBar> processPrice(BigDecimal price, BigDecimal volume, BigDecimal quoteVolume,
                                      Instant timestamp, Boolean isBuy) {
        return accumulate(price, volume, quoteVolume, timestamp, Boolean.TRUE.equals(isBuy))
            .map(List::of)
            .orElse(List.of());
    }

    private Optional<TickBar> accumulate(BigDecimal price, BigDecimal qty, BigDecimal quote,
                                         Instant timestamp, boolean marketBuy) {
        if (tickCount == 0) {
            open = price;
            high = price;
            low = price;
            firstTickTime = timestamp;
        } else {
            high = high.max(price);
            low = low.min(price);
        }
        close = price;
        lastTickTime = timestamp;

        volume = volume.add(qty);
        quoteVolume = quoteVolume.add(quote != null ? quote : BigDecimal.ZERO);

        if (marketBuy) {
            buyTicks++;
            buyVolume = buyVolume.add(qty);
        } else {
            sellTicks++;
            sellVolume = sellVolume.add(qty);
        }
        tickCount++;

        if (tickCount >= tickSize) {
            TickBar bar = buildBar();
            logger.debug("Tick bar completed for {}: {} ticks, close {}", symbol, tickCount, close);
            reset();
            return Optional.of(bar);
        }
        return Optional.empty();
    }

    /**
     * Flush a partial bar, e.g. at end of day or on shutdown.
     */
    @Override
    public Optional<TickBar> forceComplete() {
        if (tickCount == 0) {
            return Optional.empty();
        }
        TickBar bar = buildBar();
        reset();
        return Optional.of(bar);
    }

    private TickBar buildBar() {
        return new TickBar(symbol, firstTickTime, lastTickTime, open, high, low, close, volume, quoteVolume,
            source, tickSize, tickCount, buyTicks, sellTicks, buyVolume, sellVolume);
    }

    @Override
    public void reset() {
        open = null;
        high = null;
        low = null;
        close = null;
        volume = BigDecimal.ZERO;
        quoteVolume = BigDecimal.ZERO;
        buyTicks = 0;
        sellTicks = 0;
        buyVolume = BigDecimal.ZERO;
        sellVolume = BigDecimal.ZERO;
        tickCount = 0;
        firstTickTime = null;
        lastTickTime = null;
    }

    /**
     * Fill of the current bar, 0.0 to 1.0.
     */
    public double progress() {
        return tickCount / (double) tickSize;
    }

    public Stats currentStats() {
        return new Stats(tickCount, volume, buyVolume.subtract(sellVolume));
    }

    /**
     * Snapshot of the bar being built. {@code deltaVolume} is buy minus sell volume.
     */
    public record Stats(int tickCount, BigDecimal volume, BigDecimal deltaVolume) {
    }
}
