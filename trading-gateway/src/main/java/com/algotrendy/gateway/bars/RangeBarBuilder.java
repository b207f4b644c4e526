package com.algotrendy.gateway.bars;

import com.algotrendy.gateway.channel.MarketData;
import com.algotrendy.gateway.exception.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Builds range bars: a bar closes as soon as its high-low range reaches the threshold,
 * whatever the time or tick count.
 *
 * Features:
 * - Fixed threshold or ATR-derived threshold ({@link #createAtr})
 * - Buy/sell volume when the aggressor side is known
 * - Candle input decomposed into O, H, L, C
 */
public final class RangeBarBuilder implements BarAggregator<RangeBar> {
    private static final Logger logger = LoggerFactory.getLogger(RangeBarBuilder.class);

    private final String symbol;
    private final BigDecimal rangeThreshold;
    private final String source;

    private boolean started;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private BigDecimal volume;
    private BigDecimal quoteVolume;
    private BigDecimal buyVolume;
    private BigDecimal sellVolume;
    private int tickCount;
    private Instant firstTime;
    private Instant lastTime;

    public RangeBarBuilder(String symbol, BigDecimal rangeThreshold, String source) {
        if (symbol == null || symbol.isBlank()) {
            throw new InvalidConfigurationException("Symbol cannot be empty");
        }
        if (rangeThreshold == null || rangeThreshold.signum() <= 0) {
            throw new InvalidConfigurationException("Range threshold must be greater than 0: " + rangeThreshold);
        }
        if (source == null || source.isBlank()) {
            throw new InvalidConfigurationException("Source cannot be empty");
        }
        this.symbol = symbol;
        this.rangeThreshold = rangeThreshold;
        this.source = source;
        reset();
    }

    public static RangeBarBuilder createAtr(String symbol, List<MarketData> candles, String source) {
        return createAtr(symbol, candles, source, AverageTrueRange.DEFAULT_PERIOD, BigDecimal.ONE);
    }

    /**
     * Threshold = ATR(period) x multiplier over the given history.
     */
    public static RangeBarBuilder createAtr(String symbol, List<MarketData> candles, String source,
                                            int period, BigDecimal multiplier) {
        BigDecimal threshold = AverageTrueRange.calculate(candles, period).multiply(multiplier);
        if (threshold.signum() <= 0) {
            throw new InvalidConfigurationException("Invalid range threshold " + threshold + " calculated for " + symbol);
        }
        logger.info("Created ATR-based range bar builder for {} with threshold {} (ATR{} x {})",
            symbol, threshold.toPlainString(), period, multiplier);
        return new RangeBarBuilder(symbol, threshold, source);
    }

    @Override
    public String symbol() {
        return symbol;
    }

    public BigDecimal rangeThreshold() {
        return rangeThreshold;
    }

    public Optional<RangeBar> addTick(Tick tick) {
        if (!symbol.equals(tick.symbol())) {
            logger.warn("Tick symbol {} does not match builder symbol {}", tick.symbol(), symbol);
            return Optional.empty();
        }
        List<RangeBar> bars = processPrice(tick.price(), tick.quantity(), tick.quoteVolume(),
            tick.timestamp(), tick.marketBuy());
        return bars.isEmpty() ? Optional.empty() : Optional.of(bars.get(0));
    }

    @Override
    public List<RangeBar> processPrice(BigDecimal price, BigDecimal qty, BigDecimal quote,
                                       Instant timestamp, Boolean isBuy) {
        if (!started) {
            open = price;
            high = price;
            low = price;
            firstTime = timestamp;
            started = true;
        } else {
            high = high.max(price);
            low = low.min(price);
        }
        close = price;
        lastTime = timestamp;

        volume = volume.add(qty);
        quoteVolume = quoteVolume.add(quote != null ? quote : BigDecimal.ZERO);
        tickCount++;

        if (isBuy != null) {
            if (isBuy) {
                buyVolume = buyVolume.add(qty);
            } else {
                sellVolume = sellVolume.add(qty);
            }
        }

        if (high.subtract(low).compareTo(rangeThreshold) >= 0) {
            RangeBar bar = buildBar();
            logger.debug("Range bar completed for {}: {} - {}", symbol, low, high);
            reset();
            return List.of(bar);
        }
        return List.of();
    }

    @Override
    public Optional<RangeBar> forceComplete() {
        if (!started) {
            return Optional.empty();
        }
        RangeBar bar = buildBar();
        reset();
        return Optional.of(bar);
    }

    private RangeBar buildBar() {
        return new RangeBar(symbol, lastTime, open, high, low, close, volume, quoteVolume, source,
            rangeThreshold, tickCount, Duration.between(firstTime, lastTime), buyVolume, sellVolume);
    }

    @Override
    public void reset() {
        started = false;
        open = null;
        high = null;
        low = null;
        close = null;
        volume = BigDecimal.ZERO;
        quoteVolume = BigDecimal.ZERO;
        buyVolume = BigDecimal.ZERO;
        sellVolume = BigDecimal.ZERO;
        tickCount = 0;
        firstTime = null;
        lastTime = null;
    }

    public BigDecimal currentRange() {
        return started ? high.subtract(low) : BigDecimal.ZERO;
    }

    /**
     * Current range over the threshold, capped at 1.0.
     */
    public double progress() {
        if (!started) {
            return 0.0;
        }
        return Math.min(currentRange().divide(rangeThreshold, MathContext.DECIMAL64).doubleValue(), 1.0);
    }

    public Stats currentStats() {
        return new Stats(currentRange(), tickCount, volume, buyVolume.subtract(sellVolume));
    }

    public record Stats(BigDecimal range, int tickCount, BigDecimal volume, BigDecimal deltaVolume) {
    }
}
