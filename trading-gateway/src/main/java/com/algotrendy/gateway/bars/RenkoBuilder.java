package com.algotrendy.gateway.bars;

import com.algotrendy.gateway.channel.MarketData;
import com.algotrendy.gateway.exception.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds Renko bricks of a fixed price size.
 *
 * Features:
 * - First price anchors the brick grid at the nearest brick multiple (half-even)
 * - One brick per brick size crossed, chained open-to-close
 * - Fixed, ATR or percentage sizing
 *
 * Volume folded in since the previous brick goes to the next brick; in a multi-brick
 * jump the first brick carries it and the rest carry zero. Renko has no partial brick,
 * so {@link #forceComplete()} never emits; pending volume stays visible in {@link #currentState()}.
 */
public final class RenkoBuilder implements BarAggregator<RenkoBrick> {
    private static final Logger logger = LoggerFactory.getLogger(RenkoBuilder.class);

    public static final String FIXED = "Fixed";
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final String symbol;
    private final BigDecimal brickSize;
    private final String source;
    private final String sizingMethod;

    private BigDecimal brickOpen;
    private BigDecimal highSinceBrick;
    private BigDecimal lowSinceBrick;
    private BigDecimal accumulatedVolume;
    private BigDecimal accumulatedQuoteVolume;
    private int dataPoints;
    private Instant lastTime;
    private boolean hasPriorBrick;
    private boolean lastBrickUp;

    public RenkoBuilder(String symbol, BigDecimal brickSize, String source, String sizingMethod) {
        if (symbol == null || symbol.isBlank()) {
            throw new InvalidConfigurationException("Symbol cannot be empty");
        }
        if (brickSize == null || brickSize.signum() <= 0) {
            throw new InvalidConfigurationException("Brick size must be greater than 0: " + brickSize);
        }
        if (source == null || source.isBlank()) {
            throw new InvalidConfigurationException("Source cannot be empty");
        }
        this.symbol = symbol;
        this.brickSize = brickSize;
        this.source = source;
        this.sizingMethod = sizingMethod;
        reset();
    }

    // ==================== SIZING ====================

    public static RenkoBuilder fixed(String symbol, BigDecimal brickSize, String source) {
        return new RenkoBuilder(symbol, brickSize, source, FIXED);
    }

    /**
     * Brick size = ATR(period) over the given history (needs period + 1 candles).
     */
    public static RenkoBuilder atr(String symbol, List<MarketData> candles, String source, int period) {
        BigDecimal atr = AverageTrueRange.calculate(candles, period);
        if (atr.signum() <= 0) {
            throw new InvalidConfigurationException(
                "Invalid ATR value " + atr + " calculated for " + symbol + ". Need more historical data.");
        }
        logger.info("Created ATR-based Renko builder for {} with brick size {} (ATR{})",
            symbol, atr.toPlainString(), period);
        return new RenkoBuilder(symbol, atr, source, "ATR(" + period + ")");
    }

    public static RenkoBuilder atr(String symbol, List<MarketData> candles, String source) {
        return atr(symbol, candles, source, AverageTrueRange.DEFAULT_PERIOD);
    }

    /**
     * Brick size = price x percent / 100, with {@code 0 < percent <= 100}.
     */
    public static RenkoBuilder percentage(String symbol, BigDecimal currentPrice, BigDecimal percent, String source) {
        if (percent.signum() <= 0 || percent.compareTo(HUNDRED) > 0) {
            throw new InvalidConfigurationException("Percentage must be between 0 and 100: " + percent);
        }
        BigDecimal size = currentPrice.multiply(percent).divide(HUNDRED);
        logger.info("Created percentage-based Renko builder for {} with {}% brick size = {}",
            symbol, percent.toPlainString(), size.toPlainString());
        return new RenkoBuilder(symbol, size, source,
            "Percentage(" + percent.stripTrailingZeros().toPlainString() + "%)");
    }

    @Override
    public String symbol() {
        return symbol;
    }

    public BigDecimal brickSize() {
        return brickSize;
    }

    public String sizingMethod() {
        return sizingMethod;
    }

    // ==================== PROCESSING ====================

    @Override
    public List<RenkoBrick> processPrice(BigDecimal price, BigDecimal volume, BigDecimal quoteVolume,
                                         Instant timestamp, Boolean isBuy) {
        accumulatedVolume = accumulatedVolume.add(volume);
        accumulatedQuoteVolume = accumulatedQuoteVolume.add(quoteVolume != null ? quoteVolume : BigDecimal.ZERO);
        dataPoints++;
        lastTime = timestamp;

        if (brickOpen == null) {
            brickOpen = price.divide(brickSize, 0, RoundingMode.HALF_EVEN).multiply(brickSize);
            highSinceBrick = price;
            lowSinceBrick = price;
            return List.of();
        }

        highSinceBrick = highSinceBrick.max(price);
        lowSinceBrick = lowSinceBrick.min(price);

        List<RenkoBrick> bricks = new ArrayList<>();
        while (highSinceBrick.compareTo(brickOpen.add(brickSize)) >= 0) {
            bricks.add(emit(brickOpen, brickOpen.add(brickSize), true));
        }
        // The low seen before an up move must not also produce down bricks
        if (!bricks.isEmpty()) {
            highSinceBrick = price;
            lowSinceBrick = price;
        }
        while (lowSinceBrick.compareTo(brickOpen.subtract(brickSize)) <= 0) {
            bricks.add(emit(brickOpen, brickOpen.subtract(brickSize), false));
        }

        if (!bricks.isEmpty()) {
            highSinceBrick = price;
            lowSinceBrick = price;
            logger.debug("{} Renko brick(s) for {} ending at {}", bricks.size(), symbol, brickOpen);
        }
        return bricks;
    }

    private RenkoBrick emit(BigDecimal open, BigDecimal close, boolean up) {
        boolean reversal = hasPriorBrick && up != lastBrickUp;
        RenkoBrick brick = new RenkoBrick(symbol, lastTime, open,
            up ? close : open, up ? open : close, close,
            accumulatedVolume, accumulatedQuoteVolume, source, brickSize, up, reversal, dataPoints, sizingMethod);

        brickOpen = close;
        hasPriorBrick = true;
        lastBrickUp = up;
        accumulatedVolume = BigDecimal.ZERO;
        accumulatedQuoteVolume = BigDecimal.ZERO;
        dataPoints = 0;
        return brick;
    }

    @Override
    public Optional<RenkoBrick> forceComplete() {
        return Optional.empty();
    }

    @Override
    public void reset() {
        brickOpen = null;
        highSinceBrick = null;
        lowSinceBrick = null;
        accumulatedVolume = BigDecimal.ZERO;
        accumulatedQuoteVolume = BigDecimal.ZERO;
        dataPoints = 0;
        lastTime = null;
        hasPriorBrick = false;
        lastBrickUp = false;
    }

    public State currentState() {
        return new State(brickOpen, highSinceBrick, lowSinceBrick, dataPoints, accumulatedVolume);
    }

    /**
     * @param brickOpen     null before the first price
     * @param pendingVolume volume not yet assigned to a brick
     */
    public record State(BigDecimal brickOpen, BigDecimal high, BigDecimal low, int dataPoints,
                        BigDecimal pendingVolume) {
    }
}
