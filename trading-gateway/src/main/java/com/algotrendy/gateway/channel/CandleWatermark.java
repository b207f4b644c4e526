package com.algotrendy.gateway.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the newest closed candle already handed to listeners, per exchange and symbol.
 *
 * Every cycle fetches an overlapping window of recent candles. Only closed candles newer
 * than the watermark pass, so each candle reaches the bar builders once and in time order.
 * A candle is closed once {@code timestamp + interval <= now}; the still-forming candle
 * is held back until a later cycle sees it closed.
 */
final class CandleWatermark {
    private static final Logger logger = LoggerFactory.getLogger(CandleWatermark.class);

    private final Duration interval;
    private final Clock clock;
    private final Map<String, Instant> forwarded = new ConcurrentHashMap<>();

    CandleWatermark(String interval, Clock clock) {
        this.interval = Duration.ofMinutes(AbstractRestChannel.intervalMinutes(interval));
        this.clock = clock;
    }

    /**
     * Closed candles not forwarded before, oldest first. Advances the watermark past them.
     */
    List<MarketData> advance(String exchange, List<MarketData> records) {
        Instant now = clock.instant();
        List<MarketData> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(MarketData::timestamp));

        List<MarketData> fresh = new ArrayList<>();
        for (MarketData candle : sorted) {
            if (candle.timestamp().plus(interval).isAfter(now)) {
                continue;
            }
            String key = exchange + "|" + candle.symbol();
            Instant last = forwarded.get(key);
            if (last == null || candle.timestamp().isAfter(last)) {
                forwarded.put(key, candle.timestamp());
                fresh.add(candle);
            }
        }
        if (fresh.size() < records.size()) {
            logger.debug("{}: {} of {} candles are new and closed", exchange, fresh.size(), records.size());
        }
        return fresh;
    }
}
