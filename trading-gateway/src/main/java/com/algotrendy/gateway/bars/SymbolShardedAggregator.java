package com.algotrendy.gateway.bars;

import com.algotrendy.gateway.channel.MarketData;
import com.algotrendy.gateway.channel.MarketDataListener;
import com.algotrendy.gateway.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Feeds per-symbol bar builders without locks.
 *
 * Every event for a symbol runs on the same single-threaded shard
 * ({@code floorMod(symbol.hashCode(), shards)}), so each builder has exactly one writer.
 * Builders are keyed by source and symbol, since venues quote the same pair, and are
 * created lazily from the factory the first time a pair shows up.
 * Completed bars go to the sink from the shard thread; sink failures are logged.
 */
public final class SymbolShardedAggregator<B extends Bar> implements MarketDataListener, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SymbolShardedAggregator.class);

    private final String name;
    private final BiFunction<String, String, BarAggregator<B>> factory;
    private final Consumer<List<B>> sink;
    private final MetricsService metrics;
    private final ExecutorService[] shards;
    // Index i is only touched from shards[i]
    private final List<Map<String, BarAggregator<B>>> builders;

    /**
     * @param factory builds a builder from (source, symbol)
     */
    public SymbolShardedAggregator(String name, int shardCount, BiFunction<String, String, BarAggregator<B>> factory,
                                   Consumer<List<B>> sink, MetricsService metrics) {
        if (shardCount <= 0) {
            throw new IllegalArgumentException("Shard count must be positive: " + shardCount);
        }
        this.name = name;
        this.factory = factory;
        this.sink = sink;
        this.metrics = metrics;
        this.shards = new ExecutorService[shardCount];
        this.builders = new ArrayList<>(shardCount);
        for (int i = 0; i < shardCount; i++) {
            String threadName = name + "-shard-" + i;
            shards[i] = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, threadName);
                t.setDaemon(true);
                return t;
            });
            builders.add(new HashMap<>());
        }
        logger.info("Bar aggregator '{}' started with {} shards", name, shardCount);
    }

    int shardFor(String symbol) {
        return Math.floorMod(symbol.hashCode(), shards.length);
    }

    // ==================== INPUT ====================

    /**
     * Candles from one channel. Candles keep their order per symbol.
     */
    @Override
    public void onMarketData(String exchange, List<MarketData> records) {
        for (MarketData candle : records) {
            submit(exchange, candle.symbol(), builder -> builder.processCandle(candle));
        }
    }

    public CompletableFuture<Void> onTick(String source, Tick tick) {
        return submit(source, tick.symbol(), builder ->
            builder.processPrice(tick.price(), tick.quantity(), tick.quoteVolume(), tick.timestamp(), tick.marketBuy()));
    }

    private CompletableFuture<Void> submit(String source, String symbol, Function<BarAggregator<B>, List<B>> step) {
        int shard = shardFor(symbol);
        return CompletableFuture.runAsync(() -> {
            BarAggregator<B> builder = builders.get(shard)
                .computeIfAbsent(key(source, symbol), k -> factory.apply(source, symbol));
            emit(step.apply(builder));
        }, shards[shard]).exceptionally(ex -> {
            logger.error("Bar aggregation failed for {} in '{}': {}", symbol, name, ex.getMessage());
            return null;
        });
    }

    private void emit(List<B> bars) {
        if (bars.isEmpty()) {
            return;
        }
        metrics.incrementBarsEmitted(bars.get(0).barType().name().toLowerCase(Locale.ROOT), bars.size());
        try {
            sink.accept(bars);
        } catch (RuntimeException e) {
            logger.error("Bar sink failed for {} {} bars: {}", bars.size(), bars.get(0).barType(), e.getMessage(), e);
        }
    }

    private static String key(String source, String symbol) {
        return source + "|" + symbol;
    }

    // ==================== FLUSH / SHUTDOWN ====================

    /**
     * Force-complete every builder and emit the partial bars. Completes once all shards have flushed.
     */
    public CompletableFuture<Void> flush() {
        List<CompletableFuture<Void>> pending = new ArrayList<>();
        for (int i = 0; i < shards.length; i++) {
            Map<String, BarAggregator<B>> shardBuilders = builders.get(i);
            pending.add(CompletableFuture.runAsync(() ->
                shardBuilders.values().forEach(builder ->
                    builder.forceComplete().ifPresent(bar -> emit(List.of(bar)))), shards[i]));
        }
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]));
    }

    /**
     * Run an action against one symbol's builder on its shard, e.g. to read its state.
     */
    public <R> CompletableFuture<R> inspect(String source, String symbol, Function<BarAggregator<B>, R> action) {
        int shard = shardFor(symbol);
        return CompletableFuture.supplyAsync(() -> {
            BarAggregator<B> builder = builders.get(shard).get(key(source, symbol));
            return builder == null ? null : action.apply(builder);
        }, shards[shard]);
    }

    /**
     * Flush partial bars, then stop the shard threads.
     */
    @Override
    public void close() {
        try {
            flush().get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.warn("Flush of '{}' did not complete: {}", name, e.getMessage());
        }
        for (ExecutorService shard : shards) {
            shard.shutdown();
        }
        logger.info("Bar aggregator '{}' stopped", name);
    }
}
