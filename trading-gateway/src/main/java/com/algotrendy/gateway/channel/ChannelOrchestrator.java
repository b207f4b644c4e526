package com.algotrendy.gateway.channel;

import com.algotrendy.gateway.config.GatewayConfig;
import com.algotrendy.gateway.metrics.MetricsService;
import com.algotrendy.gateway.persistence.MarketDataRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * MARKET DATA ORCHESTRATOR
 *
 * Polls every channel on a fixed schedule, persists the candles and hands them to listeners.
 *
 * Features:
 * - One scheduler thread; a cycle never overlaps the next
 * - Channels fetched concurrently on a pool sized to the channel count
 * - A failing channel is reported and skipped, never aborts the cycle
 * - No retries within a cycle; the next cycle is the retry
 *
 * Every candle fetched is persisted (upsert), but listeners only receive closed candles
 * they have not seen, since consecutive cycles fetch overlapping windows.
 */
public class ChannelOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(ChannelOrchestrator.class);

    private final List<ChannelConnector> channels;
    private final MarketDataRepository repository;
    private final MetricsService metrics;
    private final String interval;
    private final int limit;
    private final long fetchIntervalSeconds;
    private final long startupDelaySeconds;

    private final List<MarketDataListener> listeners = new CopyOnWriteArrayList<>();
    private final CandleWatermark watermark;
    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private final ScheduledExecutorService scheduler;
    private final ExecutorService fetchPool;
    private volatile ScheduledFuture<?> scheduledCycle;

    public ChannelOrchestrator(List<? extends ChannelConnector> channels, MarketDataRepository repository,
                               MetricsService metrics, GatewayConfig config) {
        this(channels, repository, metrics, config, Clock.systemUTC());
    }

    ChannelOrchestrator(List<? extends ChannelConnector> channels, MarketDataRepository repository,
                        MetricsService metrics, GatewayConfig config, Clock clock) {
        if (channels.isEmpty()) {
            throw new IllegalArgumentException("At least one channel is required");
        }
        this.channels = List.copyOf(channels);
        this.repository = repository;
        this.metrics = metrics;
        this.interval = config.getMarketDataInterval();
        this.limit = config.getMarketDataLimit();
        this.fetchIntervalSeconds = config.getFetchIntervalSeconds();
        this.startupDelaySeconds = config.getStartupDelaySeconds();
        this.watermark = new CandleWatermark(interval, clock);

        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "market-data-scheduler");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger threadCount = new AtomicInteger();
        this.fetchPool = Executors.newFixedThreadPool(this.channels.size(), r -> {
            Thread t = new Thread(r, "market-data-fetch-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        logger.info("Market data orchestrator initialized with {} channels: {}", this.channels.size(),
            this.channels.stream().map(ChannelConnector::exchangeName).toList());
    }

    public void addListener(MarketDataListener listener) {
        listeners.add(listener);
    }

    public void removeListener(MarketDataListener listener) {
        listeners.remove(listener);
    }

    // ==================== LIFECYCLE ====================

    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("Market data orchestrator was stopped");
        }
        if (!running.compareAndSet(false, true)) {
            logger.warn("Market data orchestrator already running");
            return;
        }
        logger.info("📊 Market data orchestrator starting with fetch interval: {}s (first cycle in {}s)",
            fetchIntervalSeconds, startupDelaySeconds);
        scheduledCycle = scheduler.scheduleWithFixedDelay(this::runScheduledCycle,
            startupDelaySeconds, fetchIntervalSeconds, TimeUnit.SECONDS);
    }

    private void runScheduledCycle() {
        try {
            runCycle();
        } catch (RuntimeException e) {
            // Keeps the schedule alive; a thrown exception would cancel it
            logger.error("Error in market data fetch cycle", e);
        }
    }

    /**
     * Cancel the schedule, then stop every connected channel concurrently.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        running.set(false);
        logger.info("Stopping all market data channels");
        if (scheduledCycle != null) {
            scheduledCycle.cancel(false);
        }
        scheduler.shutdown();

        List<CompletableFuture<Void>> stops = new ArrayList<>();
        for (ChannelConnector channel : channels) {
            if (!channel.isConnected()) {
                continue;
            }
            stops.add(CompletableFuture.runAsync(channel::stop, fetchPool)
                .exceptionally(ex -> {
                    logger.error("Error stopping {} channel: {}", channel.exchangeName(), rootMessage(ex));
                    return null;
                }));
        }
        CompletableFuture.allOf(stops.toArray(new CompletableFuture[0])).join();

        fetchPool.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Fetch cycle still running after 10s, forcing shutdown");
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Market data orchestrator stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    // ==================== FETCH CYCLE ====================

    /**
     * Run one fetch cycle now and wait for every channel. Blocks while another cycle is running.
     */
    public CycleReport runCycle() {
        cycleLock.lock();
        try {
            long startNanos = System.nanoTime();
            logger.info("Starting data fetch cycle");

            List<CompletableFuture<ChannelCycleResult>> futures = channels.stream()
                .map(channel -> CompletableFuture.supplyAsync(() -> fetchFromChannel(channel), fetchPool))
                .toList();
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            List<ChannelCycleResult> results = futures.stream().map(CompletableFuture::join).toList();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            CycleReport report = new CycleReport(results, elapsed);
            metrics.recordFetchCycle(elapsed);

            logger.info("Fetch cycle completed in {}ms: {} records from {}/{} channels",
                elapsed.toMillis(), report.totalRecords(), report.successfulChannels(), results.size());
            if (!report.failedChannels().isEmpty()) {
                logger.warn("Failed channels: {}", String.join(", ", report.failedChannels()));
            }
            return report;
        } finally {
            cycleLock.unlock();
        }
    }

    private ChannelCycleResult fetchFromChannel(ChannelConnector channel) {
        String name = channel.exchangeName();
        try {
            if (!channel.isConnected()) {
                logger.info("Starting {} channel", name);
                channel.start();
            }

            FetchResult result = channel.fetchData(null, interval, limit);
            if (result.isEmpty()) {
                logger.warn("{}: No data fetched", name);
                return ChannelCycleResult.ok(name, 0);
            }

            int saved = repository.insertBatch(result.records());
            metrics.incrementRecordsSaved(name, saved);
            logger.atInfo()
                .addKeyValue("channel", name)
                .addKeyValue("records", saved)
                .log("{}: Fetched and saved {} records", name, saved);

            publish(name, result.records());
            return ChannelCycleResult.ok(name, saved);
        } catch (RuntimeException e) {
            metrics.incrementChannelFailures(name);
            logger.error("Error fetching from {}: {}", name, e.getMessage());
            return ChannelCycleResult.failed(name, e.getMessage());
        }
    }

    private void publish(String exchange, List<MarketData> fetched) {
        List<MarketData> records = watermark.advance(exchange, fetched);
        if (records.isEmpty()) {
            return;
        }
        for (MarketDataListener listener : listeners) {
            try {
                listener.onMarketData(exchange, records);
            } catch (RuntimeException e) {
                logger.error("Market data listener failed for {}: {}", exchange, e.getMessage(), e);
            }
        }
    }

    // ==================== HEALTH ====================

    public List<ChannelHealth> channelHealth() {
        return channels.stream()
            .map(channel -> new ChannelHealth(
                channel.exchangeName(),
                channel.isConnected(),
                channel.subscribedSymbols(),
                channel.lastDataReceivedAt().orElse(null),
                channel.totalMessagesReceived()))
            .toList();
    }

    private static String rootMessage(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        return cause.getMessage();
    }
}
