package com.algotrendy.gateway.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Metrics facade for the gateway.
 *
 * Provides:
 * - Prometheus-compatible registry for production
 * - Counters and timers for throttling, orders, channel cycles and bars
 *
 * One instance is created by the application and handed to each component;
 * tests use {@link #inMemory()}.
 */
public final class MetricsService {
    private static final Logger logger = LoggerFactory.getLogger(MetricsService.class);

    private final MeterRegistry registry;

    public MetricsService(MeterRegistry registry) {
        this.registry = registry;
    }

    public static MetricsService prometheus() {
        logger.info("MetricsService initialized with Prometheus registry");
        return new MetricsService(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
    }

    public static MetricsService inMemory() {
        return new MetricsService(new SimpleMeterRegistry());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Prometheus-formatted metrics for scraping, empty for non-Prometheus registries.
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry prometheus) {
            return prometheus.scrape();
        }
        return "";
    }

    // ==================== BROKERS ====================

    public void recordThrottleWait(String broker, Duration waited) {
        registry.timer("gateway.broker.throttle.wait",
            "broker", broker).record(waited);
    }

    public void incrementBrokerRequests(String broker) {
        registry.counter("gateway.broker.requests",
            "broker", broker).increment();
    }

    // ==================== ORDERS ====================

    public void incrementOrdersSubmitted(String exchange, String side) {
        registry.counter("gateway.orders.submitted",
            "exchange", exchange,
            "side", side).increment();
    }

    public void incrementDuplicateOrders(String exchange) {
        registry.counter("gateway.orders.duplicate",
            "exchange", exchange).increment();
    }

    public void incrementOrdersRejected(String exchange, String orderType) {
        registry.counter("gateway.orders.rejected",
            "exchange", exchange,
            "type", orderType).increment();
    }

    // ==================== MARKET DATA ====================

    public void recordFetchCycle(Duration elapsed) {
        registry.timer("gateway.marketdata.cycle").record(elapsed);
    }

    public void incrementChannelFailures(String channel) {
        registry.counter("gateway.marketdata.channel.failures",
            "channel", channel).increment();
    }

    public void incrementRecordsSaved(String channel, int count) {
        registry.counter("gateway.marketdata.records.saved",
            "channel", channel).increment(count);
    }

    // ==================== BARS ====================

    public void incrementBarsEmitted(String barType, int count) {
        registry.counter("gateway.bars.emitted",
            "type", barType).increment(count);
    }
}
