package com.algotrendy.gateway.config;

import java.util.Locale;

/**
 * Throttle parameters for one broker connector.
 *
 * @param maxConcurrency max requests in flight on the connector
 * @param minIntervalMs  minimum spacing between two admitted requests
 */
public record BrokerRateLimit(int maxConcurrency, long minIntervalMs) {

    public static final BrokerRateLimit BINANCE = new BrokerRateLimit(20, 50);
    public static final BrokerRateLimit BYBIT = new BrokerRateLimit(10, 100);
    public static final BrokerRateLimit INTERACTIVE_BROKERS = new BrokerRateLimit(5, 200);
    public static final BrokerRateLimit TRADESTATION = new BrokerRateLimit(10, 100);
    public static final BrokerRateLimit KRAKEN = new BrokerRateLimit(10, 100);
    public static final BrokerRateLimit COINBASE = new BrokerRateLimit(10, 100);

    /**
     * Preset for a broker name, falling back to 10 concurrent / 100 ms.
     */
    public static BrokerRateLimit presetFor(String broker) {
        return switch (broker.toLowerCase(Locale.ROOT)) {
            case "binance" -> BINANCE;
            case "bybit" -> BYBIT;
            case "ib", "interactivebrokers", "interactive-brokers" -> INTERACTIVE_BROKERS;
            case "tradestation" -> TRADESTATION;
            case "kraken" -> KRAKEN;
            case "coinbase" -> COINBASE;
            default -> new BrokerRateLimit(10, 100);
        };
    }
}
