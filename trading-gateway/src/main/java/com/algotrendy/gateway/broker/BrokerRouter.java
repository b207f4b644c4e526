package com.algotrendy.gateway.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * UNIFIED BROKER ROUTER
 *
 * Routes orders to the gateway registered under the order's exchange name.
 * Exchange names are matched case-insensitively.
 *
 * Consolidated calls fan out to every gateway and tolerate individual failures:
 * a broker that fails is logged and left out of the result.
 */
public class BrokerRouter {
    private static final Logger logger = LoggerFactory.getLogger(BrokerRouter.class);

    private final Map<String, BrokerGateway> gateways = new LinkedHashMap<>();

    public BrokerRouter(Collection<? extends BrokerGateway> gateways) {
        for (BrokerGateway gateway : gateways) {
            String key = gateway.brokerName().toLowerCase(Locale.ROOT);
            if (this.gateways.putIfAbsent(key, gateway) != null) {
                throw new IllegalArgumentException("Duplicate gateway for exchange " + key);
            }
        }
        logger.info("🔀 Broker Router initialized: {}", this.gateways.keySet());
    }

    /**
     * @throws IllegalArgumentException if no gateway is registered for the exchange
     */
    public BrokerGateway route(String exchange) {
        if (exchange == null) {
            throw new IllegalArgumentException("Exchange is required");
        }
        BrokerGateway gateway = gateways.get(exchange.toLowerCase(Locale.ROOT));
        if (gateway == null) {
            throw new IllegalArgumentException("Unknown exchange: " + exchange + " (known: " + gateways.keySet() + ")");
        }
        return gateway;
    }

    public List<String> exchanges() {
        return List.copyOf(gateways.keySet());
    }

    /**
     * Connect every gateway concurrently. Completes with each exchange's connect outcome.
     */
    public CompletableFuture<Map<String, Boolean>> connectAll() {
        Map<String, Boolean> results = new ConcurrentHashMap<>();
        var futures = gateways.entrySet().stream()
            .map(entry -> entry.getValue().connect()
                .exceptionally(ex -> {
                    logger.error("❌ {} connect failed: {}", entry.getKey(), ex.getMessage());
                    return false;
                })
                .thenAccept(connected -> results.put(entry.getKey(), connected)))
            .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
            .thenApply(v -> {
                logger.info("🔀 Connected brokers: {}", results);
                return Map.copyOf(results);
            });
    }

    public void disconnectAll() {
        gateways.values().forEach(BrokerGateway::disconnect);
    }

    /**
     * Balance of one currency at every connected broker. Disconnected or failing brokers are skipped.
     */
    public CompletableFuture<Map<String, BigDecimal>> getConsolidatedBalances(String currency) {
        Map<String, BigDecimal> results = new ConcurrentHashMap<>();
        var futures = gateways.entrySet().stream()
            .filter(entry -> entry.getValue().isConnected())
            .map(entry -> balanceOf(entry.getKey(), entry.getValue(), currency)
                .thenAccept(balance -> {
                    if (balance != null) {
                        results.put(entry.getKey(), balance);
                    }
                }))
            .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
            .thenApply(v -> Map.copyOf(results));
    }

    private CompletableFuture<BigDecimal> balanceOf(String exchange, BrokerGateway gateway, String currency) {
        CompletableFuture<BigDecimal> balance;
        try {
            balance = gateway.getBalance(currency);
        } catch (RuntimeException e) {
            balance = CompletableFuture.failedFuture(e);
        }
        return balance.exceptionally(ex -> {
            logger.warn("⚠️ {} balance unavailable: {}", exchange, ex.getMessage());
            return null;
        });
    }
}
