package com.algotrendy.gateway.channel;

import com.algotrendy.gateway.exception.DataUnavailableException;
import com.algotrendy.gateway.exception.NotConnectedException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared plumbing for REST polling channels.
 *
 * Features:
 * - resilience4j RateLimiter sized to the venue's published limit
 * - resilience4j CircuitBreaker per channel (open circuit fails the symbol, no retry)
 * - Per-symbol isolation: one failing symbol never hides the others
 * - Candle validation before anything leaves the channel
 */
public abstract class AbstractRestChannel implements ChannelConnector {
    private static final Logger logger = LoggerFactory.getLogger(AbstractRestChannel.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);

    private final String exchangeName;
    private final HttpClient httpClient;
    protected final ObjectMapper mapper;
    private final RateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;

    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final Set<String> subscriptions = ConcurrentHashMap.newKeySet();
    private final AtomicReference<Instant> lastDataReceivedAt = new AtomicReference<>();
    private final AtomicLong totalMessagesReceived = new AtomicLong(0);

    /**
     * @param requestsPerSecond venue limit for the public market data endpoints
     */
    protected AbstractRestChannel(String exchangeName, HttpClient httpClient, ObjectMapper mapper,
                                  int requestsPerSecond) {
        this.exchangeName = exchangeName;
        this.httpClient = httpClient;
        this.mapper = mapper;

        var rlConfig = RateLimiterConfig.custom()
            .limitForPeriod(requestsPerSecond)
            .limitRefreshPeriod(Duration.ofSeconds(1))
            .timeoutDuration(Duration.ofSeconds(10))
            .build();
        this.rateLimiter = RateLimiter.of(exchangeName + "-market-data", rlConfig);

        var cbConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .slidingWindowSize(10)
            .permittedNumberOfCallsInHalfOpenState(3)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .build();
        this.circuitBreaker = CircuitBreaker.of(exchangeName + "-market-data", cbConfig);
        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                logger.warn("{} circuit breaker state changed: {}", exchangeName, event.getStateTransition()));
    }

    // ==================== VENUE SPECIFICS ====================

    protected abstract String pingUrl();

    protected abstract List<String> defaultSymbols();

    /**
     * Raw candles for one symbol, oldest first. Validation happens in the caller.
     */
    protected abstract List<MarketData> fetchSymbol(String symbol, String interval, int limit);

    // ==================== LIFECYCLE ====================

    @Override
    public String exchangeName() {
        return exchangeName;
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    @Override
    public void start() {
        if (connected.get()) {
            logger.warn("{} channel already connected", exchangeName);
            return;
        }
        logger.info("Connecting to {} REST API...", exchangeName);
        getJson(pingUrl());
        connected.set(true);
        logger.info("✅ Connected to {} REST API", exchangeName);
    }

    @Override
    public void stop() {
        if (!connected.getAndSet(false)) {
            return;
        }
        subscriptions.clear();
        logger.info("Disconnected from {}", exchangeName);
    }

    @Override
    public void subscribe(List<String> symbols) {
        requireConnected();
        subscriptions.addAll(symbols);
        logger.info("Subscribed to {} symbols on {}: {}", symbols.size(), exchangeName, symbols);
    }

    @Override
    public void unsubscribe(List<String> symbols) {
        requireConnected();
        symbols.forEach(subscriptions::remove);
        logger.info("Unsubscribed from {} symbols on {}", symbols.size(), exchangeName);
    }

    private void requireConnected() {
        if (!connected.get()) {
            throw new NotConnectedException(exchangeName);
        }
    }

    @Override
    public Set<String> subscribedSymbols() {
        return Set.copyOf(subscriptions);
    }

    @Override
    public Optional<Instant> lastDataReceivedAt() {
        return Optional.ofNullable(lastDataReceivedAt.get());
    }

    @Override
    public long totalMessagesReceived() {
        return totalMessagesReceived.get();
    }

    // ==================== FETCH ====================

    @Override
    public FetchResult fetchData(List<String> symbols, String interval, int limit) {
        List<String> targets = resolveSymbols(symbols);
        List<MarketData> records = new ArrayList<>();
        int failed = 0;
        RuntimeException lastError = null;

        for (String symbol : targets) {
            try {
                for (MarketData candle : fetchSymbol(symbol, interval, limit)) {
                    if (candle.isValid()) {
                        records.add(candle);
                    } else {
                        logger.warn("Invalid candle from {} for {} at {}, dropped", exchangeName, symbol, candle.timestamp());
                    }
                }
            } catch (RuntimeException e) {
                failed++;
                lastError = e;
                logger.error("Error fetching {} data for {}: {}", exchangeName, symbol, e.getMessage());
            }
        }

        if (!targets.isEmpty() && failed == targets.size()) {
            throw new DataUnavailableException(exchangeName,
                "All " + failed + " symbols failed", lastError);
        }

        if (!records.isEmpty()) {
            totalMessagesReceived.addAndGet(records.size());
            lastDataReceivedAt.set(Instant.now());
        }
        logger.info("Fetched {} candles from {} for {} symbols", records.size(), exchangeName, targets.size());
        return FetchResult.of(records, failed);
    }

    private List<String> resolveSymbols(List<String> symbols) {
        if (symbols != null && !symbols.isEmpty()) {
            return symbols;
        }
        if (!subscriptions.isEmpty()) {
            return List.copyOf(subscriptions);
        }
        return defaultSymbols();
    }

    // ==================== TRANSPORT ====================

    /**
     * GET and parse a JSON document through the rate limiter and circuit breaker.
     *
     * @throws DataUnavailableException on transport errors, non-2xx, malformed JSON,
     *         an open circuit or an exhausted rate limit
     */
    protected JsonNode getJson(String url) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(REQUEST_TIMEOUT)
            .header("Accept", "application/json")
            .GET()
            .build();

        var decorated = RateLimiter.decorateSupplier(rateLimiter,
            CircuitBreaker.decorateSupplier(circuitBreaker, () -> send(request)));
        try {
            return decorated.get();
        } catch (CallNotPermittedException e) {
            throw new DataUnavailableException(exchangeName, "Circuit breaker open", e);
        } catch (RequestNotPermitted e) {
            throw new DataUnavailableException(exchangeName, "Rate limit wait exceeded", e);
        }
    }

    private JsonNode send(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DataUnavailableException(exchangeName, "Request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataUnavailableException(exchangeName, "Request interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new DataUnavailableException(exchangeName,
                "HTTP " + response.statusCode() + " for " + request.uri().getPath());
        }
        try {
            return mapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new DataUnavailableException(exchangeName, "Malformed response: " + e.getOriginalMessage(), e);
        }
    }

    public String getCircuitBreakerState() {
        return circuitBreaker.getState().name();
    }

    // ==================== PARSING HELPERS ====================

    protected static BigDecimal decimal(JsonNode node) {
        return new BigDecimal(node.asText());
    }

    /**
     * Nearest supported value, ties going to the smaller one.
     */
    protected static int nearest(int requested, int[] supported) {
        int best = supported[0];
        for (int candidate : supported) {
            if (Math.abs(candidate - requested) < Math.abs(best - requested)) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * "1m" -> 1, "4h" -> 240, "1d" -> 1440, "1w" -> 10080. Unknown units are minutes.
     */
    protected static int intervalMinutes(String interval) {
        String trimmed = interval.trim().toLowerCase(Locale.ROOT);
        char unit = trimmed.charAt(trimmed.length() - 1);
        int amount;
        try {
            amount = Integer.parseInt(Character.isDigit(unit) ? trimmed : trimmed.substring(0, trimmed.length() - 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unsupported interval: " + interval, e);
        }
        return switch (unit) {
            case 'h' -> amount * 60;
            case 'd' -> amount * 1440;
            case 'w' -> amount * 10080;
            default -> amount;
        };
    }
}
