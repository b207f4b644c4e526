package com.algotrendy.gateway.broker;

import com.algotrendy.gateway.exception.BrokerUnavailableException;
import com.algotrendy.gateway.exception.OrderRejectedException;
import com.algotrendy.gateway.order.Order;
import com.algotrendy.gateway.order.OrderSide;
import com.algotrendy.gateway.order.OrderStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * KRAKEN GATEWAY
 *
 * Spot trading via Kraken's REST API.
 *
 * Features:
 * - HMAC-SHA512 authentication (API-Key / API-Sign headers)
 * - Strictly increasing nonce per gateway instance
 * - Client order id forwarded as {@code cl_ord_id}
 * - Pair minimums checked before submission
 *
 * Fees: Maker 0.16%, Taker 0.26%
 */
public class KrakenGateway implements BrokerGateway {
    private static final Logger logger = LoggerFactory.getLogger(KrakenGateway.class);

    public static final String BROKER_NAME = "kraken";
    private static final String API_BASE_URL = "https://api.kraken.com";
    private static final String API_VERSION = "/0";
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);

    /**
     * Kraken minimum order sizes by pair
     * Source: https://support.kraken.com/articles/205893708-minimum-order-size-volume-for-trading
     */
    private static final Map<String, OrderLimits> PAIR_LIMITS = Map.of(
        "XXBTZUSD", OrderLimits.of("0.0001", "10"),
        "XETHZUSD", OrderLimits.of("0.01", "10"),
        "SOLUSD", OrderLimits.of("0.5", "10"),
        "XDGUSD", OrderLimits.of("500", "10"),
        "XXRPZUSD", OrderLimits.of("10", "10"),
        "ADAUSD", OrderLimits.of("10", "10")
    );
    private static final OrderLimits DEFAULT_LIMITS = OrderLimits.of("0.0001", "10");

    private final String apiKey;
    private final String apiSecret;
    private final BrokerHttpClient http;
    private final RateLimitedConnector connector;

    // Kraken requires nonces to be strictly increasing per API key
    private final AtomicLong lastNonce = new AtomicLong(0);

    public KrakenGateway(String apiKey, String apiSecret, RateLimitedConnector connector,
                         HttpClient httpClient, ObjectMapper objectMapper) {
        this.apiKey = apiKey;
        this.apiSecret = apiSecret;
        this.connector = connector;
        this.http = new BrokerHttpClient(BROKER_NAME, httpClient, objectMapper, connector);

        if (isConfigured()) {
            logger.info("🦑 Kraken gateway initialized (API Key: {}...)", apiKey.substring(0, Math.min(8, apiKey.length())));
        } else {
            logger.warn("⚠️ Kraken API keys not configured. Set KRAKEN_API_KEY and KRAKEN_API_SECRET.");
        }
    }

    @Override
    public String brokerName() {
        return BROKER_NAME;
    }

    @Override
    public ConnectionState state() {
        return connector.getState();
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank() && apiSecret != null && !apiSecret.isBlank();
    }

    // ==================== LIFECYCLE ====================

    @Override
    public CompletableFuture<Boolean> connect() {
        if (!connector.beginConnect()) {
            return CompletableFuture.completedFuture(connector.isConnected());
        }
        if (!isConfigured()) {
            logger.error("❌ Cannot connect to Kraken: API keys not configured");
            connector.markDisconnected();
            return CompletableFuture.completedFuture(false);
        }

        // Balance doubles as a credential check
        return privateRequest("/private/Balance", Map.of())
            .thenApply(json -> {
                if (hasErrors(json)) {
                    logger.error("❌ Kraken connection failed: {}", json.get("error"));
                    connector.markDisconnected();
                    return false;
                }
                connector.markConnected();
                return true;
            })
            .exceptionally(ex -> {
                logger.error("❌ Kraken connection failed: {}", rootMessage(ex));
                connector.markDisconnected();
                return false;
            });
    }

    @Override
    public void disconnect() {
        connector.markDisconnected();
    }

    // ==================== ORDERS ====================

    @Override
    public CompletableFuture<BrokerOrderAck> placeOrder(Order order) {
        requireClientOrderId(order);
        connector.ensureConnected();

        String pair = toKrakenSymbol(order.symbol());
        OrderLimits limits = PAIR_LIMITS.getOrDefault(pair, DEFAULT_LIMITS);
        var limitError = limits.validate(order.quantity(), order.price());
        if (limitError.isPresent()) {
            logger.error("❌ Order validation failed for {}: {}", pair, limitError.get());
            return CompletableFuture.failedFuture(
                new OrderRejectedException(BROKER_NAME, order.clientOrderId(), limitError.get()));
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("pair", pair);
        params.put("type", order.side() == OrderSide.BUY ? "buy" : "sell");
        params.put("ordertype", krakenOrderType(order));
        params.put("volume", order.quantity().toPlainString());
        switch (order.type()) {
            case LIMIT -> params.put("price", order.price().toPlainString());
            case STOP_LOSS, TAKE_PROFIT -> params.put("price", triggerPrice(order).toPlainString());
            case STOP_LIMIT -> {
                params.put("price", order.stopPrice().toPlainString());
                params.put("price2", order.price().toPlainString());
            }
            case MARKET -> { }
        }
        params.put("cl_ord_id", order.clientOrderId());

        logger.info("🦑 Placing Kraken {} {} order: {} {} (clientOrderId={})",
            params.get("type").toUpperCase(Locale.ROOT), params.get("ordertype"),
            order.quantity().toPlainString(), pair, order.clientOrderId());

        return privateRequest("/private/AddOrder", params)
            .thenApply(json -> {
                if (hasErrors(json)) {
                    throw new CompletionException(mapOrderError(order.clientOrderId(), json.get("error")));
                }
                JsonNode txids = json.path("result").path("txid");
                String txid = txids.isArray() && txids.size() > 0 ? txids.get(0).asText() : null;
                logger.info("✅ Kraken Order Placed: {} -> {}", order.clientOrderId(), txid);
                // Kraken doesn't return status immediately
                return BrokerOrderAck.accepted(order.clientOrderId(), txid, OrderStatus.OPEN);
            });
    }

    @Override
    public CompletableFuture<BrokerOrderAck> cancelOrder(String exchangeOrderId, String symbol) {
        connector.ensureConnected();
        logger.info("🦑 Cancelling Kraken Order: {}", exchangeOrderId);

        return privateRequest("/private/CancelOrder", Map.of("txid", exchangeOrderId))
            .thenApply(json -> {
                if (hasErrors(json)) {
                    throw new CompletionException(mapOrderError(null, json.get("error")));
                }
                return BrokerOrderAck.accepted(null, exchangeOrderId, OrderStatus.CANCELLED);
            });
    }

    @Override
    public CompletableFuture<BrokerOrderAck> getOrderStatus(String exchangeOrderId, String symbol) {
        connector.ensureConnected();

        return privateRequest("/private/QueryOrders", Map.of("txid", exchangeOrderId))
            .thenApply(json -> {
                if (hasErrors(json)) {
                    throw new CompletionException(mapOrderError(null, json.get("error")));
                }
                JsonNode info = json.path("result").path(exchangeOrderId);
                if (info.isMissingNode()) {
                    throw new CompletionException(new BrokerUnavailableException(BROKER_NAME,
                        "Order " + exchangeOrderId + " missing from QueryOrders result"));
                }
                BigDecimal executed = decimalOrNull(info.path("vol_exec"));
                BigDecimal avgPrice = decimalOrNull(info.path("price"));
                if (avgPrice != null && avgPrice.signum() == 0) {
                    avgPrice = null;
                }
                String clientId = info.path("cl_ord_id").asText(null);
                return new BrokerOrderAck(clientId, exchangeOrderId,
                    mapStatus(info.path("status").asText(), executed), executed, avgPrice, Instant.now());
            });
    }

    // ==================== ACCOUNT ====================

    /**
     * Available balance for one asset. USD maps to ZUSD, BTC to XXBT, and so on.
     */
    @Override
    public CompletableFuture<BigDecimal> getBalance(String currency) {
        connector.ensureConnected();
        String asset = toKrakenAsset(currency);

        return privateRequest("/private/Balance", Map.of())
            .thenApply(json -> {
                if (hasErrors(json)) {
                    throw new CompletionException(new BrokerUnavailableException(BROKER_NAME,
                        "Balance failed: " + json.get("error")));
                }
                BigDecimal balance = decimalOrNull(json.path("result").path(asset));
                return balance != null ? balance : BigDecimal.ZERO;
            });
    }

    /**
     * Spot holdings as positions, priced at the last trade.
     */
    @Override
    public CompletableFuture<List<Position>> getPositions() {
        connector.ensureConnected();

        return privateRequest("/private/Balance", Map.of())
            .thenCompose(json -> {
                if (hasErrors(json)) {
                    throw new CompletionException(new BrokerUnavailableException(BROKER_NAME,
                        "Balance failed: " + json.get("error")));
                }
                List<CompletableFuture<Position>> pending = new ArrayList<>();
                Iterator<Map.Entry<String, JsonNode>> fields = json.path("result").fields();
                while (fields.hasNext()) {
                    var entry = fields.next();
                    String asset = entry.getKey();
                    BigDecimal quantity = decimalOrNull(entry.getValue());
                    if (quantity == null || quantity.signum() <= 0 || isFiat(asset)) {
                        continue;
                    }
                    String symbol = fromKrakenAsset(asset) + "USD";
                    pending.add(getMarketPrice(symbol).thenApply(price ->
                        new Position(symbol, quantity, null, price, quantity.multiply(price), null)));
                }
                return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                    .thenApply(v -> pending.stream().map(CompletableFuture::join).toList());
            });
    }

    @Override
    public CompletableFuture<BigDecimal> getMarketPrice(String symbol) {
        connector.ensureConnected();
        String pair = toKrakenSymbol(symbol);

        return publicRequest("/public/Ticker?pair=" + pair)
            .thenApply(json -> {
                if (hasErrors(json)) {
                    throw new CompletionException(new BrokerUnavailableException(BROKER_NAME,
                        "Ticker failed for " + pair + ": " + json.get("error")));
                }
                Iterator<JsonNode> tickers = json.path("result").elements();
                if (!tickers.hasNext()) {
                    throw new CompletionException(new BrokerUnavailableException(BROKER_NAME, "No ticker for " + pair));
                }
                return new BigDecimal(tickers.next().path("c").path(0).asText());
            });
    }

    // ==================== HELPER METHODS ====================

    private CompletableFuture<JsonNode> publicRequest(String endpoint) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(API_BASE_URL + API_VERSION + endpoint))
            .timeout(REQUEST_TIMEOUT)
            .GET()
            .build();
        return http.send(request).thenApply(BrokerHttpClient.JsonResponse::body);
    }

    private CompletableFuture<JsonNode> privateRequest(String endpoint, Map<String, String> params) {
        long nonce = generateNonce();
        StringBuilder postData = new StringBuilder("nonce=").append(nonce);
        params.forEach((key, value) -> postData.append('&').append(key).append('=')
            .append(URLEncoder.encode(value, StandardCharsets.UTF_8)));

        String signature;
        try {
            signature = generateSignature(endpoint, nonce, postData.toString());
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            // Secret is not valid base64 or HMAC is unavailable
            return CompletableFuture.failedFuture(
                new BrokerUnavailableException(BROKER_NAME, "Request signing failed", e));
        }

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(API_BASE_URL + API_VERSION + endpoint))
            .timeout(REQUEST_TIMEOUT)
            .header("API-Key", apiKey)
            .header("API-Sign", signature)
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(postData.toString()))
            .build();
        return http.send(request).thenApply(BrokerHttpClient.JsonResponse::body);
    }

    /**
     * Microsecond-based nonce, bumped past the previous value when the clock stalls.
     */
    long generateNonce() {
        long candidate = System.currentTimeMillis() * 1000L;
        return lastNonce.updateAndGet(previous -> Math.max(previous + 1, candidate));
    }

    /**
     * Kraken API signature: HMAC-SHA512(base64-decoded secret, path + SHA256(nonce + postData)).
     */
    String generateSignature(String endpoint, long nonce, String postData) throws GeneralSecurityException {
        MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
        byte[] hash = sha256.digest((nonce + postData).getBytes(StandardCharsets.UTF_8));

        byte[] pathBytes = (API_VERSION + endpoint).getBytes(StandardCharsets.UTF_8);
        byte[] message = new byte[pathBytes.length + hash.length];
        System.arraycopy(pathBytes, 0, message, 0, pathBytes.length);
        System.arraycopy(hash, 0, message, pathBytes.length, hash.length);

        Mac hmac = Mac.getInstance("HmacSHA512");
        hmac.init(new SecretKeySpec(Base64.getDecoder().decode(apiSecret), "HmacSHA512"));
        return Base64.getEncoder().encodeToString(hmac.doFinal(message));
    }

    private static boolean hasErrors(JsonNode json) {
        return json.has("error") && json.get("error").size() > 0;
    }

    /**
     * Venue errors reject the order; service, rate limit and nonce errors are outages.
     * Source: https://support.kraken.com/articles/360001491786
     */
    private RuntimeException mapOrderError(String clientOrderId, JsonNode errors) {
        String errorCode = errors.get(0).asText();
        String description = switch (errorCode) {
            case "EOrder:Insufficient funds" ->
                "Insufficient funds. Check open orders locking funds and deposit holds";
            case "EOrder:Order minimum not met" -> "Order below minimum size";
            case "EOrder:Unknown order" -> "Order not found. May have been filled or cancelled";
            case "EAPI:Rate limit exceeded" -> "Rate limit exceeded";
            case "EAPI:Invalid nonce" -> "Invalid nonce. Clock sync issue detected";
            case "EService:Unavailable" -> "Kraken service temporarily unavailable";
            case "EGeneral:Temporary lockout" -> "Temporary lockout";
            default -> "Kraken error: " + errorCode;
        };
        logger.error("Kraken Order Error: {} ({})", errorCode, description);

        if (errorCode.startsWith("EService") || errorCode.startsWith("EAPI") || errorCode.startsWith("EGeneral")) {
            return new BrokerUnavailableException(BROKER_NAME, description);
        }
        return new OrderRejectedException(BROKER_NAME, clientOrderId, description);
    }

    private static String krakenOrderType(Order order) {
        return switch (order.type()) {
            case MARKET -> "market";
            case LIMIT -> "limit";
            case STOP_LOSS -> "stop-loss";
            case STOP_LIMIT -> "stop-loss-limit";
            case TAKE_PROFIT -> "take-profit";
        };
    }

    private static BigDecimal triggerPrice(Order order) {
        return order.stopPrice() != null ? order.stopPrice() : order.price();
    }

    static OrderStatus mapStatus(String krakenStatus, BigDecimal executed) {
        boolean partial = executed != null && executed.signum() > 0;
        return switch (krakenStatus) {
            case "pending" -> OrderStatus.PENDING;
            case "open" -> partial ? OrderStatus.PARTIALLY_FILLED : OrderStatus.OPEN;
            case "closed" -> OrderStatus.FILLED;
            case "canceled" -> OrderStatus.CANCELLED;
            case "expired" -> OrderStatus.EXPIRED;
            default -> OrderStatus.PENDING;
        };
    }

    private static BigDecimal decimalOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.asText().isBlank()) {
            return null;
        }
        return new BigDecimal(node.asText());
    }

    private static void requireClientOrderId(Order order) {
        if (!order.hasClientOrderId()) {
            throw new IllegalArgumentException("Order " + order.orderId() + " has no client order id");
        }
    }

    private static String rootMessage(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        return cause.getMessage();
    }

    // ==================== SYMBOL MAPPING ====================

    /**
     * Convert common symbol to Kraken format
     * BTC/USD -> XXBTZUSD
     * ETH/USD -> XETHZUSD
     */
    public static String toKrakenSymbol(String symbol) {
        return switch (symbol.toUpperCase(Locale.ROOT)) {
            case "BTC/USD", "BTCUSD", "XBTUSD" -> "XXBTZUSD";
            case "ETH/USD", "ETHUSD" -> "XETHZUSD";
            case "SOL/USD", "SOLUSD" -> "SOLUSD";
            case "DOGE/USD", "DOGEUSD" -> "XDGUSD";
            case "XRP/USD", "XRPUSD" -> "XXRPZUSD";
            case "ADA/USD", "ADAUSD" -> "ADAUSD";
            case "DOT/USD", "DOTUSD" -> "DOTUSD";
            case "AVAX/USD", "AVAXUSD" -> "AVAXUSD";
            default -> symbol.replace("/", "").toUpperCase(Locale.ROOT);
        };
    }

    static String toKrakenAsset(String currency) {
        return switch (currency.toUpperCase(Locale.ROOT)) {
            case "USD" -> "ZUSD";
            case "EUR" -> "ZEUR";
            case "BTC", "XBT" -> "XXBT";
            case "ETH" -> "XETH";
            case "XRP" -> "XXRP";
            case "DOGE" -> "XXDG";
            default -> currency.toUpperCase(Locale.ROOT);
        };
    }

    static String fromKrakenAsset(String asset) {
        return switch (asset) {
            case "XXBT", "XBT" -> "BTC";
            case "XETH" -> "ETH";
            case "XXRP" -> "XRP";
            case "XXDG", "XDG" -> "DOGE";
            default -> asset;
        };
    }

    private static boolean isFiat(String asset) {
        return asset.startsWith("Z") && asset.length() == 4 || asset.equals("USD") || asset.equals("USDT")
            || asset.equals("USDC") || asset.equals("EUR");
    }
}
