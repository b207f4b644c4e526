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
import java.math.RoundingMode;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * BINANCE GATEWAY
 *
 * Spot trading via the Binance REST API.
 *
 * Features:
 * - HMAC-SHA256 query signing (X-MBX-APIKEY header)
 * - Client order id forwarded as {@code newClientOrderId}
 * - Testnet or live base URL
 */
public class BinanceGateway implements BrokerGateway {
    private static final Logger logger = LoggerFactory.getLogger(BinanceGateway.class);

    public static final String BROKER_NAME = "binance";
    public static final String LIVE_URL = "https://api.binance.com";
    public static final String TESTNET_URL = "https://testnet.binance.vision";
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);
    private static final long RECV_WINDOW_MS = 5000;

    private static final Set<String> STABLE_QUOTES = Set.of("USDT", "USDC", "BUSD", "FDUSD");

    private final String apiKey;
    private final String apiSecret;
    private final String baseUrl;
    private final BrokerHttpClient http;
    private final RateLimitedConnector connector;

    public BinanceGateway(String apiKey, String apiSecret, boolean testnet, RateLimitedConnector connector,
                          HttpClient httpClient, ObjectMapper objectMapper) {
        this.apiKey = apiKey;
        this.apiSecret = apiSecret;
        this.baseUrl = testnet ? TESTNET_URL : LIVE_URL;
        this.connector = connector;
        this.http = new BrokerHttpClient(BROKER_NAME, httpClient, objectMapper, connector);

        if (isConfigured()) {
            logger.info("Binance gateway initialized ({}, API Key: {}...)", testnet ? "TESTNET" : "LIVE",
                apiKey.substring(0, Math.min(8, apiKey.length())));
        } else {
            logger.warn("⚠️ Binance API keys not configured. Set BINANCE_API_KEY and BINANCE_API_SECRET.");
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
            logger.error("❌ Cannot connect to Binance: API keys not configured");
            connector.markDisconnected();
            return CompletableFuture.completedFuture(false);
        }

        return signedRequest("GET", "/api/v3/account", Map.of())
            .thenApply(response -> {
                if (!response.isSuccess()) {
                    logger.error("❌ Binance connection failed: {}", errorMessage(response));
                    connector.markDisconnected();
                    return false;
                }
                connector.markConnected();
                return true;
            })
            .exceptionally(ex -> {
                logger.error("❌ Binance connection failed: {}", ex.getMessage());
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
        if (!order.hasClientOrderId()) {
            throw new IllegalArgumentException("Order " + order.orderId() + " has no client order id");
        }
        connector.ensureConnected();

        String symbol = toBinanceSymbol(order.symbol());
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("side", order.side() == OrderSide.BUY ? "BUY" : "SELL");
        params.put("quantity", order.quantity().toPlainString());
        switch (order.type()) {
            case MARKET -> params.put("type", "MARKET");
            case LIMIT -> {
                params.put("type", "LIMIT");
                params.put("timeInForce", "GTC");
                params.put("price", order.price().toPlainString());
            }
            case STOP_LOSS -> {
                params.put("type", "STOP_LOSS");
                params.put("stopPrice", order.stopPrice().toPlainString());
            }
            case STOP_LIMIT -> {
                params.put("type", "STOP_LOSS_LIMIT");
                params.put("timeInForce", "GTC");
                params.put("price", order.price().toPlainString());
                params.put("stopPrice", order.stopPrice().toPlainString());
            }
            case TAKE_PROFIT -> {
                params.put("type", "TAKE_PROFIT");
                params.put("stopPrice", order.stopPrice().toPlainString());
            }
        }
        params.put("newClientOrderId", order.clientOrderId());
        params.put("newOrderRespType", "RESULT");

        logger.info("📤 Placing Binance {} {} order: {} {} (clientOrderId={})", params.get("side"),
            params.get("type"), order.quantity().toPlainString(), symbol, order.clientOrderId());

        return signedRequest("POST", "/api/v3/order", params)
            .thenApply(response -> {
                if (!response.isSuccess()) {
                    throw new CompletionException(mapOrderError(order.clientOrderId(), response));
                }
                BrokerOrderAck ack = toAck(response.body());
                logger.info("✅ Binance Order Placed: {} -> {}", order.clientOrderId(), ack.exchangeOrderId());
                return ack;
            });
    }

    @Override
    public CompletableFuture<BrokerOrderAck> cancelOrder(String exchangeOrderId, String symbol) {
        connector.ensureConnected();

        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toBinanceSymbol(symbol));
        params.put("orderId", exchangeOrderId);

        return signedRequest("DELETE", "/api/v3/order", params)
            .thenApply(response -> {
                if (!response.isSuccess()) {
                    throw new CompletionException(mapOrderError(null, response));
                }
                return toAck(response.body());
            });
    }

    @Override
    public CompletableFuture<BrokerOrderAck> getOrderStatus(String exchangeOrderId, String symbol) {
        connector.ensureConnected();

        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toBinanceSymbol(symbol));
        params.put("orderId", exchangeOrderId);

        return signedRequest("GET", "/api/v3/order", params)
            .thenApply(response -> {
                if (!response.isSuccess()) {
                    throw new CompletionException(new BrokerUnavailableException(BROKER_NAME,
                        "Order " + exchangeOrderId + " lookup failed: " + errorMessage(response)));
                }
                return toAck(response.body());
            });
    }

    // ==================== ACCOUNT ====================

    @Override
    public CompletableFuture<BigDecimal> getBalance(String currency) {
        connector.ensureConnected();

        return balances().thenApply(balances -> {
            for (JsonNode balance : balances) {
                if (currency.equalsIgnoreCase(balance.path("asset").asText())) {
                    return new BigDecimal(balance.path("free").asText("0"));
                }
            }
            return BigDecimal.ZERO;
        });
    }

    @Override
    public CompletableFuture<List<Position>> getPositions() {
        connector.ensureConnected();

        return balances().thenCompose(balances -> {
            List<CompletableFuture<Position>> pending = new ArrayList<>();
            for (JsonNode balance : balances) {
                String asset = balance.path("asset").asText();
                BigDecimal total = new BigDecimal(balance.path("free").asText("0"))
                    .add(new BigDecimal(balance.path("locked").asText("0")));
                if (total.signum() <= 0 || STABLE_QUOTES.contains(asset) || "USD".equals(asset)) {
                    continue;
                }
                String symbol = asset + "USDT";
                pending.add(getMarketPrice(symbol).thenApply(price ->
                    new Position(symbol, total, null, price, total.multiply(price), null)));
            }
            return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                .thenApply(v -> pending.stream().map(CompletableFuture::join).toList());
        });
    }

    @Override
    public CompletableFuture<BigDecimal> getMarketPrice(String symbol) {
        connector.ensureConnected();
        String binanceSymbol = toBinanceSymbol(symbol);

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/api/v3/ticker/price?symbol=" + binanceSymbol))
            .timeout(REQUEST_TIMEOUT)
            .GET()
            .build();
        return http.send(request).thenApply(response -> {
            if (!response.isSuccess() || !response.body().has("price")) {
                throw new CompletionException(new BrokerUnavailableException(BROKER_NAME,
                    "Ticker failed for " + binanceSymbol + ": " + errorMessage(response)));
            }
            return new BigDecimal(response.body().get("price").asText());
        });
    }

    private CompletableFuture<JsonNode> balances() {
        return signedRequest("GET", "/api/v3/account", Map.of())
            .thenApply(response -> {
                if (!response.isSuccess()) {
                    throw new CompletionException(new BrokerUnavailableException(BROKER_NAME,
                        "Account lookup failed: " + errorMessage(response)));
                }
                return response.body().path("balances");
            });
    }

    // ==================== HELPER METHODS ====================

    private CompletableFuture<BrokerHttpClient.JsonResponse> signedRequest(String method, String path,
                                                                          Map<String, String> params) {
        StringBuilder query = new StringBuilder();
        params.forEach((key, value) -> query.append(key).append('=')
            .append(URLEncoder.encode(value, StandardCharsets.UTF_8)).append('&'));
        query.append("recvWindow=").append(RECV_WINDOW_MS)
            .append("&timestamp=").append(System.currentTimeMillis());

        String signature;
        try {
            signature = sign(query.toString());
        } catch (GeneralSecurityException e) {
            return CompletableFuture.failedFuture(
                new BrokerUnavailableException(BROKER_NAME, "Request signing failed", e));
        }

        URI uri = URI.create(baseUrl + path + "?" + query + "&signature=" + signature);
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(REQUEST_TIMEOUT)
            .header("X-MBX-APIKEY", apiKey);
        switch (method) {
            case "POST" -> builder.POST(HttpRequest.BodyPublishers.noBody());
            case "DELETE" -> builder.DELETE();
            default -> builder.GET();
        }
        return http.send(builder.build());
    }

    /**
     * Hex HMAC-SHA256 of the query string with the API secret.
     */
    String sign(String data) throws GeneralSecurityException {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(apiSecret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return HexFormat.of().formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
    }

    private static BrokerOrderAck toAck(JsonNode json) {
        BigDecimal executed = decimalOrNull(json.path("executedQty"));
        BigDecimal quoteQty = decimalOrNull(json.path("cummulativeQuoteQty"));
        BigDecimal avgPrice = null;
        if (executed != null && executed.signum() > 0 && quoteQty != null) {
            avgPrice = quoteQty.divide(executed, 8, RoundingMode.HALF_EVEN);
        }
        return new BrokerOrderAck(json.path("clientOrderId").asText(null), json.path("orderId").asText(null),
            mapStatus(json.path("status").asText()), executed, avgPrice, Instant.now());
    }

    /**
     * Binance error codes: -1xxx are request/server problems, -2010 is a new order reject.
     */
    private RuntimeException mapOrderError(String clientOrderId, BrokerHttpClient.JsonResponse response) {
        int code = response.body().path("code").asInt(0);
        String message = errorMessage(response);
        logger.error("Binance Order Error: {} ({})", code, message);

        if (code <= -1000 && code > -2000 && code != -1013 && code != -1111) {
            return new BrokerUnavailableException(BROKER_NAME, message);
        }
        return new OrderRejectedException(BROKER_NAME, clientOrderId, message);
    }

    private static String errorMessage(BrokerHttpClient.JsonResponse response) {
        return response.body().path("msg").asText("HTTP " + response.statusCode());
    }

    static OrderStatus mapStatus(String status) {
        return switch (status) {
            case "NEW" -> OrderStatus.OPEN;
            case "PARTIALLY_FILLED" -> OrderStatus.PARTIALLY_FILLED;
            case "FILLED" -> OrderStatus.FILLED;
            case "CANCELED", "PENDING_CANCEL" -> OrderStatus.CANCELLED;
            case "REJECTED" -> OrderStatus.REJECTED;
            case "EXPIRED", "EXPIRED_IN_MATCH" -> OrderStatus.EXPIRED;
            default -> OrderStatus.PENDING;
        };
    }

    private static BigDecimal decimalOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.asText().isBlank()) {
            return null;
        }
        return new BigDecimal(node.asText());
    }

    /**
     * BTC/USDT, BTC-USDT and btcusdt all map to BTCUSDT.
     */
    public static String toBinanceSymbol(String symbol) {
        return symbol.replace("/", "").replace("-", "").toUpperCase(Locale.ROOT);
    }
}
