package com.algotrendy.gateway.broker;

import com.algotrendy.gateway.exception.BrokerUnavailableException;
import com.algotrendy.gateway.exception.InvalidConfigurationException;
import com.algotrendy.gateway.exception.OrderRejectedException;
import com.algotrendy.gateway.order.Order;
import com.algotrendy.gateway.order.OrderSide;
import com.algotrendy.gateway.order.OrderStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jsonwebtoken.Jwts;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.Security;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Coinbase Advanced Trade gateway 💰
 *
 * Authentication: JWT tokens with ES256 signing, one token per request.
 * Base URL: https://api.coinbase.com
 *
 * The client order id is sent as {@code client_order_id}; Coinbase deduplicates on it,
 * which backs up the gateway's own idempotency.
 *
 * @see <a href="https://docs.cdp.coinbase.com/advanced-trade/reference">API Docs</a>
 */
public class CoinbaseGateway implements BrokerGateway {
    private static final Logger logger = LoggerFactory.getLogger(CoinbaseGateway.class);

    public static final String BROKER_NAME = "coinbase";
    private static final String HOST = "api.coinbase.com";
    private static final String BASE_URL = "https://" + HOST;
    private static final String API_PREFIX = "/api/v3/brokerage";
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);

    private final String apiKeyName;
    private final PrivateKey privateKey;
    private final BrokerHttpClient http;
    private final RateLimitedConnector connector;
    private final ObjectMapper mapper;
    private final SecureRandom random = new SecureRandom();

    static {
        // Bouncy Castle provider for EC key handling
        Security.addProvider(new BouncyCastleProvider());
    }

    /**
     * @param apiKeyName    API key name from the Coinbase Developer Platform
     * @param privateKeyPem EC private key in PEM format (ES256); literal "\n" sequences are accepted
     */
    public CoinbaseGateway(String apiKeyName, String privateKeyPem, RateLimitedConnector connector,
                           HttpClient httpClient, ObjectMapper mapper) {
        if (apiKeyName == null || apiKeyName.isBlank()) {
            throw new InvalidConfigurationException("Coinbase API key name is required");
        }
        this.apiKeyName = apiKeyName;
        this.privateKey = parsePrivateKey(privateKeyPem);
        this.connector = connector;
        this.mapper = mapper;
        this.http = new BrokerHttpClient(BROKER_NAME, httpClient, mapper, connector);

        logger.info("💰 Coinbase gateway initialized (API Key: {}...)",
            apiKeyName.substring(0, Math.min(8, apiKeyName.length())));
    }

    /**
     * Parse EC private key from PEM format (SEC1 or PKCS#8).
     */
    static PrivateKey parsePrivateKey(String privateKeyPem) {
        if (privateKeyPem == null || privateKeyPem.isBlank()) {
            throw new InvalidConfigurationException("Coinbase private key is required");
        }
        String normalizedPem = privateKeyPem.replace("\\n", "\n");
        try (PEMParser parser = new PEMParser(new StringReader(normalizedPem))) {
            Object pemObject = parser.readObject();
            JcaPEMKeyConverter converter = new JcaPEMKeyConverter().setProvider("BC");

            if (pemObject instanceof PEMKeyPair keyPair) {
                return converter.getPrivateKey(keyPair.getPrivateKeyInfo());
            } else if (pemObject instanceof PrivateKeyInfo pkInfo) {
                return converter.getPrivateKey(pkInfo);
            }
            throw new InvalidConfigurationException("Unsupported Coinbase key format: "
                + (pemObject == null ? "empty" : pemObject.getClass().getSimpleName()));
        } catch (IOException e) {
            throw new InvalidConfigurationException("Invalid Coinbase private key: " + e.getMessage());
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

    // ==================== Lifecycle ====================

    @Override
    public CompletableFuture<Boolean> connect() {
        if (!connector.beginConnect()) {
            return CompletableFuture.completedFuture(connector.isConnected());
        }
        return request("GET", "/accounts", null)
            .thenApply(response -> {
                if (!response.isSuccess() || !response.body().has("accounts")) {
                    logger.error("❌ Coinbase connection failed: HTTP {}", response.statusCode());
                    connector.markDisconnected();
                    return false;
                }
                connector.markConnected();
                return true;
            })
            .exceptionally(ex -> {
                logger.error("❌ Coinbase connection failed: {}", ex.getMessage());
                connector.markDisconnected();
                return false;
            });
    }

    @Override
    public void disconnect() {
        connector.markDisconnected();
    }

    // ==================== Order APIs ====================

    @Override
    public CompletableFuture<BrokerOrderAck> placeOrder(Order order) {
        if (!order.hasClientOrderId()) {
            throw new IllegalArgumentException("Order " + order.orderId() + " has no client order id");
        }
        connector.ensureConnected();

        ObjectNode orderConfig;
        try {
            orderConfig = orderConfiguration(order);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(
                new OrderRejectedException(BROKER_NAME, order.clientOrderId(), e.getMessage()));
        }

        ObjectNode body = mapper.createObjectNode();
        body.put("client_order_id", order.clientOrderId());
        body.put("product_id", toProductId(order.symbol()));
        body.put("side", order.side() == OrderSide.BUY ? "BUY" : "SELL");
        body.set("order_configuration", orderConfig);

        logger.info("📤 Placing {} {} order: {} {} (clientOrderId={})", body.get("side").asText(),
            order.type(), order.quantity().toPlainString(), body.get("product_id").asText(), order.clientOrderId());

        return request("POST", "/orders", body)
            .thenApply(response -> {
                JsonNode result = response.body();
                if (response.isSuccess() && result.path("success").asBoolean()) {
                    String orderId = result.path("success_response").path("order_id")
                        .asText(result.path("order_id").asText(null));
                    logger.info("✅ Order placed: {}", orderId);
                    return BrokerOrderAck.accepted(order.clientOrderId(), orderId, OrderStatus.OPEN);
                }
                String reason = result.path("error_response").path("message")
                    .asText(result.path("error_response").path("error").asText("HTTP " + response.statusCode()));
                logger.error("❌ Order failed: {}", reason);
                throw new CompletionException(new OrderRejectedException(BROKER_NAME, order.clientOrderId(), reason));
            });
    }

    private ObjectNode orderConfiguration(Order order) {
        ObjectNode orderConfig = mapper.createObjectNode();
        String baseSize = order.quantity().toPlainString();
        switch (order.type()) {
            case MARKET -> {
                ObjectNode marketIoc = orderConfig.putObject("market_market_ioc");
                marketIoc.put("base_size", baseSize);
            }
            case LIMIT -> {
                ObjectNode limitGtc = orderConfig.putObject("limit_limit_gtc");
                limitGtc.put("base_size", baseSize);
                limitGtc.put("limit_price", order.price().toPlainString());
                limitGtc.put("post_only", false);
            }
            case STOP_LIMIT -> {
                ObjectNode stopLimit = orderConfig.putObject("stop_limit_stop_limit_gtc");
                stopLimit.put("base_size", baseSize);
                stopLimit.put("limit_price", order.price().toPlainString());
                stopLimit.put("stop_price", order.stopPrice().toPlainString());
                stopLimit.put("stop_direction", order.side() == OrderSide.BUY
                    ? "STOP_DIRECTION_STOP_UP" : "STOP_DIRECTION_STOP_DOWN");
            }
            case STOP_LOSS, TAKE_PROFIT ->
                throw new IllegalArgumentException("Order type " + order.type() + " is not supported by Coinbase");
        }
        return orderConfig;
    }

    @Override
    public CompletableFuture<BrokerOrderAck> cancelOrder(String exchangeOrderId, String symbol) {
        connector.ensureConnected();

        ObjectNode body = mapper.createObjectNode();
        body.putArray("order_ids").add(exchangeOrderId);

        return request("POST", "/orders/batch_cancel", body)
            .thenApply(response -> {
                JsonNode first = response.body().path("results").path(0);
                if (response.isSuccess() && first.path("success").asBoolean()) {
                    return BrokerOrderAck.accepted(null, exchangeOrderId, OrderStatus.CANCELLED);
                }
                String reason = first.path("failure_reason").asText("HTTP " + response.statusCode());
                throw new CompletionException(new OrderRejectedException(BROKER_NAME, null,
                    "Cancel of " + exchangeOrderId + " failed: " + reason));
            });
    }

    @Override
    public CompletableFuture<BrokerOrderAck> getOrderStatus(String exchangeOrderId, String symbol) {
        connector.ensureConnected();

        return request("GET", "/orders/historical/" + exchangeOrderId, null)
            .thenApply(response -> {
                JsonNode order = response.body().path("order");
                if (!response.isSuccess() || order.isMissingNode()) {
                    throw new CompletionException(new BrokerUnavailableException(BROKER_NAME,
                        "Order " + exchangeOrderId + " lookup failed: HTTP " + response.statusCode()));
                }
                BigDecimal filled = decimalOrNull(order.path("filled_size"));
                BigDecimal avgPrice = decimalOrNull(order.path("average_filled_price"));
                if (avgPrice != null && avgPrice.signum() == 0) {
                    avgPrice = null;
                }
                return new BrokerOrderAck(order.path("client_order_id").asText(null), exchangeOrderId,
                    mapStatus(order.path("status").asText(), filled), filled, avgPrice, Instant.now());
            });
    }

    // ==================== Account & Balance APIs ====================

    @Override
    public CompletableFuture<BigDecimal> getBalance(String currency) {
        connector.ensureConnected();

        return accounts().thenApply(accounts -> {
            for (JsonNode account : accounts) {
                if (currency.equalsIgnoreCase(account.path("currency").asText())) {
                    BigDecimal value = decimalOrNull(account.path("available_balance").path("value"));
                    return value != null ? value : BigDecimal.ZERO;
                }
            }
            return BigDecimal.ZERO;
        });
    }

    @Override
    public CompletableFuture<List<Position>> getPositions() {
        connector.ensureConnected();

        return accounts().thenCompose(accounts -> {
            List<CompletableFuture<Position>> pending = new ArrayList<>();
            for (JsonNode account : accounts) {
                String currency = account.path("currency").asText();
                BigDecimal available = decimalOrZero(account.path("available_balance").path("value"));
                BigDecimal held = decimalOrZero(account.path("hold").path("value"));
                BigDecimal total = available.add(held);

                // Skip cash and dust
                if ("USD".equals(currency) || "USDC".equals(currency) || total.compareTo(new BigDecimal("0.00001")) < 0) {
                    continue;
                }
                String productId = currency + "-USD";
                pending.add(getMarketPrice(productId).thenApply(price ->
                    new Position(productId, total, null, price, total.multiply(price), null)));
            }
            return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                .thenApply(v -> pending.stream().map(CompletableFuture::join).toList());
        });
    }

    /**
     * Mid price from the best bid/ask.
     */
    @Override
    public CompletableFuture<BigDecimal> getMarketPrice(String symbol) {
        connector.ensureConnected();
        String productId = toProductId(symbol);

        return request("GET", "/best_bid_ask?product_ids=" + productId, null)
            .thenApply(response -> {
                for (JsonNode pricebook : response.body().path("pricebooks")) {
                    if (productId.equals(pricebook.path("product_id").asText())) {
                        BigDecimal bid = new BigDecimal(pricebook.path("bids").path(0).path("price").asText("0"));
                        BigDecimal ask = new BigDecimal(pricebook.path("asks").path(0).path("price").asText("0"));
                        return bid.add(ask).divide(BigDecimal.valueOf(2), 8, RoundingMode.HALF_EVEN);
                    }
                }
                throw new CompletionException(new BrokerUnavailableException(BROKER_NAME, "No price for " + productId));
            });
    }

    private CompletableFuture<JsonNode> accounts() {
        return request("GET", "/accounts", null)
            .thenApply(response -> {
                if (!response.isSuccess() || !response.body().has("accounts")) {
                    throw new CompletionException(new BrokerUnavailableException(BROKER_NAME,
                        "Account listing failed: HTTP " + response.statusCode()));
                }
                return response.body().get("accounts");
            });
    }

    // ==================== Transport ====================

    private CompletableFuture<BrokerHttpClient.JsonResponse> request(String method, String path, JsonNode body) {
        String fullPath = API_PREFIX + path;
        // JWT uri claim excludes the query string
        String pathOnly = fullPath.contains("?") ? fullPath.substring(0, fullPath.indexOf('?')) : fullPath;

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(BASE_URL + fullPath))
            .header("Authorization", "Bearer " + generateJwt(method, pathOnly))
            .header("Content-Type", "application/json")
            .timeout(REQUEST_TIMEOUT);

        if ("POST".equals(method)) {
            try {
                builder.POST(HttpRequest.BodyPublishers.ofString(body != null ? mapper.writeValueAsString(body) : ""));
            } catch (JsonProcessingException e) {
                return CompletableFuture.failedFuture(e);
            }
        } else if ("DELETE".equals(method)) {
            builder.DELETE();
        } else {
            builder.GET();
        }
        return http.send(builder.build());
    }

    /**
     * ES256 JWT for one request. URI claim format: "METHOD host+path".
     */
    String generateJwt(String method, String path) {
        long now = Instant.now().getEpochSecond();
        return Jwts.builder()
            .subject(apiKeyName)
            .issuer("cdp")
            .notBefore(java.util.Date.from(Instant.ofEpochSecond(now)))
            .expiration(java.util.Date.from(Instant.ofEpochSecond(now + 120)))
            .claim("uri", method + " " + HOST + path)
            .header()
                .add("kid", apiKeyName)
                .add("nonce", generateNonce())
                .and()
            .signWith(privateKey, Jwts.SIG.ES256)
            .compact();
    }

    private String generateNonce() {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    // ==================== Mapping ====================

    /**
     * BTC/USD, BTCUSD and BTC-USD all map to BTC-USD.
     */
    public static String toProductId(String symbol) {
        String upper = symbol.toUpperCase(Locale.ROOT);
        if (upper.contains("-")) {
            return upper;
        }
        if (upper.contains("/")) {
            return upper.replace('/', '-');
        }
        for (String quote : List.of("USDC", "USDT", "USD", "EUR", "GBP")) {
            if (upper.endsWith(quote) && upper.length() > quote.length()) {
                return upper.substring(0, upper.length() - quote.length()) + "-" + quote;
            }
        }
        return upper;
    }

    static OrderStatus mapStatus(String status, BigDecimal filled) {
        boolean partial = filled != null && filled.signum() > 0;
        return switch (status) {
            case "PENDING", "QUEUED" -> OrderStatus.PENDING;
            case "OPEN" -> partial ? OrderStatus.PARTIALLY_FILLED : OrderStatus.OPEN;
            case "FILLED" -> OrderStatus.FILLED;
            case "CANCELLED", "CANCEL_QUEUED" -> OrderStatus.CANCELLED;
            case "EXPIRED" -> OrderStatus.EXPIRED;
            case "FAILED" -> OrderStatus.REJECTED;
            default -> OrderStatus.PENDING;
        };
    }

    private static BigDecimal decimalOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.asText().isBlank()) {
            return null;
        }
        return new BigDecimal(node.asText());
    }

    private static BigDecimal decimalOrZero(JsonNode node) {
        BigDecimal value = decimalOrNull(node);
        return value != null ? value : BigDecimal.ZERO;
    }
}
