package com.algotrendy.gateway.channel;

import com.algotrendy.gateway.exception.DataUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * OKX candles from {@code /api/v5/market/candles}.
 *
 * Responses are wrapped as {@code {code, msg, data}} with {@code code == "0"} on success.
 * Rows are {@code [ts, o, h, l, c, vol, volCcy, volCcyQuote, confirm]}, newest first.
 */
public class OkxChannel extends AbstractRestChannel {

    public static final String EXCHANGE = "okx";
    static final String BASE_URL = "https://www.okx.com";
    private static final int MAX_LIMIT = 100;

    private static final List<String> DEFAULT_SYMBOLS = List.of(
        "BTC-USDT", "ETH-USDT", "SOL-USDT", "ADA-USDT", "XRP-USDT",
        "DOGE-USDT", "DOT-USDT", "MATIC-USDT", "AVAX-USDT", "LINK-USDT");

    private static final Map<String, String> INTERVAL_MAP = Map.of(
        "1m", "1m",
        "5m", "5m",
        "15m", "15m",
        "30m", "30m",
        "1h", "1H",
        "4h", "4H",
        "1d", "1D",
        "1w", "1W");

    public OkxChannel(HttpClient httpClient, ObjectMapper mapper) {
        // 20 requests per 2 seconds
        super(EXCHANGE, httpClient, mapper, 10);
    }

    @Override
    protected String pingUrl() {
        return BASE_URL + "/api/v5/public/time";
    }

    @Override
    protected List<String> defaultSymbols() {
        return DEFAULT_SYMBOLS;
    }

    static String toOkxBar(String interval) {
        return INTERVAL_MAP.getOrDefault(interval.toLowerCase(Locale.ROOT), "1m");
    }

    @Override
    protected List<MarketData> fetchSymbol(String symbol, String interval, int limit) {
        JsonNode root = getJson(BASE_URL + "/api/v5/market/candles?instId=" + symbol
            + "&bar=" + toOkxBar(interval) + "&limit=" + Math.min(limit, MAX_LIMIT));

        if (!"0".equals(root.path("code").asText())) {
            throw new DataUnavailableException(EXCHANGE,
                "API error for " + symbol + ": " + root.path("msg").asText());
        }

        List<MarketData> candles = new ArrayList<>();
        for (JsonNode row : root.path("data")) {
            var metadata = mapper.createObjectNode().put("confirmed", "1".equals(row.path(8).asText()));
            candles.add(new MarketData(
                symbol,
                EXCHANGE,
                Instant.ofEpochMilli(row.get(0).asLong()),
                decimal(row.get(1)),
                decimal(row.get(2)),
                decimal(row.get(3)),
                decimal(row.get(4)),
                decimal(row.get(5)),
                decimal(row.get(7)),
                null,
                metadata.toString()));
        }
        Collections.reverse(candles);
        return candles;
    }
}
