package com.algotrendy.gateway.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Coinbase Exchange candles from {@code /products/{id}/candles}.
 *
 * Rows are {@code [time, low, high, open, close, volume]}, newest first. The request
 * window is {@code limit} candles back from now at the nearest supported granularity.
 */
public class CoinbaseChannel extends AbstractRestChannel {

    public static final String EXCHANGE = "coinbase";
    static final String BASE_URL = "https://api.exchange.coinbase.com";
    private static final int MAX_CANDLES = 300;

    private static final List<String> DEFAULT_SYMBOLS = List.of(
        "BTC-USD", "ETH-USD", "SOL-USD", "ADA-USD", "XRP-USD",
        "DOGE-USD", "DOT-USD", "MATIC-USD", "AVAX-USD", "LINK-USD");

    private static final int[] GRANULARITIES = {60, 300, 900, 3600, 21600, 86400};

    public CoinbaseChannel(HttpClient httpClient, ObjectMapper mapper) {
        // Public endpoints: 10 requests per second
        super(EXCHANGE, httpClient, mapper, 10);
    }

    @Override
    protected String pingUrl() {
        return BASE_URL + "/time";
    }

    @Override
    protected List<String> defaultSymbols() {
        return DEFAULT_SYMBOLS;
    }

    static int granularitySeconds(String interval) {
        return nearest(intervalMinutes(interval) * 60, GRANULARITIES);
    }

    @Override
    protected List<MarketData> fetchSymbol(String symbol, String interval, int limit) {
        int granularity = granularitySeconds(interval);
        int count = Math.min(limit, MAX_CANDLES);
        Instant end = Instant.now();
        Instant start = end.minusSeconds((long) granularity * count);

        JsonNode rows = getJson(BASE_URL + "/products/" + symbol + "/candles?granularity=" + granularity
            + "&start=" + start + "&end=" + end);

        List<MarketData> candles = new ArrayList<>();
        for (JsonNode row : rows) {
            candles.add(MarketData.of(
                symbol,
                EXCHANGE,
                Instant.ofEpochSecond(row.get(0).asLong()),
                decimal(row.get(3)),
                decimal(row.get(2)),
                decimal(row.get(1)),
                decimal(row.get(4)),
                decimal(row.get(5))));
        }
        candles.sort(Comparator.comparing(MarketData::timestamp));
        return candles;
    }
}
