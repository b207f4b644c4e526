package com.algotrendy.gateway.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Binance spot klines from {@code /api/v3/klines}.
 *
 * Rows are {@code [openTime, open, high, low, close, volume, closeTime, quoteVolume, trades, ...]}.
 */
public class BinanceChannel extends AbstractRestChannel {

    public static final String EXCHANGE = "binance";
    static final String BASE_URL = "https://api.binance.com";
    private static final int MAX_LIMIT = 1000;

    private static final List<String> DEFAULT_SYMBOLS = List.of(
        "BTCUSDT", "ETHUSDT", "BNBUSDT", "SOLUSDT", "ADAUSDT",
        "XRPUSDT", "DOGEUSDT", "DOTUSDT", "MATICUSDT", "AVAXUSDT");

    public BinanceChannel(HttpClient httpClient, ObjectMapper mapper) {
        // 1200 request weight per minute; klines cost 1-2
        super(EXCHANGE, httpClient, mapper, 10);
    }

    @Override
    protected String pingUrl() {
        return BASE_URL + "/api/v3/ping";
    }

    @Override
    protected List<String> defaultSymbols() {
        return DEFAULT_SYMBOLS;
    }

    @Override
    protected List<MarketData> fetchSymbol(String symbol, String interval, int limit) {
        JsonNode rows = getJson(BASE_URL + "/api/v3/klines?symbol=" + symbol
            + "&interval=" + interval + "&limit=" + Math.min(limit, MAX_LIMIT));

        List<MarketData> candles = new ArrayList<>();
        for (JsonNode row : rows) {
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
                row.get(8).asLong(),
                null));
        }
        return candles;
    }
}
