package com.algotrendy.gateway.channel;

import com.algotrendy.gateway.exception.DataUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Kraken OHLC candles from {@code /0/public/OHLC}.
 *
 * Rows are {@code [time, open, high, low, close, vwap, volume, count]}; the VWAP is kept
 * in the candle metadata. Kraken pair names are normalized (XXBTZUSD -> BTCUSD).
 */
public class KrakenChannel extends AbstractRestChannel {

    public static final String EXCHANGE = "kraken";
    static final String BASE_URL = "https://api.kraken.com";

    private static final List<String> DEFAULT_SYMBOLS = List.of(
        "XXBTZUSD", "XETHZUSD", "SOLUSD", "ADAUSD", "XXRPZUSD",
        "DOGEUSD", "DOTUSD", "MATICUSD", "AVAXUSD", "LINKUSD");

    private static final Map<String, String> SYMBOL_MAP = Map.of(
        "XXBTZUSD", "BTCUSD",
        "XETHZUSD", "ETHUSD",
        "XXRPZUSD", "XRPUSD");

    private static final int[] VALID_INTERVALS = {1, 5, 15, 30, 60, 240, 1440, 10080, 21600};

    public KrakenChannel(HttpClient httpClient, ObjectMapper mapper) {
        // Public endpoints: roughly one call per second
        super(EXCHANGE, httpClient, mapper, 1);
    }

    @Override
    protected String pingUrl() {
        return BASE_URL + "/0/public/Time";
    }

    @Override
    protected List<String> defaultSymbols() {
        return DEFAULT_SYMBOLS;
    }

    @Override
    protected List<MarketData> fetchSymbol(String symbol, String interval, int limit) {
        int krakenInterval = nearest(intervalMinutes(interval), VALID_INTERVALS);
        JsonNode root = getJson(BASE_URL + "/0/public/OHLC?pair=" + symbol + "&interval=" + krakenInterval);

        JsonNode errors = root.path("error");
        if (errors.isArray() && errors.size() > 0) {
            throw new DataUnavailableException(EXCHANGE, "API error for " + symbol + ": " + errors);
        }

        // Data sits under the pair name Kraken chooses, next to "last"
        JsonNode rows = null;
        Iterator<Map.Entry<String, JsonNode>> fields = root.path("result").fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            if (!"last".equals(entry.getKey()) && entry.getValue().isArray()) {
                rows = entry.getValue();
                break;
            }
        }
        if (rows == null) {
            return List.of();
        }

        String standardSymbol = SYMBOL_MAP.getOrDefault(symbol, symbol);
        List<MarketData> candles = new ArrayList<>();
        int skip = Math.max(0, rows.size() - limit);
        for (int i = skip; i < rows.size(); i++) {
            JsonNode row = rows.get(i);
            var metadata = mapper.createObjectNode().put("vwap", row.get(5).asText());
            candles.add(new MarketData(
                standardSymbol,
                EXCHANGE,
                Instant.ofEpochSecond(row.get(0).asLong()),
                decimal(row.get(1)),
                decimal(row.get(2)),
                decimal(row.get(3)),
                decimal(row.get(4)),
                decimal(row.get(6)),
                null,
                row.get(7).asLong(),
                metadata.toString()));
        }
        return candles;
    }
}
