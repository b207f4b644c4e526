package com.algotrendy.gateway.channel;

import java.util.List;

/**
 * Outcome of one successful fetch: either candles or an explicit "nothing new".
 * Failures are reported by exception, never by an empty result.
 */
public record FetchResult(Status status, List<MarketData> records, int failedSymbols) {

    public enum Status {
        OK,
        EMPTY
    }

    public FetchResult {
        records = List.copyOf(records);
    }

    public static FetchResult of(List<MarketData> records, int failedSymbols) {
        return new FetchResult(records.isEmpty() ? Status.EMPTY : Status.OK, records, failedSymbols);
    }

    public static FetchResult empty() {
        return new FetchResult(Status.EMPTY, List.of(), 0);
    }

    public boolean isEmpty() {
        return status == Status.EMPTY;
    }

    public int size() {
        return records.size();
    }
}
