package com.algotrendy.gateway.channel;

import java.util.List;

/**
 * Receives the candles each channel delivers in a fetch cycle.
 */
@FunctionalInterface
public interface MarketDataListener {

    void onMarketData(String exchange, List<MarketData> records);
}
