package com.algotrendy.gateway.channel;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Market data source for one exchange.
 */
public interface ChannelConnector {

    String exchangeName();

    boolean isConnected();

    Set<String> subscribedSymbols();

    Optional<Instant> lastDataReceivedAt();

    long totalMessagesReceived();

    /**
     * Verify connectivity and mark the channel connected. Calling it again is a no-op.
     *
     * @throws com.algotrendy.gateway.exception.DataUnavailableException if the venue is unreachable
     */
    void start();

    /**
     * Drop subscriptions and mark the channel disconnected. Idempotent.
     */
    void stop();

    /**
     * @throws com.algotrendy.gateway.exception.NotConnectedException before {@link #start()}
     */
    void subscribe(List<String> symbols);

    void unsubscribe(List<String> symbols);

    /**
     * Fetch recent candles. A null or empty symbol list means the subscribed symbols, or the
     * channel's default set when nothing is subscribed. Symbols that fail are logged and skipped.
     *
     * @throws com.algotrendy.gateway.exception.DataUnavailableException when every symbol failed
     */
    FetchResult fetchData(List<String> symbols, String interval, int limit);
}
