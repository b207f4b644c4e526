package com.algotrendy.gateway.channel;

import java.time.Instant;
import java.util.Set;

/**
 * Point-in-time status of one channel.
 *
 * @param lastDataReceivedAt null until the first candles arrive
 */
public record ChannelHealth(
    String channel,
    boolean connected,
    Set<String> subscribedSymbols,
    Instant lastDataReceivedAt,
    long totalMessagesReceived
) {
}
