package com.algotrendy.gateway.channel;

/**
 * Outcome of one channel in one fetch cycle.
 *
 * @param records records persisted; 0 for an empty fetch or a failure
 * @param error   failure message, null on success
 */
public record ChannelCycleResult(String channel, int records, boolean success, String error) {

    public static ChannelCycleResult ok(String channel, int records) {
        return new ChannelCycleResult(channel, records, true, null);
    }

    public static ChannelCycleResult failed(String channel, String error) {
        return new ChannelCycleResult(channel, 0, false, error);
    }
}
