package com.algotrendy.gateway.channel;

import java.time.Duration;
import java.util.List;

/**
 * Summary of one fetch cycle across all channels.
 */
public record CycleReport(List<ChannelCycleResult> results, Duration elapsed) {

    public CycleReport {
        results = List.copyOf(results);
    }

    public int totalRecords() {
        return results.stream().mapToInt(ChannelCycleResult::records).sum();
    }

    public long successfulChannels() {
        return results.stream().filter(ChannelCycleResult::success).count();
    }

    public List<String> failedChannels() {
        return results.stream()
            .filter(result -> !result.success())
            .map(ChannelCycleResult::channel)
            .toList();
    }
}
