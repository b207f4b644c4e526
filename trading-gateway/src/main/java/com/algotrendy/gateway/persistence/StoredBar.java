package com.algotrendy.gateway.persistence;

import com.algotrendy.gateway.bars.BarType;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A bar read back from storage: the common OHLCV columns plus the type-specific
 * fields as JSON (tick counts, threshold, brick size and so on).
 */
public record StoredBar(
    String symbol,
    BarType barType,
    String source,
    Instant timestamp,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume,
    BigDecimal quoteVolume,
    JsonNode details
) {
}
