package com.algotrendy.gateway.broker;

import java.math.BigDecimal;

/**
 * Open holding reported by a broker.
 */
public record Position(
    String symbol,
    BigDecimal quantity,
    BigDecimal averageEntryPrice,
    BigDecimal currentPrice,
    BigDecimal marketValue,
    BigDecimal unrealizedPnl
) {}
