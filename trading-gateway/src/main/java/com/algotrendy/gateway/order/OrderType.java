package com.algotrendy.gateway.order;

public enum OrderType {
    MARKET,
    LIMIT,
    STOP_LOSS,
    STOP_LIMIT,
    TAKE_PROFIT;

    public boolean requiresPrice() {
        return this == LIMIT || this == STOP_LIMIT;
    }

    public boolean requiresStopPrice() {
        return this == STOP_LOSS || this == STOP_LIMIT;
    }
}
