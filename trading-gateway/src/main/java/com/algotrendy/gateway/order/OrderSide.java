package com.algotrendy.gateway.order;

public enum OrderSide {
    BUY,
    SELL
}
