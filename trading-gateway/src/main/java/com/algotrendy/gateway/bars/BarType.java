package com.algotrendy.gateway.bars;

public enum BarType {
    TICK,
    RANGE,
    RENKO
}
