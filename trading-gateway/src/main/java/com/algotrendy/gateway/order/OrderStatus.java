package com.algotrendy.gateway.order;

/**
 * Order lifecycle. FILLED, CANCELLED, REJECTED and EXPIRED are terminal.
 */
public enum OrderStatus {
    PENDING,
    OPEN,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED,
    EXPIRED;

    public boolean isTerminal() {
        return switch (this) {
            case FILLED, CANCELLED, REJECTED, EXPIRED -> true;
            case PENDING, OPEN, PARTIALLY_FILLED -> false;
        };
    }
}
