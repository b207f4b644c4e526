package com.algotrendy.gateway.exception;

/**
 * The venue answered but refused the order (insufficient funds, below minimum, ...).
 */
public class OrderRejectedException extends GatewayException {

    private final String broker;
    private final String clientOrderId;
    private final String reason;

    public OrderRejectedException(String broker, String clientOrderId, String reason) {
        super(broker + " rejected order " + clientOrderId + ": " + reason);
        this.broker = broker;
        this.clientOrderId = clientOrderId;
        this.reason = reason;
    }

    public String getBroker() {
        return broker;
    }

    public String getClientOrderId() {
        return clientOrderId;
    }

    public String getReason() {
        return reason;
    }
}
