package com.algotrendy.gateway.exception;

/**
 * Transport or venue failure while talking to a broker. Surfaced as-is, no internal retry.
 */
public class BrokerUnavailableException extends GatewayException {

    private final String broker;

    public BrokerUnavailableException(String broker, String message) {
        super(broker + ": " + message);
        this.broker = broker;
    }

    public BrokerUnavailableException(String broker, String message, Throwable cause) {
        super(broker + ": " + message, cause);
        this.broker = broker;
    }

    public String getBroker() {
        return broker;
    }
}
