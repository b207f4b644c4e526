package com.algotrendy.gateway.exception;

/**
 * Thrown when a broker or channel operation runs before {@code connect()}/{@code start()}.
 * Callers must connect explicitly; this is never retried automatically.
 */
public class NotConnectedException extends GatewayException {

    private final String target;

    public NotConnectedException(String target) {
        super("Not connected to " + target + ". Call connect first.");
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
