package com.algotrendy.gateway.exception;

/**
 * Root of the gateway's unchecked exception hierarchy.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
