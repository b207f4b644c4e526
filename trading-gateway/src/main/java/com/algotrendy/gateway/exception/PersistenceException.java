package com.algotrendy.gateway.exception;

public class PersistenceException extends GatewayException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
