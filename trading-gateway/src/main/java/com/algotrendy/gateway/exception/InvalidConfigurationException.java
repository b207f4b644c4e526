package com.algotrendy.gateway.exception;

/**
 * Invalid sizing or configuration value (zero/negative brick size, threshold, tick size, ...).
 * Raised at construction time; values are never clamped.
 */
public class InvalidConfigurationException extends GatewayException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
