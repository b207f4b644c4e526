package com.algotrendy.gateway.exception;

/**
 * One market data channel could not reach its venue. Isolated to that channel.
 */
public class DataUnavailableException extends GatewayException {

    private final String channel;

    public DataUnavailableException(String channel, String message) {
        super(channel + ": " + message);
        this.channel = channel;
    }

    public DataUnavailableException(String channel, String message, Throwable cause) {
        super(channel + ": " + message, cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
