package com.algotrendy.gateway.broker;

/**
 * Broker session lifecycle: DISCONNECTED -> CONNECTING -> CONNECTED -> DISCONNECTED.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
