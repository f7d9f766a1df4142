package com.tradebot.client.channel;

/**
 * Lifecycle state of the persistent channel.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
