package com.tradebot.client;

/**
 * Snapshot of the client's transport state.
 */
public record ConnectionStatus(
    boolean connected,        // Channel is open
    boolean usingChannel,     // Calls prefer the channel over HTTP
    int reconnectAttempts,    // Attempts used since the last successful connect
    int subscriptionCount     // Topic keys currently subscribed
) {}
