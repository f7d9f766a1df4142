package com.tradebot.client.channel;

/**
 * Which path calls should take first.
 */
public enum TransportMode {
    /** Use the channel when it is connected, HTTP otherwise. */
    CHANNEL_PREFERRED,
    /** Skip the channel and go straight to HTTP. */
    FALLBACK_ONLY
}
