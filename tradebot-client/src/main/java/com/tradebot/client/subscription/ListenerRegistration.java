package com.tradebot.client.subscription;

/**
 * Handle returned when a listener is attached; {@link #remove()} detaches it.
 */
@FunctionalInterface
public interface ListenerRegistration {

    void remove();
}
