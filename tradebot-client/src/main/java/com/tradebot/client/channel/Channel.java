package com.tradebot.client.channel;

import com.tradebot.client.exception.TransportUnavailableException;

/**
 * A duplex text message stream to the trading service.
 *
 * Lifecycle events are reported to the {@link ChannelListener} the channel
 * was created with.
 */
public interface Channel {

    /**
     * Start opening. Returns immediately; completion is signalled through
     * {@link ChannelListener#onOpen()} or a failure callback.
     */
    void open();

    void send(String message) throws TransportUnavailableException;

    void close();

    boolean isOpen();
}
