package com.tradebot.client.channel;

/**
 * Callbacks from a {@link Channel}. Invoked on the channel's I/O thread.
 */
public interface ChannelListener {

    void onOpen();

    void onMessage(String message);

    /**
     * Called once when the channel is gone, whether or not it ever opened.
     */
    void onClose(CloseReason reason, int code, String detail);

    void onError(Exception error);
}
