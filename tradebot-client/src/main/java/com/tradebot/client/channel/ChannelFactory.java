package com.tradebot.client.channel;

import com.tradebot.client.exception.ConnectFailureException;

/**
 * Creates a fresh, unopened channel for each connect attempt.
 */
@FunctionalInterface
public interface ChannelFactory {

    Channel create(ChannelListener listener) throws ConnectFailureException;
}
