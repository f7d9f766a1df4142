package com.tradebot.client.exception;

/**
 * The channel path was attempted while the channel was not connected.
 */
public class TransportUnavailableException extends TradingClientException {

    public TransportUnavailableException(String message) {
        super(message);
    }
}
