package com.tradebot.client.exception;

/**
 * Base type of every failure the trading client reports to callers.
 */
public class TradingClientException extends Exception {

    public TradingClientException(String message) {
        super(message);
    }

    public TradingClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
