package com.tradebot.client.exception;

/**
 * The channel could not be opened. Only ever logged by the connection
 * manager; it turns into a transport demotion instead of reaching callers.
 */
public class ConnectFailureException extends TradingClientException {

    public ConnectFailureException(String message) {
        super(message);
    }

    public ConnectFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
