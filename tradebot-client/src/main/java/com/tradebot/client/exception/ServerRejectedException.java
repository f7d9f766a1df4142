package com.tradebot.client.exception;

/**
 * The service answered a channel request with {@code success: false}.
 */
public class ServerRejectedException extends TradingClientException {

    private final String method;

    public ServerRejectedException(String method, String message) {
        super(message);
        this.method = method;
    }

    public String getMethod() {
        return method;
    }
}
