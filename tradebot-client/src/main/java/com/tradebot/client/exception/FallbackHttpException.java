package com.tradebot.client.exception;

/**
 * A stateless HTTP call failed: non-success status, unreadable body, or I/O error.
 */
public class FallbackHttpException extends TradingClientException {

    public static final int NO_STATUS = -1;

    private final int statusCode;

    public FallbackHttpException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public FallbackHttpException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_STATUS;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
