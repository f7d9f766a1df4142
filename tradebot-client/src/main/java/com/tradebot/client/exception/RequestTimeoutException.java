package com.tradebot.client.exception;

public class RequestTimeoutException extends TradingClientException {

    private final String method;
    private final long timeoutMs;

    public RequestTimeoutException(String method, long timeoutMs) {
        super("Request timeout: " + method + " got no response within " + timeoutMs + "ms");
        this.method = method;
        this.timeoutMs = timeoutMs;
    }

    public String getMethod() {
        return method;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
