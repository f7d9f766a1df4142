package com.tradebot.client.exception;

/**
 * A channel payload could not be read as the type the call expects.
 */
public class PayloadDecodeException extends TradingClientException {

    public PayloadDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
