package com.tradecore.exception;

/** Transport-level exchange failure (network, timeout, 5xx). The outcome of the call is unknown. */
public class ExchangeException extends BaseException {

    public ExchangeException(String message) {
        super(ErrorCode.EXCHANGE_ERROR, message);
    }

    public ExchangeException(String message, Throwable cause) {
        super(ErrorCode.EXCHANGE_ERROR, message, cause);
    }
}
