package com.tradecore.exception;

/**
 * The exchange received the request and refused it (invalid parameters, insufficient balance,
 * unknown order). The outcome is definite: nothing changed on the exchange side.
 */
public class ExchangeRejectedException extends BaseException {

    public ExchangeRejectedException(String message) {
        super(ErrorCode.EXCHANGE_REJECTED, message);
    }
}
