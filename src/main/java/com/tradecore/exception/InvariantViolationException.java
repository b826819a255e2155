package com.tradecore.exception;

/**
 * A write would break an entity invariant (overfill, duplicate exchange id, a second open buy
 * leg on a deal). Rejected at the repository boundary; indicates a programming-level error.
 */
public class InvariantViolationException extends BusinessException {

    public InvariantViolationException(String message) {
        super(ErrorCode.INVARIANT_VIOLATION, message);
    }
}
