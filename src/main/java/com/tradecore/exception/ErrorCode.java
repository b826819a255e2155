package com.tradecore.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR"),
    NOT_FOUND("NOT_FOUND"),
    INVALID_STATE_TRANSITION("INVALID_STATE_TRANSITION"),
    INVARIANT_VIOLATION("INVARIANT_VIOLATION"),
    REPOSITORY_UNAVAILABLE("REPOSITORY_UNAVAILABLE"),
    EXCHANGE_REJECTED("EXCHANGE_REJECTED"),
    EXCHANGE_ERROR("EXCHANGE_ERROR"),
    INTERNAL_ERROR("INTERNAL_ERROR");

    private final String code;
}
