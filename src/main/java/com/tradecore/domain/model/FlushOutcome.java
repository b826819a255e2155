package com.tradecore.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-repository result of a factory-wide flush (full resync or forced dump).
 * Exactly one of {@code success}/{@code error} describes the outcome.
 */
@Value
@Builder
public class FlushOutcome {

    boolean success;
    long recordCount;
    String detail;
    String error;

    public static FlushOutcome ok(long recordCount, String detail) {
        return FlushOutcome.builder().success(true).recordCount(recordCount).detail(detail).build();
    }

    public static FlushOutcome failed(Throwable cause) {
        return FlushOutcome.builder()
                .success(false)
                .error(cause.getClass().getSimpleName() + ": " + cause.getMessage())
                .build();
    }
}
