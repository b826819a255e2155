package com.tradecore.domain.enums;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle status of a deal (one buy/sell round trip).
 * Transitions: ACTIVE → WAITING_SELL → COMPLETED; ACTIVE | WAITING_SELL → CANCELED;
 * any non-terminal state → FAILED on an unrecoverable error.
 */
public enum DealStatus {
    ACTIVE,
    WAITING_SELL,
    COMPLETED,
    CANCELED,
    FAILED;

    private static final Map<DealStatus, Set<DealStatus>> ALLOWED = Map.of(
            ACTIVE, EnumSet.of(WAITING_SELL, CANCELED, FAILED),
            WAITING_SELL, EnumSet.of(COMPLETED, CANCELED, FAILED),
            COMPLETED, EnumSet.noneOf(DealStatus.class),
            CANCELED, EnumSet.noneOf(DealStatus.class),
            FAILED, EnumSet.noneOf(DealStatus.class));

    public boolean canTransitionTo(DealStatus target) {
        return ALLOWED.get(this).contains(target);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELED || this == FAILED;
    }
}
