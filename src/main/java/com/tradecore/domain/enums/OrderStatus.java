package com.tradecore.domain.enums;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle status of an order.
 *
 * <p>State transitions:
 * <pre>
 * PENDING → PLACED → PARTIALLY_FILLED ↔ PLACED → FILLED
 * PLACED | PARTIALLY_FILLED → CANCELED
 * PENDING | PLACED → REJECTED
 * </pre>
 *
 * <p>PENDING is our internal pre-submission state. FILLED, CANCELED and REJECTED are terminal.
 */
public enum OrderStatus {
    PENDING,
    PLACED,
    PARTIALLY_FILLED,
    FILLED,
    CANCELED,
    REJECTED;

    private static final Map<OrderStatus, Set<OrderStatus>> ALLOWED = Map.of(
            PENDING, EnumSet.of(PLACED, REJECTED),
            PLACED, EnumSet.of(PARTIALLY_FILLED, FILLED, CANCELED, REJECTED),
            PARTIALLY_FILLED, EnumSet.of(PLACED, PARTIALLY_FILLED, FILLED, CANCELED),
            FILLED, EnumSet.noneOf(OrderStatus.class),
            CANCELED, EnumSet.noneOf(OrderStatus.class),
            REJECTED, EnumSet.noneOf(OrderStatus.class));

    public boolean canTransitionTo(OrderStatus target) {
        return ALLOWED.get(this).contains(target);
    }

    public boolean isTerminal() {
        return this == FILLED || this == CANCELED || this == REJECTED;
    }

    /** Open = resting on the exchange and still able to fill. */
    public boolean isOpen() {
        return this == PLACED || this == PARTIALLY_FILLED;
    }
}
