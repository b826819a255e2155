package com.tradecore.domain.enums;

/**
 * Order execution type.
 * STOP and STOP_LIMIT wait for a trigger price; only LIMIT orders are considered by the
 * stale-order monitor since they are the ones that rest on the book at a fixed price.
 */
public enum OrderType {
    LIMIT,
    MARKET,
    STOP,
    STOP_LIMIT
}
