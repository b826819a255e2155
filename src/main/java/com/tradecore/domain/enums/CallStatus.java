package com.tradecore.domain.enums;

/**
 * Outcome of a state-changing exchange call (place or cancel).
 * UNKNOWN means the request may have reached the exchange but no acknowledgment arrived
 * (timeout or transport failure after send); the caller must re-verify before acting.
 */
public enum CallStatus {
    CONFIRMED,
    REJECTED,
    UNKNOWN
}
