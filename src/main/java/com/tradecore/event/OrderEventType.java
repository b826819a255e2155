package com.tradecore.event;

/**
 * Classifies the order change that triggered an {@link OrderEvent}.
 */
public enum OrderEventType {

    /** Cancel confirmed by the exchange. */
    CANCELED,

    /** Replacement buy order placed and attached to the deal. */
    REPLACED,

    /** Stale order canceled but its replacement could not be placed; the deal has no buy leg. */
    REPLACEMENT_FAILED,

    /** Order filled (fully or partially) before the cancel reached the exchange. */
    FILLED_BEFORE_CANCEL,

    /** Exchange outcome of a state-changing call is unknown and needs manual reconciliation. */
    OUTCOME_UNKNOWN,

    /** Pending sell leg repriced after its buy leg was replaced. */
    REPRICED
}
