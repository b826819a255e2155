package com.tradecore.domain.model;

/**
 * An immutable, append-only market observation identified by {@code (symbol, timestamp)}.
 * Observations are never updated in place; they are appended and evicted in bulk.
 */
public interface StreamObservation {

    String getSymbol();

    /** Monotonic epoch millis. */
    long getTimestamp();
}
