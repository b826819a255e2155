package com.tradecore.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Counters for one write-through repository. Durable-store failures surface here and in
 * the log, never as exceptions on the trading path.
 */
@Value
@Builder
public class SyncStatistics {

    long scheduled;
    long succeeded;
    long failed;

    /** Tasks rejected by a saturated sync pool. Healed by the next full resync. */
    long dropped;

    /** Tasks skipped because a later resync already persisted a newer value for the id. */
    long skippedStale;

    int pending;
    long fullResyncs;
    long fullResyncFailures;

    /** Epoch millis of the last successful full resync, 0 if none. */
    long lastResyncAt;

    String lastError;

    /** The initial load failed; full resyncs upsert only until a load succeeds. */
    boolean loadPending;
}
