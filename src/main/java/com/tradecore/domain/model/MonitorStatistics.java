package com.tradecore.domain.model;

import lombok.Builder;
import lombok.Value;

/** Running counters of the stale-order monitor. */
@Value
@Builder
public class MonitorStatistics {

    boolean running;
    long checksPerformed;
    long staleOrdersFound;
    long ordersCanceled;
    long ordersRecreated;
    long recreationFailures;
    long skippedByCooldown;
    long ambiguousOutcomes;

    /** Deals (or standalone orders) currently inside their recreation cooldown. */
    int cooldownEntries;
}
