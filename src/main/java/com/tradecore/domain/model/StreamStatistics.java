package com.tradecore.domain.model;

import lombok.Builder;
import lombok.Value;

/** Counters for one streaming repository. */
@Value
@Builder
public class StreamStatistics {

    long appended;

    /** Appends refused after ingestion was stopped for shutdown. */
    long rejectedAfterStop;

    /** Records dropped oldest-first to stay under the hard memory limit. */
    long evicted;

    long dumps;
    long dumpFailures;
    long recordsDumped;
    MemoryUsage memoryUsage;
}
