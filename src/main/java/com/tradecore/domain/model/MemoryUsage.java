package com.tradecore.domain.model;

import lombok.Builder;
import lombok.Value;

/** Memory footprint of a streaming buffer relative to its configured ceiling. */
@Value
@Builder
public class MemoryUsage {

    long recordCount;

    /** Estimated from a per-record size, not measured. */
    long estimatedBytes;

    /** estimatedBytes / memoryLimit * 100. Zero when the repository has no byte limit. */
    double percentOfLimit;
}
