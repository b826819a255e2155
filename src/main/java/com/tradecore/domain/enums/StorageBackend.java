package com.tradecore.domain.enums;

/**
 * Closed set of storage backends, chosen per repository kind at construction time.
 *
 * <p>MEMORY_WITH_DURABLE_SYNC means "memory first, with a durable second tier": write-through
 * to the relational store for ORDERS/DEALS, batch dumps to columnar files for streaming kinds.
 * PURE_MEMORY_LEGACY keeps everything in process memory only and is the fallback whenever
 * the durable tier cannot be constructed.
 */
public enum StorageBackend {
    MEMORY_WITH_DURABLE_SYNC,
    PURE_MEMORY_LEGACY
}
