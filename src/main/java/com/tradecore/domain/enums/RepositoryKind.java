package com.tradecore.domain.enums;

/**
 * Every repository the factory can hand out.
 * ORDERS and DEALS hold business state (write-through to the durable store);
 * the remaining kinds hold streaming observations (batch-dumped to files).
 */
public enum RepositoryKind {
    ORDERS(false),
    DEALS(false),
    TICKERS(true),
    ORDER_BOOKS(true),
    INDICATORS(true);

    private final boolean streaming;

    RepositoryKind(boolean streaming) {
        this.streaming = streaming;
    }

    public boolean isStreaming() {
        return streaming;
    }
}
