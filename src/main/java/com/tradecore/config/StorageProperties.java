package com.tradecore.config;

import com.tradecore.domain.enums.RepositoryKind;
import com.tradecore.domain.enums.StorageBackend;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

/**
 * Configuration properties for the repository layer.
 *
 * <p>Each repository kind names its storage backend. If the configured backend cannot be
 * constructed (for example the relational store is unreachable at startup), the factory falls
 * back to {@link StorageBackend#PURE_MEMORY_LEGACY} for that kind only.
 */
@Configuration
@ConfigurationProperties(prefix = "tradecore.storage")
@Getter
@Setter
public class StorageProperties {

    private StorageBackend orders = StorageBackend.MEMORY_WITH_DURABLE_SYNC;
    private StorageBackend deals = StorageBackend.MEMORY_WITH_DURABLE_SYNC;
    private StorageBackend tickers = StorageBackend.MEMORY_WITH_DURABLE_SYNC;
    private StorageBackend orderBooks = StorageBackend.MEMORY_WITH_DURABLE_SYNC;
    private StorageBackend indicators = StorageBackend.MEMORY_WITH_DURABLE_SYNC;

    /** How often dirty write-through repositories (dropped or failed syncs) are fully resynced. */
    private Duration resyncInterval = Duration.ofMinutes(5);

    private Sync sync = new Sync();
    private Streaming streaming = new Streaming();
    private Legacy legacy = new Legacy();

    public StorageBackend backendFor(RepositoryKind kind) {
        return switch (kind) {
            case ORDERS -> orders;
            case DEALS -> deals;
            case TICKERS -> tickers;
            case ORDER_BOOKS -> orderBooks;
            case INDICATORS -> indicators;
        };
    }

    @Getter
    @Setter
    public static class Sync {

        /** Worker threads per write-through repository. */
        private int poolSize = 2;

        /** Pending write tasks per repository before new ones are dropped (and healed by resync). */
        private int queueCapacity = 10_000;
    }

    @Getter
    @Setter
    public static class Streaming {

        /** Root directory for batch files. One subdirectory per repository kind. */
        private String dumpDirectory = "data/batches";

        /** Buffer size that triggers a background dump. */
        private DataSize dumpThreshold = DataSize.ofMegabytes(8);

        /** Hard ceiling for a buffer; the oldest records are dropped beyond it. */
        private DataSize memoryLimit = DataSize.ofMegabytes(64);

        /** Periodic dump of non-empty buffers regardless of size. */
        private Duration dumpInterval = Duration.ofMinutes(5);

        /** Batch files older than this are deleted by the retention sweep. */
        private int retentionDays = 7;
    }

    @Getter
    @Setter
    public static class Legacy {

        /** Capacity of the pure-memory orders table. Only terminal orders are evicted. */
        private int maxOrders = 50_000;

        private int maxDeals = 50_000;

        /** Ring buffer size of each pure-memory streaming repository. */
        private int maxStreamRecords = 100_000;
    }
}
