package com.tradecore.repository.factory;

import com.tradecore.config.AsyncConfig;
import com.tradecore.config.StorageProperties;
import com.tradecore.domain.enums.RepositoryKind;
import com.tradecore.domain.enums.StorageBackend;
import com.tradecore.domain.model.Deal;
import com.tradecore.domain.model.DumpResult;
import com.tradecore.domain.model.FlushOutcome;
import com.tradecore.domain.model.IndicatorPoint;
import com.tradecore.domain.model.Order;
import com.tradecore.domain.model.OrderBookSnapshot;
import com.tradecore.domain.model.StorageInfo;
import com.tradecore.domain.model.StreamObservation;
import com.tradecore.domain.model.Ticker;
import com.tradecore.repository.BatchDumpingRepository;
import com.tradecore.repository.DealsRepository;
import com.tradecore.repository.ManagedRepository;
import com.tradecore.repository.OrdersRepository;
import com.tradecore.repository.StreamingRepository;
import com.tradecore.repository.WriteThroughRepository;
import com.tradecore.repository.memory.InMemoryDealsRepository;
import com.tradecore.repository.memory.InMemoryOrdersRepository;
import com.tradecore.repository.stream.BatchDumpStreamRepository;
import com.tradecore.repository.stream.ObservationSchema;
import com.tradecore.repository.stream.ObservationSchemas;
import com.tradecore.repository.stream.RingBufferStreamRepository;
import com.tradecore.repository.sync.DurableStore;
import com.tradecore.repository.sync.DurableSyncAdapter;
import com.tradecore.repository.sync.SyncedDealsRepository;
import com.tradecore.repository.sync.SyncedOrdersRepository;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Owns every repository handle of the process.
 *
 * <p>Each {@link RepositoryKind} is constructed once, on first request, with the backend named in
 * {@link StorageProperties}. If that backend cannot be constructed (durable store unreachable,
 * dump directory not writable), the failure is logged and the kind falls back to
 * {@link StorageBackend#PURE_MEMORY_LEGACY}; other kinds are unaffected.
 *
 * <p>Factory-wide flushes ({@link #forceSyncAll()}, {@link #forceDumpAll()}) visit every
 * repository constructed so far and report a per-kind outcome. One failing kind never stops
 * the others.
 */
@Component
public class RepositoryFactory {

    private static final Logger log = LoggerFactory.getLogger(RepositoryFactory.class);

    private final StorageProperties storageProperties;
    private final DurableStore<Order> orderDurableStore;
    private final DurableStore<Deal> dealDurableStore;

    private final Map<RepositoryKind, ManagedRepository> repositories = new ConcurrentHashMap<>();
    private final Map<RepositoryKind, String> fallbackReasons = new ConcurrentHashMap<>();

    public RepositoryFactory(
            StorageProperties storageProperties,
            DurableStore<Order> orderDurableStore,
            DurableStore<Deal> dealDurableStore) {
        this.storageProperties = storageProperties;
        this.orderDurableStore = orderDurableStore;
        this.dealDurableStore = dealDurableStore;
    }

    // ---- Handles ----

    /** Returns the single repository of {@code kind}, constructing it on first use. */
    public ManagedRepository get(RepositoryKind kind) {
        ManagedRepository existing = repositories.get(kind);
        if (existing != null) {
            return existing;
        }
        synchronized (this) {
            return repositories.computeIfAbsent(kind, this::create);
        }
    }

    public OrdersRepository orders() {
        return (OrdersRepository) get(RepositoryKind.ORDERS);
    }

    public DealsRepository deals() {
        return (DealsRepository) get(RepositoryKind.DEALS);
    }

    @SuppressWarnings("unchecked")
    public StreamingRepository<Ticker> tickers() {
        return (StreamingRepository<Ticker>) get(RepositoryKind.TICKERS);
    }

    @SuppressWarnings("unchecked")
    public StreamingRepository<OrderBookSnapshot> orderBooks() {
        return (StreamingRepository<OrderBookSnapshot>) get(RepositoryKind.ORDER_BOOKS);
    }

    @SuppressWarnings("unchecked")
    public StreamingRepository<IndicatorPoint> indicators() {
        return (StreamingRepository<IndicatorPoint>) get(RepositoryKind.INDICATORS);
    }

    /** The repository of {@code kind} if it has been constructed; never constructs one. */
    public Optional<ManagedRepository> existing(RepositoryKind kind) {
        return Optional.ofNullable(repositories.get(kind));
    }

    /** Repositories constructed so far. */
    public List<ManagedRepository> instantiated() {
        return new ArrayList<>(repositories.values());
    }

    // ---- Construction ----

    private ManagedRepository create(RepositoryKind kind) {
        StorageBackend configured = storageProperties.backendFor(kind);
        if (configured == StorageBackend.MEMORY_WITH_DURABLE_SYNC) {
            try {
                ManagedRepository repository = createDurable(kind);
                log.info("Created {} repository with backend {}", kind, configured);
                return repository;
            } catch (Exception e) {
                fallbackReasons.put(kind, e.getClass().getSimpleName() + ": " + e.getMessage());
                log.error("Could not create {} repository with backend {}, falling back to {}",
                        kind, configured, StorageBackend.PURE_MEMORY_LEGACY, e);
            }
        }
        ManagedRepository repository = createLegacy(kind);
        log.info("Created {} repository with backend {}", kind, StorageBackend.PURE_MEMORY_LEGACY);
        return repository;
    }

    private ManagedRepository createDurable(RepositoryKind kind) throws IOException {
        return switch (kind) {
            case ORDERS -> {
                orderDurableStore.ping();
                yield new SyncedOrdersRepository(
                        new DurableSyncAdapter<>("orders", orderDurableStore, Order::getId, syncExecutor("orders")));
            }
            case DEALS -> {
                dealDurableStore.ping();
                yield new SyncedDealsRepository(
                        new DurableSyncAdapter<>("deals", dealDurableStore, Deal::getId, syncExecutor("deals")));
            }
            case TICKERS -> batchRepository(kind, ObservationSchemas.TICKERS);
            case ORDER_BOOKS -> batchRepository(kind, ObservationSchemas.ORDER_BOOKS);
            case INDICATORS -> batchRepository(kind, ObservationSchemas.INDICATORS);
        };
    }

    private ManagedRepository createLegacy(RepositoryKind kind) {
        StorageProperties.Legacy legacy = storageProperties.getLegacy();
        return switch (kind) {
            case ORDERS -> new InMemoryOrdersRepository(legacy.getMaxOrders());
            case DEALS -> new InMemoryDealsRepository(legacy.getMaxDeals());
            case TICKERS -> new RingBufferStreamRepository<Ticker>(
                    kind, legacy.getMaxStreamRecords(), ObservationSchemas.TICKERS.getEstimatedRecordBytes());
            case ORDER_BOOKS -> new RingBufferStreamRepository<OrderBookSnapshot>(
                    kind, legacy.getMaxStreamRecords(), ObservationSchemas.ORDER_BOOKS.getEstimatedRecordBytes());
            case INDICATORS -> new RingBufferStreamRepository<IndicatorPoint>(
                    kind, legacy.getMaxStreamRecords(), ObservationSchemas.INDICATORS.getEstimatedRecordBytes());
        };
    }

    private <T extends StreamObservation> BatchDumpStreamRepository<T> batchRepository(
            RepositoryKind kind, ObservationSchema<T> schema) throws IOException {
        StorageProperties.Streaming streaming = storageProperties.getStreaming();
        Path root = Paths.get(streaming.getDumpDirectory());
        ThreadPoolTaskExecutor dumpExecutor = AsyncConfig.boundedExecutor(
                "dump-" + schema.getName() + "-", 1, 1, 4, new ThreadPoolExecutor.AbortPolicy());
        dumpExecutor.initialize();
        try {
            return new BatchDumpStreamRepository<>(
                    kind,
                    schema,
                    root,
                    streaming.getDumpThreshold().toBytes(),
                    streaming.getMemoryLimit().toBytes(),
                    dumpExecutor);
        } catch (IOException | RuntimeException e) {
            dumpExecutor.shutdown();
            throw e;
        }
    }

    private ThreadPoolTaskExecutor syncExecutor(String name) {
        StorageProperties.Sync sync = storageProperties.getSync();
        ThreadPoolTaskExecutor executor = AsyncConfig.boundedExecutor(
                "sync-" + name + "-",
                sync.getPoolSize(),
                sync.getPoolSize(),
                sync.getQueueCapacity(),
                new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    // ---- Factory-wide operations ----

    /** Fully resyncs every write-through repository. Legacy repositories report success with nothing written. */
    public Map<RepositoryKind, FlushOutcome> forceSyncAll() {
        Map<RepositoryKind, FlushOutcome> outcomes = new EnumMap<>(RepositoryKind.class);
        for (ManagedRepository repository : instantiated()) {
            if (repository.kind().isStreaming()) {
                continue;
            }
            if (!(repository instanceof WriteThroughRepository)) {
                outcomes.put(repository.kind(), FlushOutcome.ok(0, "no durable tier (" + repository.backend() + ")"));
                continue;
            }
            try {
                int rows = ((WriteThroughRepository) repository).forceFullResync();
                outcomes.put(repository.kind(), FlushOutcome.ok(rows, "resynced"));
            } catch (Exception e) {
                log.error("Force sync of {} failed", repository.kind(), e);
                outcomes.put(repository.kind(), FlushOutcome.failed(e));
            }
        }
        return outcomes;
    }

    /** Dumps every batch-dumping repository. Ring buffers report success with nothing written. */
    public Map<RepositoryKind, FlushOutcome> forceDumpAll() {
        Map<RepositoryKind, FlushOutcome> outcomes = new EnumMap<>(RepositoryKind.class);
        for (ManagedRepository repository : instantiated()) {
            if (!repository.kind().isStreaming()) {
                continue;
            }
            if (!(repository instanceof BatchDumpingRepository)) {
                outcomes.put(repository.kind(), FlushOutcome.ok(0, "no batch files (" + repository.backend() + ")"));
                continue;
            }
            try {
                DumpResult result = ((BatchDumpingRepository) repository).forceDump();
                outcomes.put(
                        repository.kind(),
                        FlushOutcome.ok(result.getRecordCount(), result.isEmpty() ? "empty" : result.getPath().toString()));
            } catch (Exception e) {
                log.error("Force dump of {} failed", repository.kind(), e);
                outcomes.put(repository.kind(), FlushOutcome.failed(e));
            }
        }
        return outcomes;
    }

    /**
     * Waits for in-flight write-through tasks of every repository, sharing one deadline.
     *
     * @return true if all of them finished in time
     */
    public boolean awaitPendingSyncs(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean allDone = true;
        for (ManagedRepository repository : instantiated()) {
            if (repository instanceof WriteThroughRepository) {
                Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
                allDone &= ((WriteThroughRepository) repository).awaitPendingSyncs(remaining);
            }
        }
        return allDone;
    }

    /** Stops every streaming repository from accepting observations. */
    public void stopIngestion() {
        for (ManagedRepository repository : instantiated()) {
            if (repository instanceof StreamingRepository) {
                ((StreamingRepository<?>) repository).stopAccepting();
            }
        }
    }

    public Map<RepositoryKind, StorageInfo> storageInfo() {
        Map<RepositoryKind, StorageInfo> info = new EnumMap<>(RepositoryKind.class);
        for (RepositoryKind kind : RepositoryKind.values()) {
            ManagedRepository repository = repositories.get(kind);
            info.put(kind, StorageInfo.builder()
                    .kind(kind)
                    .configured(storageProperties.backendFor(kind))
                    .actual(repository != null ? repository.backend() : null)
                    .instantiated(repository != null)
                    .fallbackReason(fallbackReasons.get(kind))
                    .build());
        }
        return info;
    }

    // ---- Maintenance ----

    /** Heals write-through repositories that dropped or failed a sync since their last resync. */
    @Scheduled(
            fixedDelayString = "${tradecore.storage.resync-interval:PT5M}",
            initialDelayString = "${tradecore.storage.resync-interval:PT5M}")
    public void resyncDirtyRepositories() {
        for (ManagedRepository repository : instantiated()) {
            if (repository instanceof WriteThroughRepository && ((WriteThroughRepository) repository).isDirty()) {
                try {
                    ((WriteThroughRepository) repository).forceFullResync();
                } catch (Exception e) {
                    log.warn("Scheduled resync of {} failed, will retry: {}", repository.kind(), e.getMessage());
                }
            }
        }
    }

    /** Dumps non-empty streaming buffers that have not reached their size threshold. */
    @Scheduled(
            fixedDelayString = "${tradecore.storage.streaming.dump-interval:PT5M}",
            initialDelayString = "${tradecore.storage.streaming.dump-interval:PT5M}")
    public void dumpStreamingBuffers() {
        for (ManagedRepository repository : instantiated()) {
            if (repository instanceof BatchDumpStreamRepository) {
                ((BatchDumpStreamRepository<?>) repository).dumpAsync();
            }
        }
    }

    @PreDestroy
    public void close() {
        for (ManagedRepository repository : instantiated()) {
            try {
                repository.close();
            } catch (Exception e) {
                log.warn("Error closing {} repository: {}", repository.kind(), e.getMessage());
            }
        }
    }
}
