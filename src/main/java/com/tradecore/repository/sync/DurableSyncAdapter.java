package com.tradecore.repository.sync;

import com.tradecore.domain.model.SyncStatistics;
import com.tradecore.exception.RepositoryUnavailableException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ExecutorConfigurationSupport;

/**
 * Mirrors writes of one in-memory table into its durable store without blocking the writer.
 *
 * <p>Each {@link #onUpserted} schedules one write task on a bounded executor. When the executor
 * is saturated the task is dropped, counted, and the table is marked dirty; the next
 * {@link #forceFullResync} heals it. Durable failures are logged and counted, never propagated
 * to the writer and never rolled back in memory.
 *
 * <p>Ordering: every task carries a sequence number taken when it was scheduled. Writes for one
 * id are serialised and a task older than the last value persisted for that id (by a newer task
 * or by a full resync) is skipped, so the durable row converges on the last scheduled value.
 *
 * <p>A full resync holds the write side of a read/write lock; write tasks hold the read side only
 * around their durable write. Scheduling never touches the lock.
 *
 * <p>If the initial load failed, memory does not hold the durable rows, so a bulk replace would
 * delete them. Until a load succeeds a full resync first retries the load and, if that fails
 * again, only upserts the in-memory rows and reports failure.
 */
public class DurableSyncAdapter<T> {

    private static final Logger log = LoggerFactory.getLogger(DurableSyncAdapter.class);

    private final String name;
    private final DurableStore<T> durableStore;
    private final Function<T, String> idOf;
    private final TaskExecutor executor;

    private final ReentrantReadWriteLock resyncLock = new ReentrantReadWriteLock();
    private final AtomicLong sequence = new AtomicLong();
    private final ConcurrentHashMap<String, Long> persistedSequence = new ConcurrentHashMap<>();
    private final Set<CompletableFuture<Void>> inFlight = ConcurrentHashMap.newKeySet();

    private final AtomicLong scheduled = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong skippedStale = new AtomicLong();
    private final AtomicLong fullResyncs = new AtomicLong();
    private final AtomicLong fullResyncFailures = new AtomicLong();
    private volatile long lastResyncAt;
    private volatile String lastError;
    private volatile boolean dirty;
    private volatile boolean loadPending;

    public DurableSyncAdapter(
            String name, DurableStore<T> durableStore, Function<T, String> idOf, TaskExecutor executor) {
        this.name = name;
        this.durableStore = durableStore;
        this.idOf = idOf;
        this.executor = executor;
    }

    // ---- Load at start ----

    /**
     * Reads the durable copy. If the store fails, logs and returns an empty list: the repository
     * then starts empty in degraded mode rather than refusing to start.
     */
    public List<T> loadInitial() {
        try {
            List<T> rows = durableStore.loadAll();
            log.info("Loaded {} {} rows from durable store", rows.size(), name);
            return rows;
        } catch (Exception e) {
            loadPending = true;
            dirty = true;
            lastError = describe(e);
            log.warn("DEGRADED: could not load {} from durable store, starting empty: {}", name, e.getMessage(), e);
            return List.of();
        }
    }

    // ---- Write-through (called from the writer's thread) ----

    /** Schedules persistence of {@code entity}. Never blocks and never throws. */
    public void onUpserted(T entity) {
        String id = idOf.apply(entity);
        schedule(id, () -> durableStore.upsert(entity));
    }

    public void onDeleted(String id) {
        schedule(id, () -> durableStore.delete(id));
    }

    private void schedule(String id, Runnable write) {
        long seq = sequence.incrementAndGet();
        scheduled.incrementAndGet();
        try {
            CompletableFuture<Void> task = CompletableFuture.runAsync(() -> runWrite(id, seq, write), executor);
            inFlight.add(task);
            task.whenComplete((ignored, error) -> inFlight.remove(task));
        } catch (RejectedExecutionException e) {
            dropped.incrementAndGet();
            dirty = true;
            log.warn("Sync pool saturated, dropped {} write for id={} (healed by next full resync)", name, id);
        }
    }

    private void runWrite(String id, long seq, Runnable write) {
        resyncLock.readLock().lock();
        try {
            persistedSequence.compute(id, (key, persisted) -> {
                if (persisted != null && persisted >= seq) {
                    skippedStale.incrementAndGet();
                    return persisted;
                }
                write.run();
                succeeded.incrementAndGet();
                return seq;
            });
        } catch (Exception e) {
            failed.incrementAndGet();
            dirty = true;
            lastError = describe(e);
            log.error("Durable write failed for {} id={}", name, id, e);
        } finally {
            resyncLock.readLock().unlock();
        }
    }

    // ---- Full resync ----

    public int forceFullResync(Supplier<Collection<T>> snapshot) {
        return forceFullResync(snapshot, null);
    }

    /**
     * Replaces the durable copy with {@code snapshot}, which must read the in-memory table after
     * this method is entered.
     *
     * <p>While the initial load is pending, the durable rows are loaded first and handed to
     * {@code mergeLoaded} so memory can take the ones it lacks. Without a merge callback, or if
     * the load fails again, the snapshot is upserted row by row and nothing is deleted.
     *
     * @return number of rows written
     * @throws RepositoryUnavailableException if the durable store fails, or the initial load is
     *     still pending after the upserts
     */
    public int forceFullResync(Supplier<Collection<T>> snapshot, Consumer<List<T>> mergeLoaded) {
        resyncLock.writeLock().lock();
        try {
            if (loadPending) {
                retryLoad(mergeLoaded);
            }
            // Every task scheduled up to here wrote memory before it was scheduled,
            // so the snapshot below already holds its value or a newer one
            long covered = sequence.get();
            List<T> rows = new ArrayList<>(snapshot.get());
            if (loadPending) {
                return upsertOnly(rows, covered);
            }
            durableStore.replaceAll(rows);

            persistedSequence.clear();
            for (T row : rows) {
                persistedSequence.put(idOf.apply(row), covered);
            }
            dirty = false;
            fullResyncs.incrementAndGet();
            lastResyncAt = System.currentTimeMillis();
            log.info("Full resync of {} wrote {} rows", name, rows.size());
            return rows.size();
        } catch (Exception e) {
            fullResyncFailures.incrementAndGet();
            lastError = describe(e);
            log.error("Full resync of {} failed", name, e);
            throw e instanceof RepositoryUnavailableException
                    ? (RepositoryUnavailableException) e
                    : new RepositoryUnavailableException("Full resync of " + name + " failed: " + e.getMessage(), e);
        } finally {
            resyncLock.writeLock().unlock();
        }
    }

    private void retryLoad(Consumer<List<T>> mergeLoaded) {
        if (mergeLoaded == null) {
            return;
        }
        try {
            List<T> loaded = durableStore.loadAll();
            mergeLoaded.accept(loaded);
            loadPending = false;
            log.info("Recovered {} {} rows from durable store after a failed initial load", loaded.size(), name);
        } catch (Exception e) {
            lastError = describe(e);
            log.warn("Load of {} from durable store still failing, bulk replace refused: {}", name, e.getMessage());
        }
    }

    private int upsertOnly(List<T> rows, long covered) {
        for (T row : rows) {
            durableStore.upsert(row);
            persistedSequence.put(idOf.apply(row), covered);
        }
        dirty = true;
        log.warn("Durable copy of {} never loaded: upserted {} rows, deleted none", name, rows.size());
        throw new RepositoryUnavailableException(
                "Durable copy of " + name + " was never loaded; upserted " + rows.size()
                        + " rows, bulk replace refused");
    }

    // ---- Pending tasks ----

    /**
     * Waits for the write tasks in flight when called.
     *
     * @return true if all of them completed within {@code timeout}
     */
    public boolean awaitPending(Duration timeout) {
        List<CompletableFuture<Void>> pending = new ArrayList<>(inFlight);
        if (pending.isEmpty()) {
            return true;
        }
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("Timed out after {} waiting for {} pending {} writes", timeout, inFlight.size(), name);
            return false;
        } catch (ExecutionException e) {
            // Tasks handle their own failures; reaching here means the executor itself failed them
            log.error("Pending {} writes completed exceptionally", name, e.getCause());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public int pendingCount() {
        return inFlight.size();
    }

    public boolean isDirty() {
        return dirty;
    }

    /** True while memory may lack durable rows because the initial load failed. */
    public boolean isLoadPending() {
        return loadPending;
    }

    public SyncStatistics statistics() {
        return SyncStatistics.builder()
                .scheduled(scheduled.get())
                .succeeded(succeeded.get())
                .failed(failed.get())
                .dropped(dropped.get())
                .skippedStale(skippedStale.get())
                .pending(inFlight.size())
                .fullResyncs(fullResyncs.get())
                .fullResyncFailures(fullResyncFailures.get())
                .lastResyncAt(lastResyncAt)
                .lastError(lastError)
                .loadPending(loadPending)
                .build();
    }

    public void close() {
        if (executor instanceof ExecutorConfigurationSupport) {
            ((ExecutorConfigurationSupport) executor).shutdown();
        }
    }

    private static String describe(Exception e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
