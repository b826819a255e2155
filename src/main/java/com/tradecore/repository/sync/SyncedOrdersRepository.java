package com.tradecore.repository.sync;

import com.tradecore.domain.enums.StorageBackend;
import com.tradecore.domain.model.Order;
import com.tradecore.domain.model.SyncStatistics;
import com.tradecore.repository.WriteThroughRepository;
import com.tradecore.repository.memory.InMemoryOrdersRepository;
import java.time.Duration;

/**
 * Orders table in memory with write-through to the durable store.
 *
 * <p>Construction loads the durable copy into memory. Reads and writes behave exactly like
 * {@link InMemoryOrdersRepository}; each write additionally schedules one durable write.
 */
public class SyncedOrdersRepository extends InMemoryOrdersRepository implements WriteThroughRepository {

    private final DurableSyncAdapter<Order> syncAdapter;

    public SyncedOrdersRepository(DurableSyncAdapter<Order> syncAdapter) {
        super(0);
        this.syncAdapter = syncAdapter;
        load(syncAdapter.loadInitial());
    }

    @Override
    public StorageBackend backend() {
        return StorageBackend.MEMORY_WITH_DURABLE_SYNC;
    }

    @Override
    protected void onStored(Order stored) {
        syncAdapter.onUpserted(stored);
    }

    @Override
    protected void onRemoved(Order removed) {
        syncAdapter.onDeleted(removed.getId());
    }

    @Override
    public int forceFullResync() {
        return syncAdapter.forceFullResync(table::snapshot, this::mergeLoaded);
    }

    @Override
    public boolean awaitPendingSyncs(Duration timeout) {
        return syncAdapter.awaitPending(timeout);
    }

    @Override
    public boolean isDirty() {
        return syncAdapter.isDirty();
    }

    @Override
    public SyncStatistics syncStatistics() {
        return syncAdapter.statistics();
    }

    @Override
    public void close() {
        syncAdapter.close();
    }
}
