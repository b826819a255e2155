package com.tradecore.repository.sync;

import com.tradecore.domain.enums.StorageBackend;
import com.tradecore.domain.model.Deal;
import com.tradecore.domain.model.SyncStatistics;
import com.tradecore.repository.WriteThroughRepository;
import com.tradecore.repository.memory.InMemoryDealsRepository;
import java.time.Duration;

/**
 * Deals table in memory with write-through to the durable store. Leg changes made through
 * {@code attachBuyLeg}/{@code detachBuyLeg} are synced like any other write.
 */
public class SyncedDealsRepository extends InMemoryDealsRepository implements WriteThroughRepository {

    private final DurableSyncAdapter<Deal> syncAdapter;

    public SyncedDealsRepository(DurableSyncAdapter<Deal> syncAdapter) {
        super(0);
        this.syncAdapter = syncAdapter;
        load(syncAdapter.loadInitial());
    }

    @Override
    public StorageBackend backend() {
        return StorageBackend.MEMORY_WITH_DURABLE_SYNC;
    }

    @Override
    protected void onStored(Deal stored) {
        syncAdapter.onUpserted(stored);
    }

    @Override
    protected void onRemoved(Deal removed) {
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
