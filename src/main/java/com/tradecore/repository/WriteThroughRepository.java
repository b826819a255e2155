package com.tradecore.repository;

import com.tradecore.domain.model.SyncStatistics;
import java.time.Duration;

/** A memory-first repository that mirrors every write into the durable store. */
public interface WriteThroughRepository extends ManagedRepository {

    /**
     * Replaces the durable copy with the current in-memory contents in one transaction.
     *
     * @return number of rows written
     * @throws com.tradecore.exception.RepositoryUnavailableException if the durable store fails
     */
    int forceFullResync();

    /**
     * Waits for write-through tasks that were scheduled before the call.
     *
     * @return true if all of them finished within the timeout
     */
    boolean awaitPendingSyncs(Duration timeout);

    /** True when some write may be missing from the durable copy until the next full resync. */
    boolean isDirty();

    SyncStatistics syncStatistics();
}
