package com.tradecore.repository.sync;

import java.util.Collection;
import java.util.List;

/**
 * Relational copy of one business table. Calls block on I/O and must never run on a trading path.
 * Every method throws {@link com.tradecore.exception.RepositoryUnavailableException} when the
 * store cannot be reached.
 */
public interface DurableStore<T> {

    /** Cheap reachability check. */
    void ping();

    List<T> loadAll();

    /** Insert-or-update by id. */
    void upsert(T entity);

    void delete(String id);

    /** Replaces the whole table with {@code entities} in one transaction. */
    void replaceAll(Collection<T> entities);
}
