package com.tradecore.repository;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Keyed store for business entities.
 *
 * <p>All operations are synchronous against process memory and never perform I/O, so they are
 * safe to call from latency-sensitive trading paths. Every returned entity is an independent
 * copy: mutating it does not change the stored row until it is passed back to {@link #upsert}.
 */
public interface EntityRepository<T> extends ManagedRepository {

    /**
     * Inserts or replaces the entity by id. A missing id is assigned (random UUID).
     *
     * @return a copy of the stored value, with its id populated
     */
    T upsert(T entity);

    Optional<T> get(String id);

    /** Snapshot of the rows matching the predicate at call time. */
    List<T> scan(Predicate<T> predicate);

    List<T> findAll();

    boolean delete(String id);

    int count();
}
