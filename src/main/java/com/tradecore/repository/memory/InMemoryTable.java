package com.tradecore.repository.memory;

import com.tradecore.exception.ResourceNotFoundException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Process-memory table of entities keyed by string id.
 *
 * <p>Stored instances are never handed out and never mutated in place: every write replaces the
 * row with a fresh copy and every read returns a copy. That lets listeners and snapshot readers
 * hold on to a stored instance without further copying.
 *
 * <p>Writes to one id are serialised by the underlying map; the optional {@code onStored}
 * listener runs inside that critical section, so listeners observe writes to an id in the
 * order they were applied. Listeners must not block.
 */
public class InMemoryTable<T> {

    private final String name;
    private final Function<T, String> idGetter;
    private final BiConsumer<T, String> idSetter;
    private final UnaryOperator<T> copier;
    private final ConcurrentHashMap<String, T> rows = new ConcurrentHashMap<>();

    public InMemoryTable(
            String name, Function<T, String> idGetter, BiConsumer<T, String> idSetter, UnaryOperator<T> copier) {
        this.name = name;
        this.idGetter = idGetter;
        this.idSetter = idSetter;
        this.copier = copier;
    }

    public T upsert(T entity) {
        return upsert(entity, stored -> {});
    }

    /**
     * Stores a copy of {@code entity}, assigning a random UUID if it has no id.
     *
     * @param onStored receives the stored instance (read-only) after the write
     * @return a copy of the stored row
     */
    public T upsert(T entity, Consumer<T> onStored) {
        return upsert(entity, (current, candidate) -> {}, onStored);
    }

    /**
     * Like {@link #upsert(Object, Consumer)}, but first hands the stored row (null if none) and the
     * candidate to {@code check} inside the row's critical section. If it throws, nothing is stored.
     */
    public T upsert(T entity, BiConsumer<T, T> check, Consumer<T> onStored) {
        T candidate = copier.apply(entity);
        String id = idGetter.apply(candidate);
        if (id == null || id.isBlank()) {
            id = UUID.randomUUID().toString();
            idSetter.accept(candidate, id);
        }
        rows.compute(id, (key, current) -> {
            check.accept(current, candidate);
            onStored.accept(candidate);
            return candidate;
        });
        return copier.apply(candidate);
    }

    /**
     * Applies {@code mutation} to a copy of the stored row and stores the result atomically.
     * If the mutation throws, the stored row is left unchanged and the exception propagates.
     *
     * @throws ResourceNotFoundException if no row has this id
     */
    public T update(String id, Consumer<T> mutation, Consumer<T> onStored) {
        T updated = rows.compute(id, (key, current) -> {
            if (current == null) {
                throw new ResourceNotFoundException(name, id);
            }
            T next = copier.apply(current);
            mutation.accept(next);
            onStored.accept(next);
            return next;
        });
        return copier.apply(updated);
    }

    public Optional<T> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        T row = rows.get(id);
        return row == null ? Optional.empty() : Optional.of(copier.apply(row));
    }

    public List<T> scan(Predicate<T> predicate) {
        List<T> result = new ArrayList<>();
        for (T row : rows.values()) {
            if (predicate.test(row)) {
                result.add(copier.apply(row));
            }
        }
        return result;
    }

    /**
     * Stored instances, uncopied. Callers must treat them as read-only.
     */
    public List<T> snapshot() {
        return new ArrayList<>(rows.values());
    }

    public boolean delete(String id) {
        return delete(id, removed -> {});
    }

    public boolean delete(String id, Consumer<T> onRemoved) {
        if (id == null) {
            return false;
        }
        boolean[] removed = {false};
        rows.computeIfPresent(id, (key, current) -> {
            onRemoved.accept(current);
            removed[0] = true;
            return null;
        });
        return removed[0];
    }

    public int count() {
        return rows.size();
    }

    /**
     * Stores a copy of {@code entity} only if no row has its id. Listeners are not notified.
     *
     * @return true if the row was inserted
     */
    public boolean insertIfAbsent(T entity) {
        T copy = copier.apply(entity);
        return rows.putIfAbsent(idGetter.apply(copy), copy) == null;
    }

    /** Replaces the whole table without notifying listeners. Used when loading at startup. */
    public void replaceAll(Collection<T> entities) {
        Map<String, T> loaded = new ConcurrentHashMap<>();
        for (T entity : entities) {
            T copy = copier.apply(entity);
            String id = idGetter.apply(copy);
            if (id == null || id.isBlank()) {
                id = UUID.randomUUID().toString();
                idSetter.accept(copy, id);
            }
            loaded.put(id, copy);
        }
        rows.clear();
        rows.putAll(loaded);
    }

    public String getName() {
        return name;
    }
}
