package com.tradecore.repository.memory;

import com.tradecore.domain.enums.DealStatus;
import com.tradecore.domain.enums.RepositoryKind;
import com.tradecore.domain.enums.StorageBackend;
import com.tradecore.domain.model.Deal;
import com.tradecore.exception.InvariantViolationException;
import com.tradecore.repository.DealsRepository;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Deals table held purely in process memory. Capacity handling matches
 * {@link InMemoryOrdersRepository}: only terminal deals are evicted, oldest first.
 */
public class InMemoryDealsRepository implements DealsRepository {

    protected final InMemoryTable<Deal> table;
    private final int capacity;
    private final ReentrantLock evictionLock = new ReentrantLock();

    public InMemoryDealsRepository(int capacity) {
        this.table = new InMemoryTable<>("Deal", Deal::getId, Deal::setId, Deal::copy);
        this.capacity = capacity;
    }

    @Override
    public RepositoryKind kind() {
        return RepositoryKind.DEALS;
    }

    @Override
    public StorageBackend backend() {
        return StorageBackend.PURE_MEMORY_LEGACY;
    }

    @Override
    public Deal upsert(Deal deal) {
        Objects.requireNonNull(deal, "deal");
        int before = table.count();
        Deal stored = table.upsert(deal, InMemoryDealsRepository::checkLegs, this::onStored);
        if (capacity > 0 && table.count() > before && table.count() > capacity) {
            evictTerminalDeals();
        }
        return stored;
    }

    @Override
    public Optional<Deal> get(String id) {
        return table.get(id);
    }

    @Override
    public List<Deal> scan(Predicate<Deal> predicate) {
        return table.scan(predicate);
    }

    @Override
    public List<Deal> findAll() {
        return table.scan(deal -> true);
    }

    @Override
    public boolean delete(String id) {
        return table.delete(id, this::onRemoved);
    }

    @Override
    public int count() {
        return table.count();
    }

    @Override
    public List<Deal> findActive() {
        return table.scan(deal -> !deal.isTerminal());
    }

    @Override
    public List<Deal> findBySymbol(String symbol) {
        return table.scan(deal -> Objects.equals(symbol, deal.getSymbol()));
    }

    @Override
    public List<Deal> findByStatus(DealStatus status) {
        return table.scan(deal -> deal.getStatus() == status);
    }

    @Override
    public Deal attachBuyLeg(String dealId, String orderId) {
        return table.update(dealId, deal -> deal.attachBuyOrder(orderId), this::onStored);
    }

    @Override
    public Deal detachBuyLeg(String dealId) {
        return table.update(dealId, Deal::detachBuyOrder, this::onStored);
    }

    /**
     * Plain upserts may not swap legs behind {@code attachBuyLeg}/{@code detachBuyLeg}: an open buy
     * leg or an attached sell leg can only be replaced after it is detached, and a terminal deal's
     * legs are frozen.
     */
    private static void checkLegs(Deal current, Deal candidate) {
        if (current == null) {
            return;
        }
        boolean buyChanged = !Objects.equals(current.getBuyOrderId(), candidate.getBuyOrderId());
        boolean sellChanged = !Objects.equals(current.getSellOrderId(), candidate.getSellOrderId());
        if (current.isTerminal() && (buyChanged || sellChanged)) {
            throw new InvariantViolationException(
                    String.format("Deal %s is %s, legs are frozen", current.getId(), current.getStatus()));
        }
        if (buyChanged && current.hasOpenBuyLeg() && candidate.getBuyOrderId() != null) {
            throw new InvariantViolationException(String.format(
                    "Deal %s already has open buy leg %s, cannot replace it with %s",
                    current.getId(), current.getBuyOrderId(), candidate.getBuyOrderId()));
        }
        if (sellChanged && current.getSellOrderId() != null && candidate.getSellOrderId() != null) {
            throw new InvariantViolationException(String.format(
                    "Deal %s already has sell leg %s, cannot replace it with %s",
                    current.getId(), current.getSellOrderId(), candidate.getSellOrderId()));
        }
    }

    /** Replaces the contents without notifying hooks. Used when loading the durable copy. */
    protected void load(Collection<Deal> deals) {
        table.replaceAll(deals);
    }

    /** Adds durable rows that memory lacks, without notifying hooks. Rows already in memory win. */
    protected void mergeLoaded(Collection<Deal> deals) {
        for (Deal deal : deals) {
            if (deal.getId() != null) {
                table.insertIfAbsent(deal);
            }
        }
    }

    protected void onStored(Deal stored) {}

    protected void onRemoved(Deal removed) {}

    private void evictTerminalDeals() {
        if (!evictionLock.tryLock()) {
            return;
        }
        try {
            int excess = table.count() - Math.max(1, (int) (capacity * 0.9));
            if (excess <= 0) {
                return;
            }
            table.snapshot().stream()
                    .filter(Deal::isTerminal)
                    .sorted(Comparator.comparingLong(Deal::getCompletedAt).thenComparingLong(Deal::getCreatedAt))
                    .limit(excess)
                    .collect(Collectors.toList())
                    .forEach(victim -> table.delete(victim.getId()));
        } finally {
            evictionLock.unlock();
        }
    }
}
