package com.tradecore.repository.memory;

import com.tradecore.domain.enums.OrderSide;
import com.tradecore.domain.enums.OrderStatus;
import com.tradecore.domain.enums.RepositoryKind;
import com.tradecore.domain.enums.StorageBackend;
import com.tradecore.domain.model.Order;
import com.tradecore.domain.model.OrderStatistics;
import com.tradecore.exception.InvariantViolationException;
import com.tradecore.repository.OrdersRepository;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orders table held purely in process memory.
 *
 * <p>Keeps a reverse index from exchange id to order id, mirroring how the exchange reports
 * fills by its own id. The index is a hint: lookups verify the row and fall back to a scan.
 *
 * <p>With a positive {@code capacity}, inserting past it evicts the oldest terminal orders
 * (down to 90% of capacity, so eviction does not run on every insert). Open and PENDING orders
 * are never evicted, even if that leaves the table over capacity.
 */
public class InMemoryOrdersRepository implements OrdersRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryOrdersRepository.class);

    protected final InMemoryTable<Order> table;
    private final Map<String, String> exchangeIdIndex = new ConcurrentHashMap<>();
    private final int capacity;
    private final ReentrantLock evictionLock = new ReentrantLock();

    public InMemoryOrdersRepository(int capacity) {
        this.table = new InMemoryTable<>("Order", Order::getId, Order::setId, Order::copy);
        this.capacity = capacity;
    }

    @Override
    public RepositoryKind kind() {
        return RepositoryKind.ORDERS;
    }

    @Override
    public StorageBackend backend() {
        return StorageBackend.PURE_MEMORY_LEGACY;
    }

    @Override
    public Order upsert(Order order) {
        Objects.requireNonNull(order, "order");
        checkAmounts(order);
        int before = table.count();
        Order stored;
        String exchangeId = order.getExchangeId();
        if (exchangeId == null || order.getStatus() == OrderStatus.REJECTED) {
            stored = table.upsert(order, this::onStored);
        } else {
            // The row is stored while the exchange id entry is held, so a competing claim sees it
            Order[] result = new Order[1];
            exchangeIdIndex.compute(exchangeId, (key, ownerId) -> {
                ensureUnclaimed(exchangeId, ownerId, order.getId());
                result[0] = table.upsert(order, this::onStored);
                return result[0].getId();
            });
            stored = result[0];
        }
        if (capacity > 0 && table.count() > before && table.count() > capacity) {
            evictTerminalOrders();
        }
        return stored;
    }

    @Override
    public Optional<Order> get(String id) {
        return table.get(id);
    }

    @Override
    public List<Order> scan(Predicate<Order> predicate) {
        return table.scan(predicate);
    }

    @Override
    public List<Order> findAll() {
        return table.scan(order -> true);
    }

    @Override
    public boolean delete(String id) {
        Order[] removed = new Order[1];
        boolean deleted = table.delete(id, row -> {
            removed[0] = row;
            onRemoved(row);
        });
        if (deleted) {
            unindex(removed[0]);
        }
        return deleted;
    }

    @Override
    public int count() {
        return table.count();
    }

    // ---- Queries ----

    @Override
    public Optional<Order> findByExchangeId(String exchangeId) {
        if (exchangeId == null) {
            return Optional.empty();
        }
        String orderId = exchangeIdIndex.get(exchangeId);
        if (orderId != null) {
            Optional<Order> indexed = table.get(orderId);
            if (indexed.isPresent() && exchangeId.equals(indexed.get().getExchangeId())) {
                return indexed;
            }
        }
        return table.scan(order -> exchangeId.equals(order.getExchangeId())).stream()
                .filter(order -> order.getStatus() != OrderStatus.REJECTED)
                .findFirst();
    }

    @Override
    public List<Order> findOpenOrders() {
        return table.scan(Order::isOpen);
    }

    @Override
    public List<Order> findOpenBuyOrders() {
        return table.scan(order -> order.isOpen() && order.getSide() == OrderSide.BUY);
    }

    @Override
    public List<Order> findByDealId(String dealId) {
        return table.scan(order -> dealId != null && dealId.equals(order.getDealId()));
    }

    @Override
    public List<Order> findBySymbol(String symbol) {
        return table.scan(order -> Objects.equals(symbol, order.getSymbol()));
    }

    @Override
    public List<Order> findByStatus(OrderStatus status) {
        return table.scan(order -> order.getStatus() == status);
    }

    @Override
    public Optional<Order> findPendingSellForDeal(String dealId) {
        return table
                .scan(order -> dealId != null
                        && dealId.equals(order.getDealId())
                        && order.getSide() == OrderSide.SELL
                        && order.getStatus() == OrderStatus.PENDING)
                .stream()
                .findFirst();
    }

    @Override
    public OrderStatistics statistics() {
        List<Order> rows = table.snapshot();
        Map<OrderStatus, Long> byStatus = new EnumMap<>(OrderStatus.class);
        for (OrderStatus status : OrderStatus.values()) {
            byStatus.put(status, 0L);
        }
        rows.forEach(order -> byStatus.merge(order.getStatus(), 1L, Long::sum));
        return OrderStatistics.builder()
                .total(rows.size())
                .open(rows.stream().filter(Order::isOpen).count())
                .byStatus(byStatus)
                .withErrors(rows.stream().filter(order -> order.getLastError() != null).count())
                .build();
    }

    // ---- Hooks for write-through subclasses ----

    /** Replaces the contents without notifying hooks. Used when loading the durable copy. */
    protected void load(Collection<Order> orders) {
        table.replaceAll(orders);
        exchangeIdIndex.clear();
        for (Order order : table.snapshot()) {
            if (order.getExchangeId() != null && order.getStatus() != OrderStatus.REJECTED) {
                exchangeIdIndex.put(order.getExchangeId(), order.getId());
            }
        }
    }

    /**
     * Adds durable rows that memory lacks, without notifying hooks. Rows already in memory are
     * newer and win. Used when the durable copy is loaded late.
     */
    protected void mergeLoaded(Collection<Order> orders) {
        int added = 0;
        for (Order order : orders) {
            if (order.getId() == null || !table.insertIfAbsent(order)) {
                continue;
            }
            added++;
            if (order.getExchangeId() != null && order.getStatus() != OrderStatus.REJECTED) {
                exchangeIdIndex.putIfAbsent(order.getExchangeId(), order.getId());
            }
        }
        log.info("Merged {} of {} late-loaded orders into memory", added, orders.size());
    }

    /** Called with the stored instance inside the row's critical section. Must not block. */
    protected void onStored(Order stored) {}

    protected void onRemoved(Order removed) {}

    // ---- Internals ----

    private static void checkAmounts(Order order) {
        BigDecimal filled = order.getFilledAmount();
        BigDecimal requested = order.getRequestedAmount();
        if (filled == null || filled.signum() < 0) {
            throw new InvariantViolationException(
                    String.format("Order %s has invalid filled amount %s", order.getId(), filled));
        }
        if (requested != null && filled.compareTo(requested) > 0) {
            throw new InvariantViolationException(String.format(
                    "Order %s overfilled: %s > requested %s", order.getId(), filled, requested));
        }
        if (order.getStatus() == OrderStatus.FILLED && (requested == null || filled.compareTo(requested) != 0)) {
            throw new InvariantViolationException(String.format(
                    "Order %s is FILLED with %s of %s", order.getId(), filled, requested));
        }
    }

    private void ensureUnclaimed(String exchangeId, String ownerId, String candidateId) {
        if (ownerId == null || ownerId.equals(candidateId)) {
            return;
        }
        Optional<Order> owner = table.get(ownerId);
        if (owner.isPresent()
                && exchangeId.equals(owner.get().getExchangeId())
                && owner.get().getStatus() != OrderStatus.REJECTED) {
            throw new InvariantViolationException(String.format(
                    "Exchange id %s already belongs to order %s, cannot assign to %s",
                    exchangeId, ownerId, candidateId));
        }
    }

    private void unindex(Order removed) {
        if (removed != null && removed.getExchangeId() != null) {
            exchangeIdIndex.remove(removed.getExchangeId(), removed.getId());
        }
    }

    private void evictTerminalOrders() {
        if (!evictionLock.tryLock()) {
            return;
        }
        try {
            int target = Math.max(1, (int) (capacity * 0.9));
            int excess = table.count() - target;
            if (excess <= 0) {
                return;
            }
            List<Order> victims = table.snapshot().stream()
                    .filter(Order::isTerminal)
                    .sorted(Comparator.comparingLong(Order::getLastUpdatedAt).thenComparingLong(Order::getCreatedAt))
                    .limit(excess)
                    .collect(Collectors.toList());
            // Eviction only forgets the row in memory; it is not a business delete
            for (Order victim : victims) {
                if (table.delete(victim.getId())) {
                    unindex(victim);
                }
            }
            if (victims.size() < excess) {
                log.warn(
                        "Orders table over capacity: count={}, capacity={}, no more terminal orders to evict",
                        table.count(),
                        capacity);
            } else {
                log.debug("Evicted {} terminal orders, count={}", victims.size(), table.count());
            }
        } finally {
            evictionLock.unlock();
        }
    }
}
