package com.tradecore.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradecore.domain.enums.DealStatus;
import com.tradecore.domain.enums.OrderSide;
import com.tradecore.domain.enums.OrderStatus;
import com.tradecore.domain.enums.OrderType;
import com.tradecore.domain.model.Deal;
import com.tradecore.domain.model.Order;
import com.tradecore.entity.OrderEntity;
import com.tradecore.repository.jpa.DealJpaRepository;
import com.tradecore.repository.jpa.OrderJpaRepository;
import com.tradecore.repository.sync.DurableSyncAdapter;
import com.tradecore.repository.sync.JpaDealDurableStore;
import com.tradecore.repository.sync.JpaOrderDurableStore;
import com.tradecore.repository.sync.SyncedDealsRepository;
import com.tradecore.repository.sync.SyncedOrdersRepository;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Round trips through the relational tier on embedded H2: write-through, full resync and
 * reload on restart. Runs without a test transaction so every store call commits on its own.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class DurableStoreIntegrationTest {

    @Autowired
    private OrderJpaRepository orderJpaRepository;

    @Autowired
    private DealJpaRepository dealJpaRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private JpaOrderDurableStore orderStore;
    private JpaDealDurableStore dealStore;

    @BeforeEach
    void setUp() {
        orderJpaRepository.deleteAll();
        dealJpaRepository.deleteAll();
        orderStore = new JpaOrderDurableStore(orderJpaRepository, new TransactionTemplate(transactionManager));
        dealStore = new JpaDealDurableStore(dealJpaRepository, new TransactionTemplate(transactionManager));
    }

    private static Order order(String id, OrderStatus status, String filled) {
        return Order.builder()
                .id(id)
                .exchangeId("EX-" + id)
                .clientOrderId("client-" + id)
                .symbol("BTC/USDT")
                .side(OrderSide.BUY)
                .type(OrderType.LIMIT)
                .price(new BigDecimal("30123.45678901"))
                .requestedAmount(new BigDecimal("0.015"))
                .filledAmount(new BigDecimal(filled))
                .status(status)
                .dealId("deal-1")
                .createdAt(1_700_000_000_000L)
                .lastUpdatedAt(1_700_000_000_500L)
                .build();
    }

    private SyncedOrdersRepository syncedOrders() {
        return new SyncedOrdersRepository(new DurableSyncAdapter<>("orders", orderStore, Order::getId, Runnable::run));
    }

    @Test
    @DisplayName("replaceAll then loadAll reproduces the set, including dropped rows")
    void replaceAllRoundTrip() {
        orderStore.replaceAll(List.of(order("a", OrderStatus.PLACED, "0"), order("b", OrderStatus.FILLED, "0.015")));
        orderStore.replaceAll(List.of(order("b", OrderStatus.FILLED, "0.015"), order("c", OrderStatus.PENDING, "0")));

        List<Order> loaded = orderStore.loadAll();
        loaded.sort(Comparator.comparing(Order::getId));

        assertThat(loaded).extracting(Order::getId).containsExactly("b", "c");
        Order b = loaded.get(0);
        assertThat(b.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(b.getPrice()).isEqualByComparingTo("30123.45678901");
        assertThat(b.getFilledAmount()).isEqualByComparingTo("0.015");
        assertThat(b.getExchangeId()).isEqualTo("EX-b");
        assertThat(b.getCreatedAt()).isEqualTo(1_700_000_000_000L);
    }

    @Test
    @DisplayName("write-through keeps the durable copy current and a restart reloads it")
    void writeThroughAndReload() {
        SyncedOrdersRepository orders = syncedOrders();
        Order stored = orders.upsert(order(null, OrderStatus.PLACED, "0"));
        Order other = orders.upsert(order(null, OrderStatus.PLACED, "0").toBuilder().exchangeId("EX-2").build());
        orders.delete(other.getId());

        assertThat(orderJpaRepository.count()).isEqualTo(1);

        SyncedOrdersRepository restarted = syncedOrders();
        assertThat(restarted.count()).isEqualTo(1);
        assertThat(restarted.get(stored.getId())).isPresent();
        assertThat(restarted.findByExchangeId(stored.getExchangeId()))
                .map(Order::getId)
                .contains(stored.getId());
    }

    @Test
    @DisplayName("forceFullResync replaces the durable table with memory")
    void forceFullResync() {
        orderStore.upsert(order("stray", OrderStatus.PLACED, "0"));
        SyncedOrdersRepository orders = syncedOrders();
        orders.delete("stray");
        orders.upsert(order("kept", OrderStatus.PLACED, "0"));

        int rows = orders.forceFullResync();

        assertThat(rows).isEqualTo(1);
        assertThat(orderJpaRepository.findAll()).extracting(OrderEntity::getId).containsExactly("kept");
    }

    @Test
    @DisplayName("deals round trip with their legs and status")
    void dealsRoundTrip() {
        SyncedDealsRepository deals =
                new SyncedDealsRepository(new DurableSyncAdapter<>("deals", dealStore, Deal::getId, Runnable::run));
        Deal deal = deals.upsert(Deal.builder()
                .symbol("ETH/USDT")
                .targetProfitPercent(new BigDecimal("1.5"))
                .createdAt(1_700_000_000_000L)
                .build());
        deals.attachBuyLeg(deal.getId(), "order-1");

        List<Deal> loaded = dealStore.loadAll();

        assertThat(loaded).singleElement().satisfies(reloaded -> {
            assertThat(reloaded.getStatus()).isEqualTo(DealStatus.ACTIVE);
            assertThat(reloaded.getBuyOrderId()).isEqualTo("order-1");
            assertThat(reloaded.getTargetProfitPercent()).isEqualByComparingTo("1.5");
        });
    }
}
