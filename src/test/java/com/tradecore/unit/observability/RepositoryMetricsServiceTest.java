package com.tradecore.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.tradecore.config.StorageProperties;
import com.tradecore.domain.enums.OrderSide;
import com.tradecore.domain.enums.OrderStatus;
import com.tradecore.domain.enums.OrderType;
import com.tradecore.domain.enums.RepositoryKind;
import com.tradecore.domain.enums.StorageBackend;
import com.tradecore.domain.model.Deal;
import com.tradecore.domain.model.MonitorStatistics;
import com.tradecore.domain.model.Order;
import com.tradecore.domain.model.Ticker;
import com.tradecore.event.OrderEvent;
import com.tradecore.event.OrderEventType;
import com.tradecore.observability.RepositoryMetricsService;
import com.tradecore.oms.StaleOrderMonitor;
import com.tradecore.repository.factory.RepositoryFactory;
import com.tradecore.repository.sync.DurableStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.annotation.Async;

/**
 * Tests for RepositoryMetricsService gauges and counters using SimpleMeterRegistry.
 */
class RepositoryMetricsServiceTest {

    @TempDir
    Path tempDir;

    private SimpleMeterRegistry meterRegistry;
    private RepositoryFactory repositoryFactory;
    private StaleOrderMonitor staleOrderMonitor;
    private RepositoryMetricsService metricsService;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        StorageProperties properties = new StorageProperties();
        properties.getStreaming().setDumpDirectory(tempDir.toString());
        properties.setDeals(StorageBackend.PURE_MEMORY_LEGACY);
        DurableStore<Order> orderStore = mock(DurableStore.class);
        when(orderStore.loadAll()).thenReturn(List.of());
        repositoryFactory = new RepositoryFactory(properties, orderStore, mock(DurableStore.class));

        staleOrderMonitor = mock(StaleOrderMonitor.class);
        when(staleOrderMonitor.statistics()).thenReturn(MonitorStatistics.builder()
                .staleOrdersFound(4)
                .ordersRecreated(3)
                .recreationFailures(1)
                .build());

        meterRegistry = new SimpleMeterRegistry();
        metricsService = new RepositoryMetricsService(meterRegistry, repositoryFactory, staleOrderMonitor);
    }

    @AfterEach
    void tearDown() {
        repositoryFactory.close();
    }

    private double gauge(String name, String kind) {
        return meterRegistry.get(name).tag("kind", kind).gauge().value();
    }

    @Test
    @DisplayName("gauges read zero for kinds not constructed yet and never construct them")
    void gaugesDoNotConstruct() {
        assertThat(gauge("tradecore.repository.rows", "orders")).isZero();
        assertThat(gauge("tradecore.sync.pending", "orders")).isZero();
        assertThat(gauge("tradecore.stream.memory.bytes", "tickers")).isZero();

        assertThat(repositoryFactory.existing(RepositoryKind.ORDERS)).isEmpty();
        assertThat(repositoryFactory.existing(RepositoryKind.TICKERS)).isEmpty();
    }

    @Test
    @DisplayName("row and buffer gauges follow the repositories")
    void rowAndBufferGauges() {
        repositoryFactory.orders().upsert(Order.builder()
                .symbol("BTC/USDT")
                .side(OrderSide.BUY)
                .type(OrderType.LIMIT)
                .price(new BigDecimal("30000"))
                .requestedAmount(new BigDecimal("0.01"))
                .status(OrderStatus.PENDING)
                .build());
        repositoryFactory.deals().upsert(Deal.builder().symbol("BTC/USDT").build());
        for (int i = 0; i < 3; i++) {
            repositoryFactory.tickers().append(Ticker.builder()
                    .symbol("BTC/USDT")
                    .timestamp(i)
                    .last(new BigDecimal("30000"))
                    .build());
        }

        assertThat(gauge("tradecore.repository.rows", "orders")).isEqualTo(1.0);
        assertThat(gauge("tradecore.repository.rows", "deals")).isEqualTo(1.0);
        assertThat(gauge("tradecore.repository.rows", "tickers")).isEqualTo(3.0);
        assertThat(gauge("tradecore.stream.memory.bytes", "tickers")).isEqualTo(1200.0);
        assertThat(gauge("tradecore.sync.dirty", "deals")).isZero();
    }

    @Test
    @DisplayName("monitor gauges read the monitor statistics")
    void monitorGauges() {
        assertThat(meterRegistry.get("tradecore.monitor.stale.found").gauge().value()).isEqualTo(4.0);
        assertThat(meterRegistry.get("tradecore.monitor.recreated").gauge().value()).isEqualTo(3.0);
        assertThat(meterRegistry.get("tradecore.monitor.recreation.failures").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("order events are counted by type")
    void orderEventCounter() {
        Order order = Order.builder().id("o-1").status(OrderStatus.PLACED).build();

        metricsService.onOrderEvent(new OrderEvent(this, order, OrderEventType.REPLACED, OrderStatus.PENDING));
        metricsService.onOrderEvent(new OrderEvent(this, order, OrderEventType.REPLACED, OrderStatus.PENDING));
        metricsService.onOrderEvent(new OrderEvent(this, order, OrderEventType.OUTCOME_UNKNOWN, OrderStatus.PLACED));

        assertThat(meterRegistry.get("tradecore.monitor.events").tag("type", "replaced").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get("tradecore.monitor.events").tag("type", "outcome_unknown").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("the order event listener runs on the event executor, off the monitor thread")
    void orderEventListenerIsAsync() throws NoSuchMethodException {
        Async async = RepositoryMetricsService.class
                .getMethod("onOrderEvent", OrderEvent.class)
                .getAnnotation(Async.class);

        assertThat(async).isNotNull();
        assertThat(async.value()).isEqualTo("eventExecutor");
    }
}
