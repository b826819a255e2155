package com.tradecore.unit.factory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradecore.config.StorageProperties;
import com.tradecore.domain.enums.OrderSide;
import com.tradecore.domain.enums.OrderType;
import com.tradecore.domain.enums.RepositoryKind;
import com.tradecore.domain.enums.StorageBackend;
import com.tradecore.domain.model.Deal;
import com.tradecore.domain.model.FlushOutcome;
import com.tradecore.domain.model.Order;
import com.tradecore.domain.model.StorageInfo;
import com.tradecore.domain.model.Ticker;
import com.tradecore.exception.RepositoryUnavailableException;
import com.tradecore.repository.factory.RepositoryFactory;
import com.tradecore.repository.sync.DurableStore;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for RepositoryFactory: per-kind fallback, single instances and factory-wide flushes.
 */
@DisplayName("RepositoryFactory")
class RepositoryFactoryTest {

    @TempDir
    Path tempDir;

    private StorageProperties properties;
    private DurableStore<Order> orderStore;
    private DurableStore<Deal> dealStore;
    private RepositoryFactory factory;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        properties = new StorageProperties();
        properties.getStreaming().setDumpDirectory(tempDir.resolve("batches").toString());
        orderStore = mock(DurableStore.class);
        dealStore = mock(DurableStore.class);
        when(orderStore.loadAll()).thenReturn(List.of());
        when(dealStore.loadAll()).thenReturn(List.of());
        factory = new RepositoryFactory(properties, orderStore, dealStore);
    }

    @AfterEach
    void tearDown() {
        factory.close();
    }

    private static Order buyOrder() {
        return Order.builder()
                .symbol("BTC/USDT")
                .side(OrderSide.BUY)
                .type(OrderType.LIMIT)
                .price(new BigDecimal("30000"))
                .requestedAmount(new BigDecimal("0.01"))
                .build();
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("each kind is constructed once")
        void singleInstance() {
            assertThat(factory.get(RepositoryKind.ORDERS)).isSameAs(factory.orders());
            assertThat(factory.tickers()).isSameAs(factory.get(RepositoryKind.TICKERS));
        }

        @Test
        @DisplayName("configured backends are used when they can be constructed")
        void configuredBackend() {
            assertThat(factory.orders().backend()).isEqualTo(StorageBackend.MEMORY_WITH_DURABLE_SYNC);
            assertThat(factory.tickers().backend()).isEqualTo(StorageBackend.MEMORY_WITH_DURABLE_SYNC);
            assertThat(tempDir.resolve("batches").resolve("tickers")).isDirectory();
        }

        @Test
        @DisplayName("an unreachable durable store falls back to memory for that kind only")
        void storeDownFallsBack() {
            doThrow(new RepositoryUnavailableException("orders store down")).when(orderStore).ping();

            assertThat(factory.orders().backend()).isEqualTo(StorageBackend.PURE_MEMORY_LEGACY);
            assertThat(factory.deals().backend()).isEqualTo(StorageBackend.MEMORY_WITH_DURABLE_SYNC);

            StorageInfo info = factory.storageInfo().get(RepositoryKind.ORDERS);
            assertThat(info.getConfigured()).isEqualTo(StorageBackend.MEMORY_WITH_DURABLE_SYNC);
            assertThat(info.getActual()).isEqualTo(StorageBackend.PURE_MEMORY_LEGACY);
            assertThat(info.getFallbackReason()).contains("orders store down");
        }

        @Test
        @DisplayName("an unusable dump directory falls back to a ring buffer")
        void dumpDirectoryUnusable() throws IOException {
            Path notADirectory = Files.createFile(tempDir.resolve("plain-file"));
            properties.getStreaming().setDumpDirectory(notADirectory.toString());

            assertThat(factory.tickers().backend()).isEqualTo(StorageBackend.PURE_MEMORY_LEGACY);
            assertThat(factory.storageInfo().get(RepositoryKind.TICKERS).getFallbackReason()).isNotNull();
        }

        @Test
        @DisplayName("a configured legacy backend is used without touching the durable store")
        void configuredLegacy() {
            properties.setOrders(StorageBackend.PURE_MEMORY_LEGACY);

            assertThat(factory.orders().backend()).isEqualTo(StorageBackend.PURE_MEMORY_LEGACY);
            assertThat(factory.storageInfo().get(RepositoryKind.ORDERS).getFallbackReason()).isNull();
        }

        @Test
        @DisplayName("existing never constructs a repository")
        void existingDoesNotConstruct() {
            assertThat(factory.existing(RepositoryKind.DEALS)).isEmpty();
            assertThat(factory.storageInfo().get(RepositoryKind.DEALS).isInstantiated()).isFalse();

            factory.deals();

            assertThat(factory.existing(RepositoryKind.DEALS)).isPresent();
        }
    }

    @Nested
    @DisplayName("Factory-wide flushes")
    class Flushes {

        @Test
        @DisplayName("forceSyncAll reports each kind and one failure does not stop the others")
        void forceSyncAll() {
            properties.setDeals(StorageBackend.PURE_MEMORY_LEGACY);
            factory.orders().upsert(buyOrder());
            factory.deals();
            assertThat(factory.awaitPendingSyncs(Duration.ofSeconds(5))).isTrue();

            Map<RepositoryKind, FlushOutcome> outcomes = factory.forceSyncAll();

            assertThat(outcomes.get(RepositoryKind.ORDERS).isSuccess()).isTrue();
            assertThat(outcomes.get(RepositoryKind.ORDERS).getRecordCount()).isEqualTo(1);
            assertThat(outcomes.get(RepositoryKind.DEALS).isSuccess()).isTrue();
            assertThat(outcomes.get(RepositoryKind.DEALS).getRecordCount()).isZero();
        }

        @Test
        @DisplayName("a failing resync is reported as a failed outcome")
        void forceSyncFailure() {
            doThrow(new RepositoryUnavailableException("write failed")).when(dealStore).replaceAll(any());
            factory.orders();
            factory.deals();

            Map<RepositoryKind, FlushOutcome> outcomes = factory.forceSyncAll();

            assertThat(outcomes.get(RepositoryKind.ORDERS).isSuccess()).isTrue();
            assertThat(outcomes.get(RepositoryKind.DEALS).isSuccess()).isFalse();
            assertThat(outcomes.get(RepositoryKind.DEALS).getError()).contains("write failed");
        }

        @Test
        @DisplayName("a store that pings but cannot load is never bulk-replaced")
        void unreadableStoreIsNotWiped() {
            when(orderStore.loadAll()).thenThrow(new RepositoryUnavailableException("orders table unreadable"));
            factory.orders().upsert(buyOrder());
            assertThat(factory.awaitPendingSyncs(Duration.ofSeconds(5))).isTrue();

            Map<RepositoryKind, FlushOutcome> outcomes = factory.forceSyncAll();

            assertThat(outcomes.get(RepositoryKind.ORDERS).isSuccess()).isFalse();
            assertThat(outcomes.get(RepositoryKind.ORDERS).getError()).contains("bulk replace refused");
            verify(orderStore, never()).replaceAll(any());
            verify(orderStore, times(2)).upsert(any());
            assertThat(factory.storageInfo().get(RepositoryKind.ORDERS).getActual())
                    .isEqualTo(StorageBackend.MEMORY_WITH_DURABLE_SYNC);
        }

        @Test
        @DisplayName("forceDumpAll dumps buffers and reports ring buffers as nothing to write")
        void forceDumpAll() {
            properties.setIndicators(StorageBackend.PURE_MEMORY_LEGACY);
            factory.tickers().append(Ticker.builder()
                    .symbol("BTC/USDT")
                    .timestamp(1L)
                    .last(new BigDecimal("30000"))
                    .build());
            factory.indicators();

            Map<RepositoryKind, FlushOutcome> outcomes = factory.forceDumpAll();

            assertThat(outcomes.get(RepositoryKind.TICKERS).isSuccess()).isTrue();
            assertThat(outcomes.get(RepositoryKind.TICKERS).getRecordCount()).isEqualTo(1);
            assertThat(outcomes.get(RepositoryKind.INDICATORS).isSuccess()).isTrue();
            assertThat(outcomes.get(RepositoryKind.INDICATORS).getRecordCount()).isZero();
            assertThat(outcomes).doesNotContainKey(RepositoryKind.ORDER_BOOKS);
        }

        @Test
        @DisplayName("stopIngestion stops every streaming repository")
        void stopIngestion() {
            factory.tickers();
            factory.orderBooks();

            factory.stopIngestion();

            assertThat(factory.tickers().isAccepting()).isFalse();
            assertThat(factory.orderBooks().isAccepting()).isFalse();
        }
    }
}
