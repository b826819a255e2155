package com.tradecore.unit.exchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradecore.config.AsyncConfig;
import com.tradecore.config.ExchangeConfig;
import com.tradecore.domain.enums.OrderSide;
import com.tradecore.domain.enums.OrderStatus;
import com.tradecore.domain.enums.OrderType;
import com.tradecore.exception.ExchangeException;
import com.tradecore.exception.ExchangeRejectedException;
import com.tradecore.exchange.CallOutcome;
import com.tradecore.exchange.CancelAck;
import com.tradecore.exchange.ExchangeGateway;
import com.tradecore.exchange.OrderAck;
import com.tradecore.exchange.OrderSpec;
import com.tradecore.exchange.TimeBoundExchangeClient;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadPoolExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Unit tests for TimeBoundExchangeClient: outcome classification of state-changing calls,
 * query retries and the circuit breaker.
 */
class TimeBoundExchangeClientTest {

    private ExchangeGateway exchangeGateway;
    private ExchangeConfig exchangeConfig;
    private ThreadPoolTaskExecutor executor;

    private final OrderSpec spec = OrderSpec.builder()
            .symbol("BTC/USDT")
            .side(OrderSide.BUY)
            .type(OrderType.LIMIT)
            .price(new BigDecimal("30000"))
            .amount(new BigDecimal("0.01"))
            .clientOrderId("client-1")
            .build();

    @BeforeEach
    void setUp() {
        exchangeGateway = mock(ExchangeGateway.class);
        exchangeConfig = new ExchangeConfig();
        exchangeConfig.setCallTimeout(Duration.ofMillis(200));
        exchangeConfig.setQueryRetryBackoff(Duration.ofMillis(10));
        executor = AsyncConfig.boundedExecutor("exchange-test-", 2, 2, 10, new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private TimeBoundExchangeClient client() {
        return new TimeBoundExchangeClient(exchangeGateway, exchangeConfig, executor);
    }

    @Nested
    @DisplayName("State-changing calls")
    class StateChanging {

        @Test
        @DisplayName("an acknowledged placement is CONFIRMED")
        void confirmed() {
            OrderAck ack = OrderAck.builder().exchangeId("EX-1").status(OrderStatus.PLACED).build();
            when(exchangeGateway.placeOrder(spec)).thenReturn(ack);

            CallOutcome<OrderAck> outcome = client().place(spec);

            assertThat(outcome.isConfirmed()).isTrue();
            assertThat(outcome.getValue()).isEqualTo(ack);
        }

        @Test
        @DisplayName("an exchange refusal is REJECTED with the reason")
        void rejected() {
            when(exchangeGateway.placeOrder(spec)).thenThrow(new ExchangeRejectedException("insufficient balance"));

            CallOutcome<OrderAck> outcome = client().place(spec);

            assertThat(outcome.isRejected()).isTrue();
            assertThat(outcome.getReason()).contains("insufficient balance");
        }

        @Test
        @DisplayName("a timeout is UNKNOWN and is not retried")
        void timeoutIsUnknown() {
            when(exchangeGateway.cancelOrder("EX-1", "BTC/USDT")).thenAnswer(invocation -> {
                Thread.sleep(2_000);
                return CancelAck.builder().exchangeId("EX-1").canceled(true).build();
            });

            CallOutcome<CancelAck> outcome = client().cancel("EX-1", "BTC/USDT");

            assertThat(outcome.isUnknown()).isTrue();
            verify(exchangeGateway, times(1)).cancelOrder("EX-1", "BTC/USDT");
        }

        @Test
        @DisplayName("a transport failure is UNKNOWN")
        void transportFailureIsUnknown() {
            when(exchangeGateway.placeOrder(spec)).thenThrow(new IllegalStateException("connection reset"));

            CallOutcome<OrderAck> outcome = client().place(spec);

            assertThat(outcome.isUnknown()).isTrue();
            assertThat(outcome.getReason()).contains("connection reset");
            verify(exchangeGateway, times(1)).placeOrder(spec);
        }

        @Test
        @DisplayName("a saturated executor never sends the request and is REJECTED")
        @SuppressWarnings("unchecked")
        void saturatedExecutor() {
            AsyncTaskExecutor saturated = mock(AsyncTaskExecutor.class);
            when(saturated.submit(any(Callable.class))).thenThrow(new TaskRejectedException("queue full"));
            TimeBoundExchangeClient client = new TimeBoundExchangeClient(exchangeGateway, exchangeConfig, saturated);

            CallOutcome<OrderAck> outcome = client.place(spec);

            assertThat(outcome.isRejected()).isTrue();
            verify(exchangeGateway, never()).placeOrder(any());
        }

        @Test
        @DisplayName("an open circuit rejects calls without reaching the exchange")
        void openCircuit() {
            exchangeConfig.setCircuitSlidingWindowSize(2);
            when(exchangeGateway.placeOrder(spec)).thenThrow(new IllegalStateException("connection reset"));
            TimeBoundExchangeClient client = client();

            client.place(spec);
            client.place(spec);
            CallOutcome<OrderAck> third = client.place(spec);

            assertThat(client.circuitState()).isEqualTo(CircuitBreaker.State.OPEN);
            assertThat(third.isRejected()).isTrue();
            assertThat(third.getReason()).contains("circuit open");
            verify(exchangeGateway, times(2)).placeOrder(spec);
        }

        @Test
        @DisplayName("exchange refusals do not open the circuit")
        void rejectionsDoNotOpenCircuit() {
            exchangeConfig.setCircuitSlidingWindowSize(2);
            when(exchangeGateway.placeOrder(spec)).thenThrow(new ExchangeRejectedException("min notional"));
            TimeBoundExchangeClient client = client();

            client.place(spec);
            client.place(spec);
            client.place(spec);

            assertThat(client.circuitState()).isEqualTo(CircuitBreaker.State.CLOSED);
            verify(exchangeGateway, times(3)).placeOrder(spec);
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("a transient failure is retried")
        void retried() {
            when(exchangeGateway.fetchMarketPrice("BTC/USDT"))
                    .thenThrow(new IllegalStateException("502"))
                    .thenReturn(new BigDecimal("30100"));

            assertThat(client().fetchMarketPrice("BTC/USDT")).isEqualByComparingTo("30100");
            verify(exchangeGateway, times(2)).fetchMarketPrice("BTC/USDT");
        }

        @Test
        @DisplayName("exhausted retries surface as ExchangeException")
        void exhausted() {
            when(exchangeGateway.fetchMarketPrice("BTC/USDT")).thenThrow(new IllegalStateException("502"));

            assertThatThrownBy(() -> client().fetchMarketPrice("BTC/USDT"))
                    .isInstanceOf(ExchangeException.class)
                    .hasMessageContaining("fetch price of BTC/USDT");
            verify(exchangeGateway, times(3)).fetchMarketPrice("BTC/USDT");
        }

        @Test
        @DisplayName("a refused query is not retried")
        void refusedNotRetried() {
            when(exchangeGateway.fetchOrderStatus("EX-9", "BTC/USDT"))
                    .thenThrow(new ExchangeRejectedException("Unknown order EX-9"));

            assertThatThrownBy(() -> client().fetchOrderStatus("EX-9", "BTC/USDT"))
                    .isInstanceOf(ExchangeRejectedException.class);
            verify(exchangeGateway, times(1)).fetchOrderStatus("EX-9", "BTC/USDT");
        }
    }
}
