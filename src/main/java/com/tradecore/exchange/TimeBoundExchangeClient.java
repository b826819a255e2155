package com.tradecore.exchange;

import com.tradecore.config.ExchangeConfig;
import com.tradecore.exception.ExchangeException;
import com.tradecore.exception.ExchangeRejectedException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.math.BigDecimal;
import java.util.concurrent.Callable;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Time-bounded access to the {@link ExchangeGateway}.
 *
 * <p>Every call runs on the exchange executor under a Resilience4j {@link TimeLimiter} and a
 * shared {@link CircuitBreaker}. State-changing calls ({@link #place}, {@link #cancel}) return a
 * {@link CallOutcome}: a timeout or transport failure after the request may have been sent is
 * UNKNOWN, never assumed to be success or failure, and is never retried here. A request that
 * provably never left the process (executor saturated, circuit open) is REJECTED.
 *
 * <p>Queries are idempotent and retried a bounded number of times; they throw
 * {@link ExchangeException} when every attempt fails.
 */
@Component
public class TimeBoundExchangeClient {

    private static final Logger log = LoggerFactory.getLogger(TimeBoundExchangeClient.class);

    private final ExchangeGateway exchangeGateway;
    private final AsyncTaskExecutor exchangeExecutor;
    private final TimeLimiter timeLimiter;
    private final CircuitBreaker circuitBreaker;
    private final Retry queryRetry;

    public TimeBoundExchangeClient(
            ExchangeGateway exchangeGateway,
            ExchangeConfig exchangeConfig,
            @Qualifier("exchangeExecutor") AsyncTaskExecutor exchangeExecutor) {
        this.exchangeGateway = exchangeGateway;
        this.exchangeExecutor = exchangeExecutor;
        this.timeLimiter = TimeLimiter.of(
                "exchange",
                TimeLimiterConfig.custom()
                        .timeoutDuration(exchangeConfig.getCallTimeout())
                        .cancelRunningFuture(true)
                        .build());
        this.circuitBreaker = CircuitBreaker.of(
                "exchange",
                CircuitBreakerConfig.custom()
                        .failureRateThreshold(exchangeConfig.getCircuitFailureRateThreshold())
                        .slidingWindowSize(exchangeConfig.getCircuitSlidingWindowSize())
                        .minimumNumberOfCalls(exchangeConfig.getCircuitSlidingWindowSize())
                        .waitDurationInOpenState(exchangeConfig.getCircuitOpenDuration())
                        .ignoreExceptions(ExchangeRejectedException.class)
                        .build());
        this.queryRetry = Retry.of(
                "exchange-queries",
                RetryConfig.custom()
                        .maxAttempts(Math.max(1, exchangeConfig.getQueryAttempts()))
                        .waitDuration(exchangeConfig.getQueryRetryBackoff())
                        .ignoreExceptions(
                                ExchangeRejectedException.class,
                                CallNotPermittedException.class,
                                RejectedExecutionException.class)
                        .build());
    }

    // ---- State-changing calls (never retried) ----

    public CallOutcome<OrderAck> place(OrderSpec spec) {
        return stateChanging(
                "place " + spec.getSide() + " " + spec.getSymbol(), () -> exchangeGateway.placeOrder(spec));
    }

    public CallOutcome<CancelAck> cancel(String exchangeId, String symbol) {
        return stateChanging("cancel " + exchangeId, () -> exchangeGateway.cancelOrder(exchangeId, symbol));
    }

    private <T> CallOutcome<T> stateChanging(String operation, Callable<T> call) {
        try {
            return CallOutcome.confirmed(execute(call));
        } catch (ExchangeRejectedException e) {
            log.warn("Exchange rejected {}: {}", operation, e.getMessage());
            return CallOutcome.rejected(e.getMessage());
        } catch (CallNotPermittedException e) {
            log.warn("Exchange circuit open, {} not sent", operation);
            return CallOutcome.rejected("not sent: exchange circuit open");
        } catch (RejectedExecutionException e) {
            log.warn("Exchange executor saturated, {} not sent", operation);
            return CallOutcome.rejected("not sent: exchange executor saturated");
        } catch (TimeoutException e) {
            log.warn("Exchange call {} timed out, outcome unknown", operation);
            return CallOutcome.unknown("timeout: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CallOutcome.unknown("interrupted");
        } catch (Exception e) {
            log.warn("Exchange call {} failed, outcome unknown: {}", operation, e.getMessage());
            return CallOutcome.unknown(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    // ---- Queries (idempotent, retried) ----

    /**
     * @throws ExchangeRejectedException if the exchange refuses the query (e.g. unknown order)
     * @throws ExchangeException if every attempt failed or timed out
     */
    public ExchangeOrderStatus fetchOrderStatus(String exchangeId, String symbol) {
        return query("fetch status of " + exchangeId, () -> exchangeGateway.fetchOrderStatus(exchangeId, symbol));
    }

    public BigDecimal fetchMarketPrice(String symbol) {
        return query("fetch price of " + symbol, () -> exchangeGateway.fetchMarketPrice(symbol));
    }

    public SymbolRules symbolRules(String symbol) {
        return query("fetch rules of " + symbol, () -> exchangeGateway.symbolRules(symbol));
    }

    private <T> T query(String operation, Callable<T> call) {
        try {
            return Retry.decorateCallable(queryRetry, () -> execute(call)).call();
        } catch (ExchangeRejectedException | ExchangeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeException(operation + " interrupted", e);
        } catch (Exception e) {
            throw new ExchangeException(operation + " failed: " + e.getMessage(), e);
        }
    }

    private <T> T execute(Callable<T> call) throws Exception {
        Callable<T> timed = TimeLimiter.decorateFutureSupplier(timeLimiter, () -> exchangeExecutor.submit(call));
        return CircuitBreaker.decorateCallable(circuitBreaker, timed).call();
    }

    public CircuitBreaker.State circuitState() {
        return circuitBreaker.getState();
    }
}
