package com.tradecore.oms;

import com.tradecore.config.StaleOrderMonitorConfig;
import com.tradecore.domain.enums.OrderSide;
import com.tradecore.domain.enums.OrderStatus;
import com.tradecore.domain.enums.OrderType;
import com.tradecore.domain.model.Deal;
import com.tradecore.domain.model.MonitorStatistics;
import com.tradecore.domain.model.Order;
import com.tradecore.event.EventPublisherHelper;
import com.tradecore.exception.BaseException;
import com.tradecore.exchange.CallOutcome;
import com.tradecore.exchange.CancelAck;
import com.tradecore.exchange.ExchangeOrderStatus;
import com.tradecore.exchange.OrderAck;
import com.tradecore.exchange.OrderSpec;
import com.tradecore.exchange.SymbolRules;
import com.tradecore.exchange.TimeBoundExchangeClient;
import com.tradecore.repository.DealsRepository;
import com.tradecore.repository.OrdersRepository;
import com.tradecore.repository.factory.RepositoryFactory;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Cancels and re-places open BUY orders that have gone stale.
 *
 * <p>An open buy order is stale when it is older than {@code maxAge} or its limit price deviates
 * from the market price by more than {@code maxDeviationPercent}. SELL orders are never touched.
 * For each stale order:
 * <ol>
 *   <li>cancel it on the exchange, then read its status to learn what filled before the cancel</li>
 *   <li>mark it CANCELED with those fills in the orders repository and detach it from its deal</li>
 *   <li>place a replacement slightly below market for the unfilled amount</li>
 *   <li>persist the replacement and attach it as the deal's buy leg</li>
 *   <li>reprice the deal's pending sell order from the new buy price</li>
 * </ol>
 *
 * <p>An order found filled during re-verification is updated from the exchange and not replaced.
 * A placement whose outcome is unknown is stored as PENDING with the reason and never retried
 * automatically. Each deal is replaced at most once per {@code minRecreationCooldown}.
 *
 * <p>Ticks run on {@code @Scheduled(fixedDelay)} while the monitor is started; {@link #checkOnce}
 * is the synchronous core.
 */
@Component
public class StaleOrderMonitor {

    private static final Logger log = LoggerFactory.getLogger(StaleOrderMonitor.class);

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final RepositoryFactory repositoryFactory;
    private final TimeBoundExchangeClient exchangeClient;
    private final EventPublisherHelper eventPublisherHelper;
    private final StaleOrderMonitorConfig config;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Map<String, Long> lastRecreationByDeal = new ConcurrentHashMap<>();

    private final AtomicLong checksPerformed = new AtomicLong();
    private final AtomicLong staleOrdersFound = new AtomicLong();
    private final AtomicLong ordersCanceled = new AtomicLong();
    private final AtomicLong ordersRecreated = new AtomicLong();
    private final AtomicLong recreationFailures = new AtomicLong();
    private final AtomicLong skippedByCooldown = new AtomicLong();
    private final AtomicLong ambiguousOutcomes = new AtomicLong();

    public StaleOrderMonitor(
            RepositoryFactory repositoryFactory,
            TimeBoundExchangeClient exchangeClient,
            EventPublisherHelper eventPublisherHelper,
            StaleOrderMonitorConfig config) {
        this.repositoryFactory = repositoryFactory;
        this.exchangeClient = exchangeClient;
        this.eventPublisherHelper = eventPublisherHelper;
        this.config = config;
    }

    // ---- Lifecycle ----

    public void start() {
        if (!config.isEnabled()) {
            log.info("Stale order monitor disabled by configuration");
            return;
        }
        if (running.compareAndSet(false, true)) {
            log.info("Stale order monitor started: maxAge={}, maxDeviation={}%, interval={}",
                    config.getMaxAge(), config.getMaxDeviationPercent(), config.getCheckInterval());
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Stale order monitor stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Scheduled(fixedDelayString = "${tradecore.monitor.check-interval:PT30S}")
    public void tick() {
        if (!running.get()) {
            return;
        }
        try {
            checkOnce(System.currentTimeMillis());
        } catch (Exception e) {
            log.error("Stale order check failed", e);
        }
    }

    // ---- Check ----

    /**
     * Evaluates every open buy order once and handles the stale ones.
     *
     * @param now epoch millis used for age and cooldown decisions
     * @return number of stale orders found
     */
    public synchronized int checkOnce(long now) {
        checksPerformed.incrementAndGet();
        long cooldownMs = config.getMinRecreationCooldown().toMillis();
        lastRecreationByDeal.values().removeIf(recreatedAt -> now - recreatedAt >= cooldownMs);
        List<Order> openBuys = repositoryFactory.orders().findOpenBuyOrders();
        if (openBuys.isEmpty()) {
            return 0;
        }

        Map<String, Optional<BigDecimal>> marketPrices = new HashMap<>();
        int stale = 0;
        for (Order order : openBuys) {
            if (now - order.getCreatedAt() < config.getGracePeriod().toMillis()) {
                continue;
            }
            Optional<BigDecimal> market = marketPrices.computeIfAbsent(order.getSymbol(), this::marketPrice);
            if (market.isEmpty() || !isStale(order, market.get(), now)) {
                continue;
            }
            stale++;
            staleOrdersFound.incrementAndGet();

            String cooldownKey = cooldownKey(order);
            Long last = lastRecreationByDeal.get(cooldownKey);
            if (last != null && now - last < cooldownMs) {
                skippedByCooldown.incrementAndGet();
                log.info("Skipping stale order {} of deal {}: recreated {}ms ago, cooldown {}ms",
                        order.getId(), order.getDealId(), now - last, cooldownMs);
                continue;
            }

            try {
                handleStale(order, market.get(), now);
            } catch (BaseException e) {
                log.error("Handling stale order {} failed: {}", order.getId(), e.getMessage(), e);
            }
        }
        return stale;
    }

    /**
     * An order is stale if it is older than {@code maxAge} or its price deviates from
     * {@code marketPrice} by more than {@code maxDeviationPercent}. Orders without a price are
     * judged on age only.
     */
    public boolean isStale(Order order, BigDecimal marketPrice, long now) {
        if (now - order.getCreatedAt() > config.getMaxAge().toMillis()) {
            return true;
        }
        BigDecimal price = order.getPrice();
        if (price == null || price.signum() <= 0 || marketPrice == null) {
            return false;
        }
        BigDecimal deviationPercent = marketPrice.subtract(price).abs()
                .divide(price, MathContext.DECIMAL64)
                .multiply(HUNDRED);
        return deviationPercent.compareTo(config.getMaxDeviationPercent()) > 0;
    }

    /**
     * Replacement price: {@code replacementOffsetPercent} below market, never above market, rounded
     * down to the symbol's price precision.
     */
    public BigDecimal replacementPrice(BigDecimal marketPrice, SymbolRules rules) {
        BigDecimal factor = BigDecimal.ONE.subtract(
                config.getReplacementOffsetPercent().divide(HUNDRED, MathContext.DECIMAL64));
        BigDecimal offset = marketPrice.multiply(factor);
        return rules.roundPriceDown(offset.min(marketPrice));
    }

    // ---- Stale order workflow ----

    private void handleStale(Order order, BigDecimal marketPrice, long now) {
        log.warn("Stale BUY order: id={}, exchangeId={}, deal={}, symbol={}, price={}, market={}, ageMs={}",
                order.getId(), order.getExchangeId(), order.getDealId(), order.getSymbol(),
                order.getPrice(), marketPrice, now - order.getCreatedAt());

        Optional<Order> canceled = cancel(order, now);
        if (canceled.isEmpty()) {
            return;
        }
        detachFromDeal(canceled.get());
        replace(canceled.get(), marketPrice, now);
    }

    /**
     * Cancels the order and records it as CANCELED with the fills the exchange reports.
     *
     * @return the canceled order, or empty if it must not be replaced
     */
    private Optional<Order> cancel(Order order, long now) {
        OrdersRepository orders = repositoryFactory.orders();
        OrderStatus previous = order.getStatus();

        CallOutcome<CancelAck> outcome = exchangeClient.cancel(order.getExchangeId(), order.getSymbol());
        if (outcome.isConfirmed() && outcome.getValue().isCanceled()) {
            // The ack does not carry fills; the replacement is sized from the exchange's filled amount
            ExchangeOrderStatus status;
            try {
                status = exchangeClient.fetchOrderStatus(order.getExchangeId(), order.getSymbol());
            } catch (BaseException e) {
                order.markCanceled(now);
                order.recordFailure("canceled, filled amount unverified: " + e.getMessage(), now);
                Order stored = orders.upsert(order);
                ordersCanceled.incrementAndGet();
                ambiguousOutcomes.incrementAndGet();
                eventPublisherHelper.publishOrderCanceled(this, stored, previous);
                eventPublisherHelper.publishOutcomeUnknown(this, stored, "cancel confirmed, status query failed");
                detachFromDeal(stored);
                log.error("Canceled stale order {} but could not read its fills, not replacing: {}",
                        stored.getExchangeId(), e.getMessage());
                return Optional.empty();
            }
            return recordCanceled(order, status, previous, now);
        }

        log.warn("Cancel of {} not confirmed ({}), querying exchange status", order.getExchangeId(), outcome);
        ExchangeOrderStatus status;
        try {
            status = exchangeClient.fetchOrderStatus(order.getExchangeId(), order.getSymbol());
        } catch (BaseException e) {
            ambiguousOutcomes.incrementAndGet();
            order.recordFailure("cancel outcome unknown: " + e.getMessage(), now);
            Order stored = orders.upsert(order);
            eventPublisherHelper.publishOutcomeUnknown(this, stored, "cancel " + outcome + ", status query failed");
            log.error("Cancel of {} unresolved: status query failed: {}", order.getExchangeId(), e.getMessage());
            return Optional.empty();
        }

        switch (status.getStatus()) {
            case CANCELED -> {
                return recordCanceled(order, status, previous, now);
            }
            case FILLED, PARTIALLY_FILLED -> {
                applyFills(order, status, now);
                Order stored = orders.upsert(order);
                eventPublisherHelper.publishFilledBeforeCancel(this, stored, previous);
                log.info("Stale order {} was {} before cancel, not replacing (filled={})",
                        stored.getExchangeId(), status.getStatus(), stored.getFilledAmount());
                return Optional.empty();
            }
            default -> {
                if (outcome.isRejected()) {
                    order.recordFailure("cancel rejected: " + outcome.getReason(), now);
                    orders.upsert(order);
                    log.warn("Cancel of {} rejected and order still {} on exchange, will retry next check",
                            order.getExchangeId(), status.getStatus());
                } else {
                    ambiguousOutcomes.incrementAndGet();
                    order.recordFailure("cancel outcome unknown: " + outcome.getReason(), now);
                    Order stored = orders.upsert(order);
                    eventPublisherHelper.publishOutcomeUnknown(this, stored, "cancel " + outcome);
                    log.error("Cancel of {} unresolved: exchange still reports {}",
                            order.getExchangeId(), status.getStatus());
                }
                return Optional.empty();
            }
        }
    }

    private Optional<Order> recordCanceled(Order order, ExchangeOrderStatus status, OrderStatus previous, long now) {
        OrdersRepository orders = repositoryFactory.orders();
        applyFills(order, status, now);
        if (order.getStatus() == OrderStatus.FILLED) {
            Order stored = orders.upsert(order);
            eventPublisherHelper.publishFilledBeforeCancel(this, stored, previous);
            log.info("Stale order {} filled completely before the cancel landed, not replacing", stored.getExchangeId());
            return Optional.empty();
        }
        order.markCanceled(now);
        Order stored = orders.upsert(order);
        ordersCanceled.incrementAndGet();
        eventPublisherHelper.publishOrderCanceled(this, stored, previous);
        log.info("Canceled stale order {} ({}), filled {} of {}",
                stored.getId(), stored.getExchangeId(), stored.getFilledAmount(), stored.getRequestedAmount());
        return Optional.of(stored);
    }

    private void applyFills(Order order, ExchangeOrderStatus status, long now) {
        BigDecimal filled = status.getFilledAmount();
        if (filled != null && filled.compareTo(order.getFilledAmount()) > 0) {
            order.applyFill(filled, status.getAverageFillPrice(), now);
        }
    }

    private void detachFromDeal(Order canceled) {
        if (canceled.getDealId() == null) {
            return;
        }
        DealsRepository deals = repositoryFactory.deals();
        deals.get(canceled.getDealId())
                .filter(deal -> canceled.getId().equals(deal.getBuyOrderId()) && !deal.isTerminal())
                .ifPresent(deal -> deals.detachBuyLeg(deal.getId()));
    }

    private void replace(Order canceled, BigDecimal marketPrice, long now) {
        Optional<Deal> deal = canceled.getDealId() == null
                ? Optional.empty()
                : repositoryFactory.deals().get(canceled.getDealId());
        if (deal.isPresent() && deal.get().isTerminal()) {
            log.info("Deal {} is {}, not replacing order {}", deal.get().getId(), deal.get().getStatus(), canceled.getId());
            return;
        }

        SymbolRules rules;
        try {
            rules = exchangeClient.symbolRules(canceled.getSymbol());
        } catch (BaseException e) {
            replacementFailed(canceled, "symbol rules unavailable: " + e.getMessage(), now);
            return;
        }

        BigDecimal price = replacementPrice(marketPrice, rules);
        BigDecimal amount = rules.roundAmountDown(canceled.remainingAmount());
        String violation = rules.violation(price, amount);
        if (violation != null) {
            replacementFailed(canceled, "replacement refused locally: " + violation, now);
            return;
        }

        Order replacement = Order.builder()
                .clientOrderId("stale-" + UUID.randomUUID())
                .symbol(canceled.getSymbol())
                .side(OrderSide.BUY)
                .type(OrderType.LIMIT)
                .price(price)
                .requestedAmount(amount)
                .dealId(canceled.getDealId())
                .replacesOrderId(canceled.getId())
                .createdAt(now)
                .lastUpdatedAt(now)
                .build();

        CallOutcome<OrderAck> placed = exchangeClient.place(OrderSpec.builder()
                .symbol(replacement.getSymbol())
                .side(OrderSide.BUY)
                .type(OrderType.LIMIT)
                .price(price)
                .amount(amount)
                .clientOrderId(replacement.getClientOrderId())
                .build());

        if (placed.isRejected()) {
            replacementFailed(canceled, "replacement rejected: " + placed.getReason(), now);
            return;
        }
        OrdersRepository orders = repositoryFactory.orders();
        if (placed.isUnknown()) {
            ambiguousOutcomes.incrementAndGet();
            replacement.recordFailure("placement outcome unknown: " + placed.getReason(), now);
            Order stored = orders.upsert(replacement);
            eventPublisherHelper.publishOutcomeUnknown(this, stored, "place " + placed);
            log.error("Replacement {} for order {} has unknown outcome ({}), left PENDING for reconciliation",
                    stored.getClientOrderId(), canceled.getId(), placed.getReason());
            return;
        }

        OrderAck ack = placed.getValue();
        replacement.markPlaced(ack.getExchangeId(), now);
        if (ack.getStatus() == OrderStatus.FILLED) {
            replacement.applyFill(amount, price, now);
        }
        Order stored = orders.upsert(replacement);
        if (deal.isPresent()) {
            try {
                repositoryFactory.deals().attachBuyLeg(deal.get().getId(), stored.getId());
            } catch (BaseException e) {
                stored.recordFailure("not attached to deal: " + e.getMessage(), now);
                orders.upsert(stored);
                log.error("Replacement {} placed but could not be attached to deal {}: {}",
                        stored.getId(), deal.get().getId(), e.getMessage());
            }
        }

        ordersRecreated.incrementAndGet();
        lastRecreationByDeal.put(cooldownKey(stored), now);
        eventPublisherHelper.publishOrderReplaced(this, stored, canceled);
        log.info("Replaced stale order {} with {} ({}): price {} -> {}, amount {}",
                canceled.getId(), stored.getId(), stored.getExchangeId(), canceled.getPrice(), price, amount);

        deal.ifPresent(d -> repricePendingSell(d, canceled, stored, rules, now));
    }

    private void replacementFailed(Order canceled, String reason, long now) {
        recreationFailures.incrementAndGet();
        canceled.recordFailure(reason, now);
        Order stored = repositoryFactory.orders().upsert(canceled);
        eventPublisherHelper.publishReplacementFailed(this, stored, reason);
        log.error("Could not replace stale order {} of deal {}: {}", canceled.getId(), canceled.getDealId(), reason);
    }

    /**
     * Prices the deal's pending sell from the new buy. Its amount covers what the canceled buy
     * already filled plus the replacement.
     */
    private void repricePendingSell(Deal deal, Order canceled, Order newBuy, SymbolRules rules, long now) {
        OrdersRepository orders = repositoryFactory.orders();
        Optional<Order> pendingSell = orders.findPendingSellForDeal(deal.getId());
        if (pendingSell.isEmpty()) {
            return;
        }
        BigDecimal markup = deal.getTargetProfitPercent() != null ? deal.getTargetProfitPercent() : BigDecimal.ZERO;
        BigDecimal sellPrice = newBuy.getPrice()
                .multiply(BigDecimal.ONE.add(markup.divide(HUNDRED, MathContext.DECIMAL64)))
                .setScale(rules.getPricePrecision(), RoundingMode.UP);

        Order sell = pendingSell.get();
        BigDecimal previousPrice = sell.getPrice();
        sell.setPrice(sellPrice);
        sell.setRequestedAmount(rules.roundAmountDown(canceled.getFilledAmount().add(newBuy.getRequestedAmount())));
        sell.setLastUpdatedAt(now);
        Order stored = orders.upsert(sell);
        eventPublisherHelper.publishOrderRepriced(this, stored, "price " + previousPrice + " -> " + sellPrice);
        log.info("Repriced pending SELL {} of deal {}: {} -> {}", stored.getId(), deal.getId(), previousPrice, sellPrice);
    }

    private Optional<BigDecimal> marketPrice(String symbol) {
        try {
            return Optional.of(exchangeClient.fetchMarketPrice(symbol));
        } catch (BaseException e) {
            log.warn("No market price for {}, skipping its orders this check: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    private static String cooldownKey(Order order) {
        return order.getDealId() != null ? order.getDealId() : order.getId();
    }

    public MonitorStatistics statistics() {
        return MonitorStatistics.builder()
                .running(running.get())
                .checksPerformed(checksPerformed.get())
                .staleOrdersFound(staleOrdersFound.get())
                .ordersCanceled(ordersCanceled.get())
                .ordersRecreated(ordersRecreated.get())
                .recreationFailures(recreationFailures.get())
                .skippedByCooldown(skippedByCooldown.get())
                .ambiguousOutcomes(ambiguousOutcomes.get())
                .cooldownEntries(lastRecreationByDeal.size())
                .build();
    }
}
