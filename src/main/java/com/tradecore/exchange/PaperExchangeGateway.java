package com.tradecore.exchange;

import com.tradecore.config.ExchangeConfig;
import com.tradecore.domain.enums.OrderSide;
import com.tradecore.domain.enums.OrderStatus;
import com.tradecore.domain.enums.OrderType;
import com.tradecore.exception.ExchangeRejectedException;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * In-process paper exchange. Active when {@code tradecore.exchange.mode=PAPER} (the default).
 *
 * <p>Market prices are pushed in with {@link #setMarketPrice}. Each price update fills resting
 * limit orders it crosses in full: buys priced at or above the market, sells at or below it.
 * Market orders fill immediately at the current price. Placements carrying an already seen
 * {@code clientOrderId} return the original acknowledgement.
 */
@Service
@ConditionalOnProperty(prefix = "tradecore.exchange", name = "mode", havingValue = "PAPER", matchIfMissing = true)
public class PaperExchangeGateway implements ExchangeGateway {

    private static final Logger log = LoggerFactory.getLogger(PaperExchangeGateway.class);

    private final ExchangeConfig.Paper paperConfig;
    private final Map<String, BigDecimal> marketPrices = new ConcurrentHashMap<>();
    private final Map<String, PaperOrder> orders = new ConcurrentHashMap<>();
    private final Map<String, String> exchangeIdByClientOrderId = new ConcurrentHashMap<>();
    private final AtomicLong orderSequence = new AtomicLong();

    public PaperExchangeGateway(ExchangeConfig exchangeConfig) {
        this.paperConfig = exchangeConfig.getPaper();
    }

    @Override
    public synchronized OrderAck placeOrder(OrderSpec spec) {
        if (spec.getClientOrderId() != null) {
            String existing = exchangeIdByClientOrderId.get(spec.getClientOrderId());
            if (existing != null) {
                log.debug("Paper placeOrder deduplicated by clientOrderId={}", spec.getClientOrderId());
                return ack(orders.get(existing));
            }
        }

        BigDecimal market = marketPrices.get(spec.getSymbol());
        BigDecimal price = spec.getType() == OrderType.MARKET ? market : spec.getPrice();
        if (price == null) {
            throw new ExchangeRejectedException("No price for " + spec.getType() + " order on " + spec.getSymbol());
        }
        String violation = symbolRules(spec.getSymbol()).violation(price, spec.getAmount());
        if (violation != null) {
            throw new ExchangeRejectedException("Order refused: " + violation);
        }

        String exchangeId = "PAPER-" + orderSequence.incrementAndGet();
        PaperOrder order = new PaperOrder(exchangeId, spec.getClientOrderId(), spec.getSymbol(), spec.getSide(), price,
                spec.getAmount());
        orders.put(exchangeId, order);
        if (spec.getClientOrderId() != null) {
            exchangeIdByClientOrderId.put(spec.getClientOrderId(), exchangeId);
        }
        if (market != null && crosses(order, market)) {
            order.fill();
        }
        log.debug("Paper placeOrder: {} {} {} @ {} -> {} ({})",
                spec.getSide(), spec.getAmount(), spec.getSymbol(), price, exchangeId, order.status);
        return ack(order);
    }

    @Override
    public synchronized CancelAck cancelOrder(String exchangeId, String symbol) {
        PaperOrder order = find(exchangeId);
        if (order.status != OrderStatus.PLACED && order.status != OrderStatus.PARTIALLY_FILLED) {
            throw new ExchangeRejectedException("Order " + exchangeId + " is " + order.status + ", cannot cancel");
        }
        order.status = OrderStatus.CANCELED;
        log.debug("Paper cancelOrder: {}", exchangeId);
        return CancelAck.builder().exchangeId(exchangeId).canceled(true).build();
    }

    @Override
    public ExchangeOrderStatus fetchOrderStatus(String exchangeId, String symbol) {
        PaperOrder order = find(exchangeId);
        synchronized (this) {
            return ExchangeOrderStatus.builder()
                    .exchangeId(exchangeId)
                    .status(order.status)
                    .filledAmount(order.filled)
                    .averageFillPrice(order.filled.signum() > 0 ? order.price : null)
                    .build();
        }
    }

    @Override
    public BigDecimal fetchMarketPrice(String symbol) {
        BigDecimal price = marketPrices.get(symbol);
        if (price == null) {
            throw new ExchangeRejectedException("No market price for " + symbol);
        }
        return price;
    }

    @Override
    public SymbolRules symbolRules(String symbol) {
        return SymbolRules.builder()
                .symbol(symbol)
                .pricePrecision(paperConfig.getPricePrecision())
                .amountPrecision(paperConfig.getAmountPrecision())
                .minAmount(paperConfig.getMinAmount())
                .minNotional(paperConfig.getMinNotional())
                .build();
    }

    // ---- Simulation controls ----

    /** Sets the market price and fills every resting order the new price crosses. */
    public synchronized void setMarketPrice(String symbol, BigDecimal price) {
        marketPrices.put(symbol, price);
        for (PaperOrder order : orders.values()) {
            if (order.symbol.equals(symbol) && order.status == OrderStatus.PLACED && crosses(order, price)) {
                order.fill();
                log.debug("Paper fill: {} {} @ {}", order.exchangeId, order.side, order.price);
            }
        }
    }

    public Optional<OrderStatus> statusOf(String exchangeId) {
        PaperOrder order = orders.get(exchangeId);
        return order == null ? Optional.empty() : Optional.of(order.status);
    }

    private boolean crosses(PaperOrder order, BigDecimal market) {
        return order.side == OrderSide.BUY ? order.price.compareTo(market) >= 0 : order.price.compareTo(market) <= 0;
    }

    private PaperOrder find(String exchangeId) {
        PaperOrder order = orders.get(exchangeId);
        if (order == null) {
            throw new ExchangeRejectedException("Unknown order " + exchangeId);
        }
        return order;
    }

    private OrderAck ack(PaperOrder order) {
        return OrderAck.builder()
                .exchangeId(order.exchangeId)
                .clientOrderId(order.clientOrderId)
                .status(order.status)
                .build();
    }

    private static final class PaperOrder {

        private final String exchangeId;
        private final String clientOrderId;
        private final String symbol;
        private final OrderSide side;
        private final BigDecimal price;
        private final BigDecimal amount;
        private BigDecimal filled = BigDecimal.ZERO;
        private OrderStatus status = OrderStatus.PLACED;

        private PaperOrder(
                String exchangeId, String clientOrderId, String symbol, OrderSide side, BigDecimal price,
                BigDecimal amount) {
            this.exchangeId = exchangeId;
            this.clientOrderId = clientOrderId;
            this.symbol = symbol;
            this.side = side;
            this.price = price;
            this.amount = amount;
        }

        private void fill() {
            filled = amount;
            status = OrderStatus.FILLED;
        }
    }
}
