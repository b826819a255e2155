package com.tradecore.domain.model;

import com.tradecore.domain.enums.OrderSide;
import com.tradecore.domain.enums.OrderStatus;
import com.tradecore.domain.enums.OrderType;
import com.tradecore.exception.InvalidStateTransitionException;
import com.tradecore.exception.InvariantViolationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single exchange order.
 *
 * <p>Primary storage is the in-memory orders table; the relational store keeps a recovery copy.
 * Every status change goes through one of the event methods below ({@link #markPlaced},
 * {@link #applyFill}, {@link #markCanceled}, {@link #markRejected}); direct {@code setStatus}
 * calls are reserved for mappers and reconciliation.
 *
 * <p>{@code dealId} is a lookup key into the deals repository, not an ownership edge.
 * Amounts and prices are fixed-point decimals.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    private String id;

    /** Exchange-assigned order ID. Null while PENDING. */
    private String exchangeId;

    /** Idempotency key sent with the placement request. */
    private String clientOrderId;

    private String symbol;
    private OrderSide side;
    private OrderType type;

    /** Limit price. Null for MARKET orders. */
    private BigDecimal price;

    private BigDecimal requestedAmount;

    @Builder.Default
    private BigDecimal filledAmount = BigDecimal.ZERO;

    /** Volume-weighted average price across all partial fills. */
    private BigDecimal averageFillPrice;

    @Builder.Default
    private BigDecimal fees = BigDecimal.ZERO;

    @Builder.Default
    private OrderStatus status = OrderStatus.PENDING;

    /** Owning deal (weak reference). */
    private String dealId;

    /** Set on replacement orders: the canceled order this one replaces. */
    private String replacesOrderId;

    /** Epoch millis. */
    private long createdAt;

    /** Epoch millis. */
    private long lastUpdatedAt;

    private int retryCount;
    private String lastError;

    // ---- State machine ----

    /** Exchange acknowledged the order. */
    public void markPlaced(String exchangeId, long now) {
        transitionTo(OrderStatus.PLACED, now);
        this.exchangeId = exchangeId;
    }

    /**
     * Applies a fill report carrying the cumulative filled amount.
     * Moves to FILLED when the whole requested amount is filled, otherwise PARTIALLY_FILLED.
     */
    public void applyFill(BigDecimal cumulativeFilled, BigDecimal averagePrice, long now) {
        if (cumulativeFilled.compareTo(filledAmount) < 0) {
            throw new InvariantViolationException(String.format(
                    "Order %s filled amount cannot decrease: %s -> %s", id, filledAmount, cumulativeFilled));
        }
        if (cumulativeFilled.compareTo(requestedAmount) > 0) {
            throw new InvariantViolationException(String.format(
                    "Order %s overfilled: %s > requested %s", id, cumulativeFilled, requestedAmount));
        }

        OrderStatus target = cumulativeFilled.compareTo(requestedAmount) == 0
                ? OrderStatus.FILLED
                : OrderStatus.PARTIALLY_FILLED;
        if (cumulativeFilled.signum() == 0) {
            // Zero-amount reports are heartbeats, nothing to transition
            return;
        }
        transitionTo(target, now);
        this.filledAmount = cumulativeFilled;
        if (averagePrice != null) {
            this.averageFillPrice = averagePrice;
        }
    }

    /** Exchange reports a partially filled order as a plain open order again (e.g. after amend). */
    public void revertToPlaced(long now) {
        transitionTo(OrderStatus.PLACED, now);
    }

    /** Cancel confirmed by the exchange. Only valid while some amount is still unfilled. */
    public void markCanceled(long now) {
        if (filledAmount.compareTo(requestedAmount) >= 0) {
            throw new InvalidStateTransitionException("Order", id, status, OrderStatus.CANCELED);
        }
        transitionTo(OrderStatus.CANCELED, now);
    }

    public void markRejected(String reason, long now) {
        transitionTo(OrderStatus.REJECTED, now);
        this.lastError = reason;
    }

    /** Records a failure against this order without changing its status. */
    public void recordFailure(String reason, long now) {
        this.lastError = reason;
        this.retryCount++;
        this.lastUpdatedAt = now;
    }

    private void transitionTo(OrderStatus target, long now) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException("Order", id, status, target);
        }
        this.status = target;
        this.lastUpdatedAt = now;
    }

    // ---- Derived values ----

    public boolean isOpen() {
        return status.isOpen();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isBuy() {
        return side == OrderSide.BUY;
    }

    public BigDecimal remainingAmount() {
        return requestedAmount.subtract(filledAmount);
    }

    /** Fraction filled in [0, 1]. */
    public BigDecimal fillPercentage() {
        if (requestedAmount == null || requestedAmount.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return filledAmount.divide(requestedAmount, 8, RoundingMode.HALF_UP);
    }

    public BigDecimal notional() {
        return price != null && requestedAmount != null ? price.multiply(requestedAmount) : BigDecimal.ZERO;
    }

    /** Independent copy; the in-memory table never hands out its own instances. */
    public Order copy() {
        return toBuilder().build();
    }
}
