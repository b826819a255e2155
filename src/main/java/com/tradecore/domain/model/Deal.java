package com.tradecore.domain.model;

import com.tradecore.domain.enums.DealStatus;
import com.tradecore.exception.InvalidStateTransitionException;
import com.tradecore.exception.InvariantViolationException;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A paired buy/sell round trip for one symbol.
 *
 * <p>{@code buyOrderId} and {@code sellOrderId} are foreign keys into the orders repository.
 * While the deal is ACTIVE a non-null {@code buyOrderId} means the deal has an open buy leg;
 * a second one can only be attached after the first is detached (cancel/replace).
 * COMPLETED, CANCELED and FAILED are terminal: no leg can be attached afterwards.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Deal {

    private String id;
    private String symbol;

    @Builder.Default
    private DealStatus status = DealStatus.ACTIVE;

    private String buyOrderId;
    private String sellOrderId;

    /** Markup applied to the buy price to derive the sell price, in percent. */
    private BigDecimal targetProfitPercent;

    @Builder.Default
    private BigDecimal realizedProfit = BigDecimal.ZERO;

    /** Epoch millis. */
    private long createdAt;

    /** Epoch millis, 0 until a terminal state is reached. */
    private long completedAt;

    private String failureReason;

    // ---- Legs ----

    public void attachBuyOrder(String orderId) {
        if (status != DealStatus.ACTIVE) {
            throw new InvariantViolationException(
                    String.format("Deal %s is %s, cannot attach buy order %s", id, status, orderId));
        }
        if (buyOrderId != null) {
            throw new InvariantViolationException(String.format(
                    "Deal %s already has open buy leg %s, cannot attach %s", id, buyOrderId, orderId));
        }
        this.buyOrderId = orderId;
    }

    /** Drops the buy leg reference after its order was canceled. */
    public void detachBuyOrder() {
        if (status.isTerminal()) {
            throw new InvariantViolationException(
                    String.format("Deal %s is %s, legs are frozen", id, status));
        }
        this.buyOrderId = null;
    }

    public void attachSellOrder(String orderId) {
        if (status.isTerminal()) {
            throw new InvariantViolationException(
                    String.format("Deal %s is %s, cannot attach sell order %s", id, status, orderId));
        }
        if (sellOrderId != null) {
            throw new InvariantViolationException(String.format(
                    "Deal %s already has sell leg %s, cannot attach %s", id, sellOrderId, orderId));
        }
        this.sellOrderId = orderId;
    }

    public boolean hasOpenBuyLeg() {
        return status == DealStatus.ACTIVE && buyOrderId != null;
    }

    // ---- State machine ----

    /** Buy leg filled, waiting for the sell leg. */
    public void markWaitingSell() {
        transitionTo(DealStatus.WAITING_SELL);
    }

    public void complete(BigDecimal realizedProfit, long now) {
        transitionTo(DealStatus.COMPLETED);
        this.realizedProfit = realizedProfit;
        this.completedAt = now;
    }

    public void cancel(long now) {
        transitionTo(DealStatus.CANCELED);
        this.completedAt = now;
    }

    public void fail(String reason, long now) {
        transitionTo(DealStatus.FAILED);
        this.failureReason = reason;
        this.completedAt = now;
    }

    private void transitionTo(DealStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException("Deal", id, status, target);
        }
        this.status = target;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Deal copy() {
        return toBuilder().build();
    }
}
