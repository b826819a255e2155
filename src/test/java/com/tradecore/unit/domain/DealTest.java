package com.tradecore.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradecore.domain.enums.DealStatus;
import com.tradecore.domain.model.Deal;
import com.tradecore.exception.InvalidStateTransitionException;
import com.tradecore.exception.InvariantViolationException;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Deal")
class DealTest {

    private Deal activeDeal() {
        return Deal.builder().id("DEAL-1").symbol("ETH/USDT").targetProfitPercent(new BigDecimal("1.5")).build();
    }

    @Test
    @DisplayName("an active deal holds at most one open buy leg")
    void singleOpenBuyLeg() {
        Deal deal = activeDeal();
        deal.attachBuyOrder("ORD-1");

        assertThat(deal.hasOpenBuyLeg()).isTrue();
        assertThatThrownBy(() -> deal.attachBuyOrder("ORD-2"))
                .isInstanceOf(InvariantViolationException.class)
                .hasMessageContaining("ORD-1");
    }

    @Test
    @DisplayName("detaching the buy leg allows a replacement to be attached")
    void detachThenAttach() {
        Deal deal = activeDeal();
        deal.attachBuyOrder("ORD-1");

        deal.detachBuyOrder();
        deal.attachBuyOrder("ORD-2");

        assertThat(deal.getBuyOrderId()).isEqualTo("ORD-2");
    }

    @Test
    @DisplayName("terminal deals reject new legs")
    void terminalDealsAreFrozen() {
        Deal deal = activeDeal();
        deal.cancel(5_000L);

        assertThat(deal.isTerminal()).isTrue();
        assertThat(deal.getCompletedAt()).isEqualTo(5_000L);
        assertThatThrownBy(() -> deal.attachBuyOrder("ORD-9")).isInstanceOf(InvariantViolationException.class);
        assertThatThrownBy(() -> deal.attachSellOrder("ORD-9")).isInstanceOf(InvariantViolationException.class);
    }

    @Test
    @DisplayName("completion goes through WAITING_SELL")
    void completionPath() {
        Deal deal = activeDeal();

        assertThatThrownBy(() -> deal.complete(BigDecimal.ONE, 1L))
                .isInstanceOf(InvalidStateTransitionException.class);

        deal.markWaitingSell();
        deal.complete(new BigDecimal("12.5"), 9_000L);

        assertThat(deal.getStatus()).isEqualTo(DealStatus.COMPLETED);
        assertThat(deal.getRealizedProfit()).isEqualByComparingTo("12.5");
    }
}
