package com.tradecore.unit.exchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradecore.config.ExchangeConfig;
import com.tradecore.domain.enums.OrderSide;
import com.tradecore.domain.enums.OrderStatus;
import com.tradecore.domain.enums.OrderType;
import com.tradecore.exception.ExchangeRejectedException;
import com.tradecore.exchange.ExchangeOrderStatus;
import com.tradecore.exchange.OrderAck;
import com.tradecore.exchange.OrderSpec;
import com.tradecore.exchange.PaperExchangeGateway;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PaperExchangeGatewayTest {

    private static final String SYMBOL = "ETH/USDT";

    private PaperExchangeGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new PaperExchangeGateway(new ExchangeConfig());
        gateway.setMarketPrice(SYMBOL, new BigDecimal("2000"));
    }

    private OrderSpec limit(OrderSide side, String price, String clientOrderId) {
        return OrderSpec.builder()
                .symbol(SYMBOL)
                .side(side)
                .type(OrderType.LIMIT)
                .price(new BigDecimal(price))
                .amount(new BigDecimal("0.5"))
                .clientOrderId(clientOrderId)
                .build();
    }

    @Test
    @DisplayName("a buy below market rests until the price reaches it")
    void restingBuyFillsOnPriceDrop() {
        OrderAck ack = gateway.placeOrder(limit(OrderSide.BUY, "1990", "c-1"));
        assertThat(ack.getStatus()).isEqualTo(OrderStatus.PLACED);

        gateway.setMarketPrice(SYMBOL, new BigDecimal("1990"));

        ExchangeOrderStatus status = gateway.fetchOrderStatus(ack.getExchangeId(), SYMBOL);
        assertThat(status.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(status.getFilledAmount()).isEqualByComparingTo("0.5");
        assertThat(status.getAverageFillPrice()).isEqualByComparingTo("1990");
    }

    @Test
    @DisplayName("a marketable limit and a market order fill immediately")
    void marketableFillsImmediately() {
        assertThat(gateway.placeOrder(limit(OrderSide.SELL, "1999", "c-2")).getStatus())
                .isEqualTo(OrderStatus.FILLED);

        OrderAck market = gateway.placeOrder(OrderSpec.builder()
                .symbol(SYMBOL)
                .side(OrderSide.BUY)
                .type(OrderType.MARKET)
                .amount(new BigDecimal("0.5"))
                .build());
        assertThat(market.getStatus()).isEqualTo(OrderStatus.FILLED);
    }

    @Test
    @DisplayName("a repeated clientOrderId returns the original order")
    void deduplicatesByClientOrderId() {
        OrderAck first = gateway.placeOrder(limit(OrderSide.BUY, "1900", "dup"));
        OrderAck second = gateway.placeOrder(limit(OrderSide.BUY, "1800", "dup"));

        assertThat(second.getExchangeId()).isEqualTo(first.getExchangeId());
    }

    @Test
    @DisplayName("orders below the minimum notional are refused")
    void minNotional() {
        OrderSpec tiny = OrderSpec.builder()
                .symbol(SYMBOL)
                .side(OrderSide.BUY)
                .type(OrderType.LIMIT)
                .price(new BigDecimal("1"))
                .amount(new BigDecimal("1"))
                .build();

        assertThatThrownBy(() -> gateway.placeOrder(tiny))
                .isInstanceOf(ExchangeRejectedException.class)
                .hasMessageContaining("notional");
    }

    @Test
    @DisplayName("only open orders can be canceled")
    void cancel() {
        OrderAck resting = gateway.placeOrder(limit(OrderSide.BUY, "1900", "c-3"));
        OrderAck filled = gateway.placeOrder(limit(OrderSide.BUY, "2100", "c-4"));

        assertThat(gateway.cancelOrder(resting.getExchangeId(), SYMBOL).isCanceled()).isTrue();
        assertThat(gateway.statusOf(resting.getExchangeId())).contains(OrderStatus.CANCELED);
        assertThatThrownBy(() -> gateway.cancelOrder(filled.getExchangeId(), SYMBOL))
                .isInstanceOf(ExchangeRejectedException.class);
        assertThatThrownBy(() -> gateway.cancelOrder("PAPER-404", SYMBOL))
                .isInstanceOf(ExchangeRejectedException.class);
    }

    @Test
    @DisplayName("a symbol without a price has no market price")
    void noMarketPrice() {
        assertThatThrownBy(() -> gateway.fetchMarketPrice("XRP/USDT")).isInstanceOf(ExchangeRejectedException.class);
    }
}
