package com.tradecore.exchange;

import com.tradecore.domain.enums.OrderStatus;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Order state as reported by the exchange. {@code filledAmount} is cumulative. */
@Value
@Builder
public class ExchangeOrderStatus {

    String exchangeId;
    OrderStatus status;
    BigDecimal filledAmount;
    BigDecimal averageFillPrice;
}
