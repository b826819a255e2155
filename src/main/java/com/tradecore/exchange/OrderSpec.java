package com.tradecore.exchange;

import com.tradecore.domain.enums.OrderSide;
import com.tradecore.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Placement request sent to the exchange. */
@Value
@Builder
public class OrderSpec {

    String symbol;
    OrderSide side;
    OrderType type;
    BigDecimal price;
    BigDecimal amount;

    /** Idempotency key; the exchange deduplicates placements carrying the same value. */
    String clientOrderId;
}
