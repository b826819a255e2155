package com.tradecore.exchange;

import com.tradecore.domain.enums.OrderStatus;
import lombok.Builder;
import lombok.Value;

/** Exchange acknowledgement of a placement. */
@Value
@Builder
public class OrderAck {

    String exchangeId;
    String clientOrderId;
    OrderStatus status;
}
