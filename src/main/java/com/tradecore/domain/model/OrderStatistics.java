package com.tradecore.domain.model;

import com.tradecore.domain.enums.OrderStatus;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Snapshot counts over the orders table. */
@Value
@Builder
public class OrderStatistics {

    long total;
    long open;
    Map<OrderStatus, Long> byStatus;
    long withErrors;
}
