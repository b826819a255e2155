package com.tradecore.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Top-of-book summary of an order book. Full depth is not retained in the streaming tier;
 * {@code bidVolume}/{@code askVolume} aggregate the first {@code depthLevels} levels.
 */
@Value
@Builder
public class OrderBookSnapshot implements StreamObservation {

    String symbol;
    long timestamp;
    BigDecimal bestBid;
    BigDecimal bestAsk;
    BigDecimal bidVolume;
    BigDecimal askVolume;
    BigDecimal spread;
    int depthLevels;
}
