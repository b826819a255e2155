package com.tradecore.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Ticker snapshot for one symbol. Price fields may be null when the exchange omits them. */
@Value
@Builder
public class Ticker implements StreamObservation {

    String symbol;
    long timestamp;
    BigDecimal last;
    BigDecimal bid;
    BigDecimal ask;
    BigDecimal high;
    BigDecimal low;
    BigDecimal open;
    BigDecimal close;
    BigDecimal baseVolume;
    BigDecimal changePercent;
}
