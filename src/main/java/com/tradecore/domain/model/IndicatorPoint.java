package com.tradecore.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** One computed indicator value (e.g. RSI 14 on the 1m timeframe). */
@Value
@Builder
public class IndicatorPoint implements StreamObservation {

    String symbol;
    long timestamp;
    String indicator;
    String timeframe;
    BigDecimal value;
}
