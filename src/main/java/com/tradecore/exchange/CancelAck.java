package com.tradecore.exchange;

import lombok.Builder;
import lombok.Value;

/** Exchange acknowledgement of a cancel request. */
@Value
@Builder
public class CancelAck {

    String exchangeId;
    boolean canceled;
}
