package com.tradecore.exchange;

import com.tradecore.domain.enums.CallStatus;

/**
 * Result of a state-changing exchange call.
 *
 * <p>UNKNOWN means the request may or may not have reached the exchange (timeout or transport
 * failure after sending). Callers must query the order status before acting on it.
 */
public final class CallOutcome<T> {

    private final CallStatus status;
    private final T value;
    private final String reason;

    private CallOutcome(CallStatus status, T value, String reason) {
        this.status = status;
        this.value = value;
        this.reason = reason;
    }

    public static <T> CallOutcome<T> confirmed(T value) {
        return new CallOutcome<>(CallStatus.CONFIRMED, value, null);
    }

    public static <T> CallOutcome<T> rejected(String reason) {
        return new CallOutcome<>(CallStatus.REJECTED, null, reason);
    }

    public static <T> CallOutcome<T> unknown(String reason) {
        return new CallOutcome<>(CallStatus.UNKNOWN, null, reason);
    }

    public CallStatus getStatus() {
        return status;
    }

    /** Present only when CONFIRMED. */
    public T getValue() {
        return value;
    }

    public String getReason() {
        return reason;
    }

    public boolean isConfirmed() {
        return status == CallStatus.CONFIRMED;
    }

    public boolean isRejected() {
        return status == CallStatus.REJECTED;
    }

    public boolean isUnknown() {
        return status == CallStatus.UNKNOWN;
    }

    @Override
    public String toString() {
        return reason == null ? "CallOutcome[" + status + "]" : "CallOutcome[" + status + ", " + reason + "]";
    }
}
