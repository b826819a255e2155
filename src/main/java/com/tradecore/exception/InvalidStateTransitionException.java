package com.tradecore.exception;

import java.util.Map;

/**
 * Thrown when an Order or Deal is asked to move to a state its state machine does not allow.
 * Business-level error: returned to the caller, never swallowed.
 */
public class InvalidStateTransitionException extends BusinessException {

    public InvalidStateTransitionException(String entityType, String entityId, Enum<?> from, Enum<?> to) {
        super(
                ErrorCode.INVALID_STATE_TRANSITION,
                String.format("%s %s cannot transition %s -> %s", entityType, entityId, from, to),
                Map.of("entityType", entityType, "entityId", String.valueOf(entityId), "from", from, "to", to));
    }
}
