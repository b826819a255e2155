package com.tradecore.event;

import com.tradecore.domain.enums.OrderStatus;
import com.tradecore.domain.model.Order;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the stale-order monitor changes an order.
 *
 * <p>Carries a snapshot of the order after the change, the kind of change and the status the
 * order had before it. {@code detail} holds a human-readable reason for failures and unknown
 * outcomes.
 */
public class OrderEvent extends ApplicationEvent {

    private final Order order;
    private final OrderEventType eventType;
    private final OrderStatus previousStatus;
    private final String detail;

    public OrderEvent(Object source, Order order, OrderEventType eventType, OrderStatus previousStatus, String detail) {
        super(source);
        this.order = order;
        this.eventType = eventType;
        this.previousStatus = previousStatus;
        this.detail = detail;
    }

    public OrderEvent(Object source, Order order, OrderEventType eventType, OrderStatus previousStatus) {
        this(source, order, eventType, previousStatus, null);
    }

    public Order getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }

    /** May be null when the previous status is not known. */
    public OrderStatus getPreviousStatus() {
        return previousStatus;
    }

    public String getDetail() {
        return detail;
    }
}
