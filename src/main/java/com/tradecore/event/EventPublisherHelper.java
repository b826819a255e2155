package com.tradecore.event;

import com.tradecore.domain.enums.OrderStatus;
import com.tradecore.domain.model.Order;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher}.
 *
 * <p>Delivery depends on the listener: synchronous {@code @EventListener} or
 * {@code @Async @EventListener} on the event executor.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Order ----

    public void publishOrderCanceled(Object source, Order order, OrderStatus previousStatus) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.CANCELED, previousStatus));
    }

    public void publishOrderReplaced(Object source, Order replacement, Order replaced) {
        applicationEventPublisher.publishEvent(new OrderEvent(
                source, replacement, OrderEventType.REPLACED, OrderStatus.PENDING, "replaces " + replaced.getId()));
    }

    public void publishReplacementFailed(Object source, Order canceled, String reason) {
        applicationEventPublisher.publishEvent(
                new OrderEvent(source, canceled, OrderEventType.REPLACEMENT_FAILED, canceled.getStatus(), reason));
    }

    public void publishFilledBeforeCancel(Object source, Order order, OrderStatus previousStatus) {
        applicationEventPublisher.publishEvent(
                new OrderEvent(source, order, OrderEventType.FILLED_BEFORE_CANCEL, previousStatus));
    }

    public void publishOutcomeUnknown(Object source, Order order, String reason) {
        applicationEventPublisher.publishEvent(
                new OrderEvent(source, order, OrderEventType.OUTCOME_UNKNOWN, order.getStatus(), reason));
    }

    public void publishOrderRepriced(Object source, Order order, String detail) {
        applicationEventPublisher.publishEvent(
                new OrderEvent(source, order, OrderEventType.REPRICED, order.getStatus(), detail));
    }

    // ---- System ----

    public void publishSystemEvent(Object source, SystemEventType eventType, String message) {
        applicationEventPublisher.publishEvent(new SystemEvent(source, eventType, message));
    }

    public void publishSystemEvent(
            Object source, SystemEventType eventType, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new SystemEvent(source, eventType, message, details));
    }
}
