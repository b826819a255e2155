package com.tradecore.event;

import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published on engine lifecycle milestones (startup recovery, shutdown) and storage degradation.
 */
public class SystemEvent extends ApplicationEvent {

    private final SystemEventType eventType;
    private final String message;
    private final Map<String, Object> details;

    public SystemEvent(Object source, SystemEventType eventType, String message) {
        this(source, eventType, message, Map.of());
    }

    public SystemEvent(Object source, SystemEventType eventType, String message, Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.message = message;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public SystemEventType getEventType() {
        return eventType;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
