package com.pwescrow.application.port.out;

import com.pwescrow.domain.event.EscrowEvent;

import java.util.List;

/**
 * Outbound port to the notification side. Callers invoke it only after their unit of work has committed.
 */
public interface EscrowEventPublisher {

    void publish(EscrowEvent event);

    default void publishAll(List<EscrowEvent> events) {
        events.forEach(this::publish);
    }
}
