package com.pwescrow.adapter.out.eventbus;

import com.pwescrow.application.port.out.EscrowEventPublisher;
import com.pwescrow.domain.event.EscrowEvent;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

/**
 * Publisher for escrow events to the Vert.x event bus
 */
@Slf4j
public class EventBusEscrowEventPublisher implements EscrowEventPublisher {

    public static final String ESCROW_EVENT_ADDRESS = "escrow.events";

    private final Vertx vertx;

    public EventBusEscrowEventPublisher(Vertx vertx) {
        this.vertx = vertx;
    }

    @Override
    public void publish(EscrowEvent event) {
        log.debug("Publishing {} event for escrow {}", event.getType(), event.getEscrowCode());
        vertx.eventBus().publish(ESCROW_EVENT_ADDRESS, event);
    }
}
