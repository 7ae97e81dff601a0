package com.pwescrow.adapter.out.notification;

import com.pwescrow.adapter.out.eventbus.EventBusEscrowEventPublisher;
import com.pwescrow.adapter.out.notification.EscrowMessageFormatter.OutgoingMessage;
import com.pwescrow.application.port.out.ChatNotifier;
import com.pwescrow.domain.event.EscrowEvent;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.eventbus.MessageConsumer;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Event bus consumer turning committed escrow events into chat messages.
 * Messages of one event are sent in order.
 */
@Slf4j
public class NotificationVerticle extends AbstractVerticle {

    private final EscrowMessageFormatter formatter;
    private final ChatNotifier chatNotifier;

    private MessageConsumer<EscrowEvent> consumer;

    public NotificationVerticle(EscrowMessageFormatter formatter, ChatNotifier chatNotifier) {
        this.formatter = formatter;
        this.chatNotifier = chatNotifier;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting Notification Verticle...");

        consumer = vertx.eventBus().consumer(EventBusEscrowEventPublisher.ESCROW_EVENT_ADDRESS, message -> {
            EscrowEvent event = message.body();
            log.debug("Received {} event for escrow {}", event.getType(), event.getEscrowCode());

            deliver(formatter.format(event))
                    .onSuccess(v -> log.debug("Notified {} event for escrow {}", event.getType(), event.getEscrowCode()))
                    .onFailure(error -> log.error("Failed to notify {} event for escrow {}",
                            event.getType(), event.getEscrowCode(), error));
        });

        consumer.completionHandler(ar -> {
            if (ar.succeeded()) {
                log.info("Notification Verticle started successfully");
                startPromise.complete();
            } else {
                startPromise.fail(ar.cause());
            }
        });
    }

    @Override
    public void stop() {
        if (consumer != null) {
            consumer.unregister();
        }
        log.info("Notification Verticle stopped");
    }

    private Future<Void> deliver(List<OutgoingMessage> messages) {
        Future<Void> future = Future.succeededFuture();
        for (OutgoingMessage outgoing : messages) {
            future = future.compose(v -> chatNotifier.sendMessage(outgoing.chatId(), outgoing.text(), outgoing.buttons()));
        }
        return future;
    }
}
