package com.pwescrow.adapter.out.notification;

import com.pwescrow.adapter.out.eventbus.EventBusEscrowEventPublisher;
import com.pwescrow.application.port.out.ChatNotifier;
import com.pwescrow.config.EscrowSettings;
import com.pwescrow.domain.event.EscrowEvent;
import com.pwescrow.domain.model.EscrowState;
import com.pwescrow.infrastructure.config.EscrowEventCodec;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.pwescrow.support.TestDatabase.await;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class NotificationVerticleTest {

    private Vertx vertx;
    private ChatNotifier notifier;

    @BeforeEach
    void setUp() throws Exception {
        vertx = Vertx.vertx();
        vertx.eventBus().registerDefaultCodec(EscrowEvent.class, new EscrowEventCodec());

        notifier = mock(ChatNotifier.class);
        doAnswer(invocation -> Future.succeededFuture())
                .when(notifier).sendMessage(anyString(), anyString(), anyList());

        EscrowSettings settings = EscrowSettings.fromConfig(new JsonObject()
                .put("bot", new JsonObject().put("log_group_id", "-999")));
        await(vertx.deployVerticle(new NotificationVerticle(
                new EscrowMessageFormatter(settings, new PaymentInstructions(settings)), notifier)));
    }

    @AfterEach
    void tearDown() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        vertx.close().onComplete(ar -> latch.countDown());
        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }

    @Test
    void publishedCancellation_isSentToChatAndLogChat() {
        new EventBusEscrowEventPublisher(vertx).publish(EscrowEvent.stateChanged("PW-100000", "-100",
                EscrowState.AGREED, EscrowState.CANCELLED, new BigDecimal("10000"), "1002", List.of()));

        verify(notifier, timeout(5000)).sendMessage(eq("-100"), contains("cancelled"), any());
        verify(notifier, timeout(5000)).sendMessage(eq("-999"), contains("cancelled by 1002"), any());
    }
}
