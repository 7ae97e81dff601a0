package com.pwescrow.adapter.out.notification;

import com.pwescrow.application.port.out.ChatNotifier;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Default chat transport: writes outgoing messages to the log
 */
@Slf4j
public class LoggingChatNotifier implements ChatNotifier {

    @Override
    public Future<Void> sendMessage(String chatId, String text, List<ChatButton> buttons) {
        log.info("[chat {}] {}", chatId, text);
        for (ChatButton button : buttons) {
            log.info("[chat {}]   [{}] -> {}", chatId, button.label(), button.callbackData());
        }
        return Future.succeededFuture();
    }
}
