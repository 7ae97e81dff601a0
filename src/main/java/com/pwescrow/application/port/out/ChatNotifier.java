package com.pwescrow.application.port.out;

import io.vertx.core.Future;

import java.util.List;

/**
 * Outbound port to the chat transport
 */
public interface ChatNotifier {

    Future<Void> sendMessage(String chatId, String text, List<ChatButton> buttons);

    /**
     * Inline button; {@code callbackData} is echoed back by the transport when pressed
     */
    record ChatButton(String label, String callbackData) {}
}
