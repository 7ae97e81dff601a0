package com.pwescrow.adapter.out.notification;

import com.pwescrow.adapter.out.notification.EscrowMessageFormatter.OutgoingMessage;
import com.pwescrow.config.EscrowSettings;
import com.pwescrow.domain.event.EscrowEvent;
import com.pwescrow.domain.model.ActionOffer;
import com.pwescrow.domain.model.EscrowAction;
import com.pwescrow.domain.model.EscrowState;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EscrowMessageFormatterTest {

    private static final String CHAT = "-100";
    private static final String LOG_CHAT = "-999";

    private final EscrowSettings settings = EscrowSettings.fromConfig(new JsonObject()
            .put("bot", new JsonObject().put("log_group_id", LOG_CHAT)));
    private final EscrowMessageFormatter formatter =
            new EscrowMessageFormatter(settings, new PaymentInstructions(settings));

    @Test
    void agreementPreview_rendersRoleLockedButtons() {
        EscrowEvent event = EscrowEvent.stateChanged("PW-100000", CHAT, EscrowState.FORM_SUBMITTED,
                EscrowState.AGREEMENT_PREVIEW, new BigDecimal("10000"), "1001", List.of(
                        new ActionOffer(EscrowAction.AGREE_BUYER, "1001", "t1"),
                        new ActionOffer(EscrowAction.AGREE_SELLER, "1002", "t2"),
                        new ActionOffer(EscrowAction.DISAGREE, "1001", "t3")));

        List<OutgoingMessage> messages = formatter.format(event);

        assertEquals(1, messages.size());
        OutgoingMessage preview = messages.get(0);
        assertEquals(CHAT, preview.chatId());
        assertTrue(preview.text().contains("PW-100000"));
        assertEquals(3, preview.buttons().size());
        assertEquals("Agree (Buyer)", preview.buttons().get(0).label());
        assertEquals("agree_buyer|PW-100000|t1", preview.buttons().get(0).callbackData());
        assertEquals("Disagree (1001)", preview.buttons().get(2).label());
    }

    @Test
    void agreed_sendsPaymentInstructionsAndLogsAvailability() {
        EscrowEvent event = EscrowEvent.stateChanged("PW-100000", CHAT, EscrowState.AGREEMENT_PREVIEW,
                EscrowState.AGREED, new BigDecimal("10000"), "1002",
                List.of(new ActionOffer(EscrowAction.PAID_NOTIFY, "1001", "t4")));

        List<OutgoingMessage> messages = formatter.format(event);

        assertEquals(3, messages.size());
        assertEquals("paid_notify|PW-100000|t4", messages.get(0).buttons().get(0).callbackData());
        assertTrue(messages.get(1).text().contains("upi://pay?pa="));
        assertEquals(LOG_CHAT, messages.get(2).chatId());
        assertTrue(messages.get(2).text().contains("PAYMENT AVAILABLE for PW-100000"));
    }

    @Test
    void pending_tellsTheChatWhoIsMissing() {
        List<OutgoingMessage> messages = formatter.format(
                EscrowEvent.pending("PW-100000", CHAT, "1001", Set.of("1002")));

        assertEquals(1, messages.size());
        assertTrue(messages.get(0).text().endsWith("Waiting for: 1002"));
    }

    @Test
    void denial_withoutChatOnlyReachesTheLogChat() {
        List<OutgoingMessage> messages = formatter.format(
                EscrowEvent.denied("PW-100000", null, "1002", "wrong_user"));

        assertEquals(1, messages.size());
        assertEquals(LOG_CHAT, messages.get(0).chatId());
        assertTrue(messages.get(0).text().contains("wrong_user"));
    }

    @Test
    void intermediateStates_produceNoMessage() {
        assertTrue(formatter.format(EscrowEvent.stateChanged("PW-1", CHAT, EscrowState.CREATED,
                EscrowState.FORM_SUBMITTED, BigDecimal.TEN, "1001", List.of())).isEmpty());
    }

    @Test
    void money_usesRupeeWithGrouping() {
        assertEquals("₹1,234,567.80", EscrowMessageFormatter.money(new BigDecimal("1234567.8")));
    }
}
