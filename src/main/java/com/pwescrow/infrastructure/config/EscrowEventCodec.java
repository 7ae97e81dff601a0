package com.pwescrow.infrastructure.config;

import com.pwescrow.domain.event.EscrowEvent;
import com.pwescrow.domain.event.EscrowEventType;
import com.pwescrow.domain.model.ActionOffer;
import com.pwescrow.domain.model.EscrowAction;
import com.pwescrow.domain.model.EscrowState;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.eventbus.MessageCodec;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.math.BigDecimal;
import java.util.ArrayList;

/**
 * Message codec for EscrowEvent to enable event bus communication
 */
public class EscrowEventCodec implements MessageCodec<EscrowEvent, EscrowEvent> {

    @Override
    public void encodeToWire(Buffer buffer, EscrowEvent event) {
        Buffer encoded = toJson(event).toBuffer();
        buffer.appendInt(encoded.length());
        buffer.appendBuffer(encoded);
    }

    @Override
    public EscrowEvent decodeFromWire(int pos, Buffer buffer) {
        int length = buffer.getInt(pos);
        JsonObject json = new JsonObject(buffer.getBuffer(pos + 4, pos + 4 + length));
        return fromJson(json);
    }

    @Override
    public EscrowEvent transform(EscrowEvent event) {
        return event;
    }

    @Override
    public String name() {
        return "EscrowEventCodec";
    }

    @Override
    public byte systemCodecID() {
        return -1;
    }

    static JsonObject toJson(EscrowEvent event) {
        JsonArray offers = new JsonArray();
        for (ActionOffer offer : event.getOffers()) {
            offers.add(new JsonObject()
                    .put("action", offer.action().getValue())
                    .put("partyId", offer.partyId())
                    .put("token", offer.token()));
        }

        return new JsonObject()
                .put("type", event.getType().name())
                .put("escrowCode", event.getEscrowCode())
                .put("chatId", event.getChatId())
                .put("from", event.getFrom() == null ? null : event.getFrom().getValue())
                .put("to", event.getTo() == null ? null : event.getTo().getValue())
                .put("amount", event.getAmount() == null ? null : event.getAmount().toPlainString())
                .put("reason", event.getReason())
                .put("actorId", event.getActorId())
                .put("waitingOn", new JsonArray(new ArrayList<>(event.getWaitingOn())))
                .put("offers", offers);
    }

    static EscrowEvent fromJson(JsonObject json) {
        EscrowEvent.EscrowEventBuilder builder = EscrowEvent.builder()
                .type(EscrowEventType.valueOf(json.getString("type")))
                .escrowCode(json.getString("escrowCode"))
                .chatId(json.getString("chatId"))
                .reason(json.getString("reason"))
                .actorId(json.getString("actorId"));

        String from = json.getString("from");
        if (from != null) {
            builder.from(EscrowState.fromValue(from));
        }
        String to = json.getString("to");
        if (to != null) {
            builder.to(EscrowState.fromValue(to));
        }
        String amount = json.getString("amount");
        if (amount != null) {
            builder.amount(new BigDecimal(amount));
        }

        JsonArray waitingOn = json.getJsonArray("waitingOn", new JsonArray());
        for (int i = 0; i < waitingOn.size(); i++) {
            builder.waitingParty(waitingOn.getString(i));
        }

        JsonArray offers = json.getJsonArray("offers", new JsonArray());
        for (int i = 0; i < offers.size(); i++) {
            JsonObject offer = offers.getJsonObject(i);
            builder.offer(new ActionOffer(
                    EscrowAction.fromValue(offer.getString("action")),
                    offer.getString("partyId"),
                    offer.getString("token")));
        }

        return builder.build();
    }
}
