package com.pwescrow.adapter.in.web.form;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Escrow form as sent by the chat transport: either the raw eight-line text in {@code form}
 * or the fields one by one
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EscrowFormRequest(
        String chatId,
        Creator creator,
        String form,
        String buyer,
        String seller,
        String dealTitle,
        String description,
        String amount,
        String delivery,
        String refundConditions,
        String disputeAgreement
) {
    @JsonCreator
    public EscrowFormRequest(
            @JsonProperty("chatId") String chatId,
            @JsonProperty("creator") Creator creator,
            @JsonProperty("form") String form,
            @JsonProperty("buyer") String buyer,
            @JsonProperty("seller") String seller,
            @JsonProperty("dealTitle") String dealTitle,
            @JsonProperty("description") String description,
            @JsonProperty("amount") String amount,
            @JsonProperty("delivery") String delivery,
            @JsonProperty("refundConditions") String refundConditions,
            @JsonProperty("disputeAgreement") String disputeAgreement
    ) {
        this.chatId = chatId;
        this.creator = creator;
        this.form = form;
        this.buyer = buyer;
        this.seller = seller;
        this.dealTitle = dealTitle;
        this.description = description;
        this.amount = amount;
        this.delivery = delivery;
        this.refundConditions = refundConditions;
        this.disputeAgreement = disputeAgreement;
    }

    public boolean isTextForm() {
        return form != null && !form.isBlank();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Creator(
            @JsonProperty("id") String id,
            @JsonProperty("username") String username,
            @JsonProperty("firstName") String firstName,
            @JsonProperty("lastName") String lastName
    ) {}
}
