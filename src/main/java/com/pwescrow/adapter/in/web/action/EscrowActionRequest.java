package com.pwescrow.adapter.in.web.action;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EscrowActionRequest(
        String action,
        String token,
        String requestingParty
) {
    @JsonCreator
    public EscrowActionRequest(
            @JsonProperty("action") String action,
            @JsonProperty("token") String token,
            @JsonProperty("requestingParty") String requestingParty
    ) {
        this.action = action;
        this.token = token;
        this.requestingParty = requestingParty;
    }
}
