package com.pwescrow.adapter.in.web.callback;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Keyboard callback as delivered by the chat transport: the button's data and the pressing user
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CallbackRequest(
        String data,
        String from
) {
    @JsonCreator
    public CallbackRequest(
            @JsonProperty("data") String data,
            @JsonProperty("from") String from
    ) {
        this.data = data;
        this.from = from;
    }
}
