package com.pwescrow.domain.exception;

import com.pwescrow.domain.model.TokenDenialReason;
import lombok.Getter;

@Getter
public class TokenDeniedException extends EscrowException {

    private final TokenDenialReason denialReason;

    public TokenDeniedException(TokenDenialReason denialReason) {
        super("Action denied: " + denialReason.getMessage());
        this.denialReason = denialReason;
    }

    @Override
    public String getReason() {
        return denialReason.getValue();
    }
}
