package com.pwescrow.domain.exception;

import lombok.Getter;

@Getter
public class EscrowNotFoundException extends EscrowException {

    private final String escrowCode;

    public EscrowNotFoundException(String escrowCode) {
        super("Escrow not found: " + escrowCode);
        this.escrowCode = escrowCode;
    }

    @Override
    public String getReason() {
        return "not_found";
    }
}
