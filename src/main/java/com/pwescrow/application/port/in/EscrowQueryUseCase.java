package com.pwescrow.application.port.in;

import com.pwescrow.domain.model.ActionLogEntry;
import com.pwescrow.domain.model.Escrow;
import io.vertx.core.Future;

import java.util.List;

public interface EscrowQueryUseCase {

    /**
     * @return Future with the escrow and its log, failed with EscrowNotFoundException for unknown codes
     */
    Future<EscrowView> findByCode(String escrowCode);

    record EscrowView(Escrow escrow, List<ActionLogEntry> log) {}
}
