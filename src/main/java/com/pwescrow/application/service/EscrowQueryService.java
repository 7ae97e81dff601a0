package com.pwescrow.application.service;

import com.pwescrow.application.port.in.EscrowQueryUseCase;
import com.pwescrow.application.port.out.EscrowLogRepository;
import com.pwescrow.application.port.out.EscrowRepository;
import com.pwescrow.domain.exception.EscrowNotFoundException;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-only lookup of an escrow and its log
 */
@Slf4j
@RequiredArgsConstructor
public class EscrowQueryService implements EscrowQueryUseCase {

    private final EscrowRepository escrowRepository;
    private final EscrowLogRepository logRepository;

    @Override
    public Future<EscrowView> findByCode(String escrowCode) {
        log.debug("Querying escrow {}", escrowCode);

        return escrowRepository.findByCode(escrowCode)
                .compose(found -> found
                        .map(escrow -> logRepository.findByEscrow(escrow.getId())
                                .map(entries -> new EscrowView(escrow, entries)))
                        .orElseGet(() -> Future.<EscrowView>failedFuture(new EscrowNotFoundException(escrowCode))));
    }
}
