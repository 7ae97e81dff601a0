package com.pwescrow.adapter.out.persistence;

import com.pwescrow.application.port.out.EscrowRepository;
import com.pwescrow.domain.model.Escrow;
import com.pwescrow.domain.model.EscrowState;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * JDBC implementation of EscrowRepository
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcEscrowPersistenceAdapter implements EscrowRepository {

    private final SqlClient sqlClient;

    @Override
    public Future<String> nextEscrowCode(String prefix, SqlConnection connection) {
        return connection.query("SELECT nextval('escrow_code_seq') AS seq").execute()
                .map(result -> {
                    long seq = result.iterator().next().getLong(0);
                    return prefix + seq;
                })
                .onFailure(error -> log.error("Failed to allocate escrow code: {}", error.getMessage()));
    }

    @Override
    public Future<Void> insert(Escrow escrow, SqlConnection connection) {
        String sql = "INSERT INTO escrows (" +
                "id, escrow_code, chat_id, buyer_id, seller_id, deal_title, description, " +
                "amount, fee_amount, delivery_deadline, refund_conditions, dispute_agreement, " +
                "state, created_at, updated_at" +
                ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        Tuple params = Tuple.of(
                escrow.getId(),
                escrow.getEscrowCode(),
                escrow.getChatId(),
                escrow.getBuyerId(),
                escrow.getSellerId(),
                escrow.getDealTitle(),
                escrow.getDescription(),
                escrow.getAmount(),
                escrow.getFeeAmount(),
                escrow.getDeliveryDeadline(),
                escrow.getRefundConditions(),
                escrow.getDisputeAgreement(),
                escrow.getState().getValue(),
                escrow.getCreatedAt(),
                escrow.getUpdatedAt()
        );

        return connection.preparedQuery(sql)
                .execute(params)
                .onSuccess(result -> log.debug("Inserted escrow {}", escrow.getEscrowCode()))
                .onFailure(error -> log.error("Failed to insert escrow {}: {}", escrow.getEscrowCode(), error.getMessage()))
                .mapEmpty();
    }

    @Override
    public Future<Optional<Escrow>> findByCodeForUpdate(String escrowCode, SqlConnection connection) {
        String sql = "SELECT * FROM escrows WHERE escrow_code = ? FOR UPDATE";

        return connection.preparedQuery(sql)
                .execute(Tuple.of(escrowCode))
                .map(result -> result.size() > 0
                        ? Optional.of(mapToEscrow(result.iterator().next()))
                        : Optional.<Escrow>empty());
    }

    @Override
    public Future<Optional<Escrow>> findByCode(String escrowCode) {
        String sql = "SELECT * FROM escrows WHERE escrow_code = ?";

        return sqlClient.preparedQuery(sql)
                .execute(Tuple.of(escrowCode))
                .map(result -> result.size() > 0
                        ? Optional.of(mapToEscrow(result.iterator().next()))
                        : Optional.<Escrow>empty());
    }

    @Override
    public Future<Boolean> updateState(String escrowId, EscrowState expected, EscrowState target,
                                       LocalDateTime updatedAt, SqlConnection connection) {
        String sql = "UPDATE escrows SET state = ?, updated_at = ? WHERE id = ? AND state = ?";

        Tuple params = Tuple.of(target.getValue(), updatedAt, escrowId, expected.getValue());

        return connection.preparedQuery(sql)
                .execute(params)
                .map(result -> result.rowCount() == 1)
                .onFailure(error -> log.error("Failed to update state of escrow {}: {}", escrowId, error.getMessage()));
    }

    private Escrow mapToEscrow(Row row) {
        Escrow escrow = new Escrow();
        escrow.setId(row.getString("id"));
        escrow.setEscrowCode(row.getString("escrow_code"));
        escrow.setChatId(row.getString("chat_id"));
        escrow.setBuyerId(row.getString("buyer_id"));
        escrow.setSellerId(row.getString("seller_id"));
        escrow.setDealTitle(row.getString("deal_title"));
        escrow.setDescription(row.getString("description"));
        escrow.setAmount(row.getBigDecimal("amount"));
        escrow.setFeeAmount(row.getBigDecimal("fee_amount"));
        escrow.setDeliveryDeadline(row.getLocalDateTime("delivery_deadline"));
        escrow.setRefundConditions(row.getString("refund_conditions"));
        escrow.setDisputeAgreement(row.getBoolean("dispute_agreement"));
        escrow.setState(EscrowState.fromValue(row.getString("state")));
        escrow.setCreatedAt(row.getLocalDateTime("created_at"));
        escrow.setUpdatedAt(row.getLocalDateTime("updated_at"));
        return escrow;
    }
}
