package com.pwescrow.config;

import io.vertx.core.json.JsonObject;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;

/**
 * Process-wide business settings, read once from application.yml and passed explicitly to services
 */
@Value
@Builder
public class EscrowSettings {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    BigDecimal feePercent;
    String upiId;
    String payeeName;
    String logGroupId;
    String codePrefix;
    int defaultDeliveryHours;
    Duration actionTokenTtl;

    public static EscrowSettings fromConfig(JsonObject config) {
        JsonObject bot = config.getJsonObject("bot", new JsonObject());
        JsonObject security = config.getJsonObject("security", new JsonObject());

        Object feeValue = bot.getValue("fee_percent", 6);
        return EscrowSettings.builder()
                .feePercent(new BigDecimal(String.valueOf(feeValue)))
                .upiId(bot.getString("upi_id", "pwescrow@upi"))
                .payeeName(bot.getString("payee_name", "PW Escrow"))
                .logGroupId(bot.getValue("log_group_id") == null ? null : String.valueOf(bot.getValue("log_group_id")))
                .codePrefix(bot.getString("escrow_code_prefix", "PW-"))
                .defaultDeliveryHours(bot.getInteger("default_delivery_hours", 24))
                .actionTokenTtl(Duration.ofSeconds(security.getLong("action_token_ttl_seconds", 900L)))
                .build();
    }

    /**
     * Fee for the given amount, rounded half-up to two decimals
     */
    public BigDecimal feeFor(BigDecimal amount) {
        return amount.multiply(feePercent).divide(HUNDRED, 2, RoundingMode.HALF_UP);
    }
}
