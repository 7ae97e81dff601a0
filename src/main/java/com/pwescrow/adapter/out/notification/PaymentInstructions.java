package com.pwescrow.adapter.out.notification;

import com.pwescrow.config.EscrowSettings;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds the UPI payment URI and caption shown once an escrow is AGREED
 */
public class PaymentInstructions {

    private final EscrowSettings settings;

    public PaymentInstructions(EscrowSettings settings) {
        this.settings = settings;
    }

    /**
     * Standard UPI deep link; the escrow code travels as the transaction note
     */
    public String upiUri(BigDecimal amount, String escrowCode) {
        return "upi://pay?pa=" + settings.getUpiId()
                + "&pn=" + encode(settings.getPayeeName())
                + "&am=" + amount.setScale(2, RoundingMode.HALF_UP).toPlainString()
                + "&tn=" + encode(escrowCode);
    }

    public String caption(BigDecimal amount, String escrowCode) {
        return "PAYMENT DETAILS - PW ESCROW\n\n"
                + "UPI ID: " + settings.getUpiId() + "\n"
                + "Amount: " + EscrowMessageFormatter.money(amount) + "\n"
                + "Escrow ID: " + escrowCode + "\n\n"
                + "Send exact amount only. Include Escrow ID in remark/note.\n"
                + upiUri(amount, escrowCode);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
