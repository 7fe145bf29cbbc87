package uk.gegc.billingrecon.features.billing.domain.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * {@code data} of a Flutterwave charge event and of the transaction verify API.
 * Amounts are in the major unit.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlutterwaveCharge(
        String id,
        @JsonProperty("tx_ref") String txRef,
        @JsonProperty("flw_ref") String flwRef,
        String status,
        BigDecimal amount,
        String currency,
        @JsonProperty("payment_plan") String paymentPlan,
        JsonNode meta
) {

    public boolean isSuccessful() {
        if (status == null) {
            return false;
        }
        String normalized = status.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("successful") || normalized.equals("succeeded") || normalized.equals("success");
    }

    public String paymentPlanCode() {
        return paymentPlan == null || paymentPlan.isBlank() ? null : paymentPlan.trim();
    }
}
