package uk.gegc.billingrecon.features.billing.domain.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StripeCheckoutSession(
        String id,
        String mode,
        JsonNode subscription,
        JsonNode customer,
        @JsonProperty("payment_intent") JsonNode paymentIntent,
        @JsonProperty("payment_status") String paymentStatus,
        @JsonProperty("amount_total") Long amountTotal,
        String currency,
        JsonNode metadata
) {

    public String subscriptionId() {
        return JsonIds.idOf(subscription);
    }

    public String customerId() {
        return JsonIds.idOf(customer);
    }

    /**
     * The payment intent id when Stripe created one, otherwise the session id.
     */
    public String paymentReference() {
        String intent = JsonIds.idOf(paymentIntent);
        return intent != null ? intent : id;
    }

    public boolean isPaid() {
        return paymentStatus == null
                || "paid".equalsIgnoreCase(paymentStatus)
                || "no_payment_required".equalsIgnoreCase(paymentStatus);
    }

    public BigDecimal amount() {
        return amountTotal == null ? BigDecimal.ZERO : BigDecimal.valueOf(amountTotal).movePointLeft(2);
    }
}
