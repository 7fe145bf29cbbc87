package uk.gegc.billingrecon.features.billing.domain.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * {@code data} of Paystack charge and invoice events, and of the transaction verify API.
 * Paystack sends {@code "plan": {}} for charges that are not tied to a plan.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PaystackCharge(
        String id,
        String reference,
        String status,
        Long amount,
        String currency,
        JsonNode metadata,
        Plan plan,
        Customer customer,
        Authorization authorization,
        SubscriptionRef subscription,
        @JsonProperty("subscription_code") String subscriptionCode
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Plan(
            @JsonProperty("plan_code") String planCode,
            @JsonProperty("subscription_code") String subscriptionCode
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Customer(@JsonProperty("customer_code") String customerCode, String email) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Authorization(@JsonProperty("authorization_code") String authorizationCode) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SubscriptionRef(@JsonProperty("subscription_code") String subscriptionCode) {
    }

    public String planCode() {
        return plan != null ? blankToNull(plan.planCode()) : null;
    }

    /**
     * Explicit subscription code from whichever field Paystack populated.
     */
    public String explicitSubscriptionCode() {
        if (plan != null && blankToNull(plan.subscriptionCode()) != null) {
            return plan.subscriptionCode().trim();
        }
        if (subscription != null && blankToNull(subscription.subscriptionCode()) != null) {
            return subscription.subscriptionCode().trim();
        }
        return blankToNull(subscriptionCode);
    }

    public String customerCode() {
        return customer != null ? blankToNull(customer.customerCode()) : null;
    }

    public String authorizationCode() {
        return authorization != null ? blankToNull(authorization.authorizationCode()) : null;
    }

    public boolean isSuccessful() {
        return "success".equalsIgnoreCase(status);
    }

    /**
     * Paystack amounts are in the minor unit.
     */
    public BigDecimal majorAmount() {
        return amount == null ? BigDecimal.ZERO : BigDecimal.valueOf(amount).movePointLeft(2);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
