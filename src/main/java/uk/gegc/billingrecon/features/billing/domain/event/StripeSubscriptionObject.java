package uk.gegc.billingrecon.features.billing.domain.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StripeSubscriptionObject(
        String id,
        String status,
        @JsonProperty("cancel_at_period_end") boolean cancelAtPeriodEnd
) {

    public boolean isDelinquent() {
        return "past_due".equalsIgnoreCase(status) || "unpaid".equalsIgnoreCase(status);
    }
}
