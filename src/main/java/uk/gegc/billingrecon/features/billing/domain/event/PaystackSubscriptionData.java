package uk.gegc.billingrecon.features.billing.domain.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PaystackSubscriptionData(
        @JsonProperty("subscription_code") String subscriptionCode,
        String status
) {
}
