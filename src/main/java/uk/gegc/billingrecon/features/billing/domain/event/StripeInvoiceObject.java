package uk.gegc.billingrecon.features.billing.domain.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StripeInvoiceObject(String id, JsonNode subscription, JsonNode parent) {

    /**
     * Older API versions put the subscription on the invoice itself, newer ones under
     * {@code parent.subscription_details}.
     */
    public String subscriptionId() {
        String direct = JsonIds.idOf(subscription);
        return direct != null ? direct : JsonIds.textAt(parent, "/subscription_details/subscription");
    }
}
