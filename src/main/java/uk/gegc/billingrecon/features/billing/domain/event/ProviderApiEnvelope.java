package uk.gegc.billingrecon.features.billing.domain.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Response wrapper shared by the Paystack and Flutterwave REST APIs. Paystack reports
 * {@code status} as a boolean, Flutterwave as the string {@code "success"}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderApiEnvelope<T>(JsonNode status, String message, T data) {

    public boolean isOk() {
        if (status == null || status.isNull()) {
            return false;
        }
        if (status.isBoolean()) {
            return status.booleanValue();
        }
        return "success".equalsIgnoreCase(status.asText());
    }
}
