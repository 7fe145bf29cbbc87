package uk.gegc.billingrecon.features.billing.domain.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StripeEventEnvelope(String id, String type, Data data) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(JsonNode object) {
    }

    public JsonNode object() {
        return data != null ? data.object() : null;
    }
}
