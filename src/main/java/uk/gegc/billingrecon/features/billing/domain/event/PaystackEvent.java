package uk.gegc.billingrecon.features.billing.domain.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PaystackEvent(String event, JsonNode data) {
}
