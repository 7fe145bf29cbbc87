package uk.gegc.billingrecon.features.billing.domain.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Flutterwave sends the event name as {@code type} in current payloads and as {@code event}
 * in older ones.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlutterwaveEvent(String id, String type, String event, JsonNode data) {

    public String eventType() {
        String value = type != null && !type.isBlank() ? type : event;
        return value == null ? "" : value.trim();
    }
}
