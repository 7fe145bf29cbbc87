package uk.gegc.billingrecon.features.billing.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.billingrecon.features.billing.domain.exception.BillingValidationException;

import java.io.IOException;

/**
 * Reads provider payloads into typed schemas; anything unparseable is a validation failure.
 */
@Component
@RequiredArgsConstructor
public class WebhookPayloadReader {

    private final ObjectMapper objectMapper;

    public <T> T read(byte[] body, Class<T> type) {
        try {
            T value = objectMapper.readValue(body, type);
            if (value == null) {
                throw new BillingValidationException("Empty webhook payload");
            }
            return value;
        } catch (IOException e) {
            throw new BillingValidationException("Unparseable webhook payload", e);
        }
    }

    public <T> T convert(JsonNode node, Class<T> type) {
        if (node == null || node.isNull() || node.isMissingNode() || !node.isObject()) {
            throw new BillingValidationException("Webhook payload is missing its data object");
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new BillingValidationException("Unparseable webhook data object", e);
        }
    }
}
