package uk.gegc.billingrecon.features.billing.domain.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import uk.gegc.billingrecon.features.billing.domain.exception.BillingValidationException;
import uk.gegc.billingrecon.features.billing.domain.model.BillingInterval;
import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;

import java.util.Optional;
import java.util.UUID;

/**
 * Reconciliation metadata staged by the checkout session issuer and echoed back by the
 * provider on the charge. It is the only record of who bought what.
 */
public record ChargeMetadata(
        String userId,
        String planId,
        String billingInterval,
        String currency,
        String userEmail
) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static ChargeMetadata empty() {
        return new ChargeMetadata(null, null, null, null, null);
    }

    /**
     * Reads metadata from a provider payload node. Some providers send the metadata object
     * as a JSON-encoded string, so textual nodes are parsed as well.
     */
    public static ChargeMetadata from(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return empty();
        }
        JsonNode source = node;
        if (node.isTextual()) {
            String text = node.asText().trim();
            if (text.isEmpty()) {
                return empty();
            }
            try {
                source = MAPPER.readTree(text);
            } catch (JsonProcessingException e) {
                throw new BillingValidationException("Unparseable metadata", e);
            }
        }
        if (!source.isObject()) {
            return empty();
        }
        return new ChargeMetadata(
                text(source, "userId", "user_id"),
                text(source, "planId", "plan"),
                text(source, "billingInterval", "billing_interval"),
                text(source, "currency"),
                text(source, "userEmail", "user_email")
        );
    }

    /**
     * Field-wise fallback: values present here win, missing ones are taken from {@code other}.
     */
    public ChargeMetadata orElse(ChargeMetadata other) {
        if (other == null) {
            return this;
        }
        return new ChargeMetadata(
                userId != null ? userId : other.userId,
                planId != null ? planId : other.planId,
                billingInterval != null ? billingInterval : other.billingInterval,
                currency != null ? currency : other.currency,
                userEmail != null ? userEmail : other.userEmail
        );
    }

    public boolean hasPurchaseIdentity() {
        return userId != null && planId != null;
    }

    public UUID requireUserId() {
        if (userId == null) {
            throw new BillingValidationException("Missing userId or planId in metadata");
        }
        try {
            return UUID.fromString(userId);
        } catch (IllegalArgumentException e) {
            throw new BillingValidationException("Metadata userId is not a valid user id: " + userId);
        }
    }

    public PlanTier requirePlan() {
        if (planId == null) {
            throw new BillingValidationException("Missing userId or planId in metadata");
        }
        return PlanTier.paidFromCode(planId)
                .orElseThrow(() -> new BillingValidationException("Invalid planId in metadata: " + planId));
    }

    public BillingInterval interval() {
        return BillingInterval.normalize(billingInterval);
    }

    public Optional<String> currencyCode() {
        return Optional.ofNullable(currency);
    }

    private static String text(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                String text = value.asText().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }
}
