package uk.gegc.billingrecon.features.billing.domain.event;

import java.util.Arrays;
import java.util.List;

public enum PaystackEventType {
    CHARGE_SUCCESS("charge.success"),
    SUBSCRIPTION_CREATE("subscription.create"),
    SUBSCRIPTION_DISABLE("subscription.disable"),
    SUBSCRIPTION_NOT_RENEW("subscription.not_renew"),
    // older integrations were registered for invoice.failed
    INVOICE_FAILED("invoice.payment_failed", "invoice.failed"),
    CHARGE_FAILED("charge.failed"),
    UNKNOWN();

    private final List<String> wireNames;

    PaystackEventType(String... wireNames) {
        this.wireNames = List.of(wireNames);
    }

    public static PaystackEventType from(String event) {
        if (event == null) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
                .filter(value -> value.wireNames.contains(event))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
