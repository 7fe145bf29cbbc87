package uk.gegc.billingrecon.features.billing.domain.event;

import java.util.Arrays;

public enum StripeEventType {
    CHECKOUT_SESSION_COMPLETED("checkout.session.completed"),
    SUBSCRIPTION_CREATED("customer.subscription.created"),
    SUBSCRIPTION_UPDATED("customer.subscription.updated"),
    SUBSCRIPTION_DELETED("customer.subscription.deleted"),
    INVOICE_PAYMENT_FAILED("invoice.payment_failed"),
    UNKNOWN("");

    private final String wireName;

    StripeEventType(String wireName) {
        this.wireName = wireName;
    }

    public static StripeEventType from(String type) {
        return Arrays.stream(values())
                .filter(value -> value != UNKNOWN && value.wireName.equals(type))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
