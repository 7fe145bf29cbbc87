package uk.gegc.billingrecon.features.billing.domain.model;

public enum SubscriptionStatus {
    TRIALING,
    ACTIVE,
    PAST_DUE,
    CANCELED;

    /**
     * Whether a subscription in this status grants its plan to the user.
     */
    public boolean isLive() {
        return this == TRIALING || this == ACTIVE;
    }
}
