package uk.gegc.billingrecon.features.billing.application;

import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;

/**
 * @param subscriptionCode code of the upserted row, {@code null} for one-off charges
 * @param entitlementGranted whether the user's tier was set to {@code plan}
 */
public record ReconciliationResult(Flow flow, String subscriptionCode, PlanTier plan, boolean entitlementGranted) {

    public enum Flow {
        SUBSCRIPTION,
        PAID_TRIAL,
        ONE_OFF
    }
}
