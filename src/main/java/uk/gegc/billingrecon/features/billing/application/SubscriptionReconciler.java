package uk.gegc.billingrecon.features.billing.application;

import uk.gegc.billingrecon.features.billing.domain.model.VerifiedCharge;

/**
 * Folds verified provider events into subscription, payment and entitlement state.
 * Every operation is safe to repeat with the same input.
 */
public interface SubscriptionReconciler {

    /**
     * Recurring plan charges upsert an active subscription, trial charges upsert a trialing one
     * keyed {@code trial_<reference>}, anything else is recorded as a payment only.
     */
    ReconciliationResult reconcileSuccessfulCharge(VerifiedCharge charge);

    /**
     * Moves the subscription to canceled and recomputes the owner's entitlement.
     *
     * @throws uk.gegc.billingrecon.features.billing.domain.exception.SubscriptionNotFoundException
     *         if no subscription has this code
     */
    void cancel(String subscriptionCode);

    /**
     * Flags the subscription to end at the current period end. Status is unchanged.
     */
    void markNonRenewing(String subscriptionCode);

    /**
     * Moves a non-canceled subscription to past_due. Entitlement is kept.
     */
    void markPastDue(String subscriptionCode);
}
