package uk.gegc.billingrecon.features.billing.application;

import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;
import uk.gegc.billingrecon.features.billing.domain.model.Subscription;
import uk.gegc.billingrecon.features.billing.domain.model.SubscriptionStatus;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Subscription persistence, expressed as single conditional writes keyed by the provider
 * subscription code.
 */
public interface SubscriptionStore {

    /**
     * Insert-or-update keyed by {@link SubscriptionUpsert#subscriptionCode()}. An existing row
     * that is already canceled, or whose last applied charge is {@link SubscriptionUpsert#chargeReference()},
     * is left untouched, and the period end never moves backwards.
     */
    void upsertFromCharge(SubscriptionUpsert upsert);

    Optional<Subscription> findByCode(String subscriptionCode);

    /**
     * @return number of rows changed
     */
    int updateStatus(String subscriptionCode, SubscriptionStatus status, Instant now);

    /**
     * Moves a row to past_due unless it is already canceled.
     *
     * @return number of rows changed
     */
    int markPastDue(String subscriptionCode, Instant now);

    int markCancelAtPeriodEnd(String subscriptionCode, Instant now);

    /**
     * Plan of the user's most recently updated trialing or active subscription whose
     * current period ends after {@code now}.
     */
    Optional<PlanTier> findLatestLivePlan(UUID userId, Instant now);

    Optional<Subscription> findLatestForUser(UUID userId);
}
